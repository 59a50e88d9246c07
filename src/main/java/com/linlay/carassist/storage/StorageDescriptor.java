package com.linlay.carassist.storage;

import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

public record StorageDescriptor(
        Flavor flavor,
        String jdbcUrl,
        String username,
        String password
) {

    public enum Flavor {
        SQLITE,
        POSTGRES
    }

    public static StorageDescriptor parse(String descriptor) {
        if (!StringUtils.hasText(descriptor)) {
            throw new IllegalArgumentException("storage descriptor is required");
        }
        String trimmed = descriptor.trim();
        if (isPostgres(trimmed)) {
            return parsePostgres(trimmed);
        }
        if (trimmed.startsWith("jdbc:")) {
            return new StorageDescriptor(Flavor.SQLITE, trimmed, null, null);
        }
        return new StorageDescriptor(Flavor.SQLITE, "jdbc:sqlite:" + trimmed, null, null);
    }

    public static boolean isPostgres(String descriptor) {
        return descriptor != null
                && (descriptor.startsWith("postgresql://") || descriptor.startsWith("postgres://"));
    }

    private static StorageDescriptor parsePostgres(String descriptor) {
        URI uri = URI.create(descriptor);
        String username = null;
        String password = null;
        String userInfo = uri.getRawUserInfo();
        if (StringUtils.hasText(userInfo)) {
            int split = userInfo.indexOf(':');
            username = decode(split < 0 ? userInfo : userInfo.substring(0, split));
            password = split < 0 ? null : decode(userInfo.substring(split + 1));
        }
        StringBuilder url = new StringBuilder("jdbc:postgresql://").append(uri.getHost());
        if (uri.getPort() > 0) {
            url.append(':').append(uri.getPort());
        }
        url.append(uri.getRawPath() == null ? "" : uri.getRawPath());
        // text parameters bound to timestamp columns need server-side inference
        String query = uri.getRawQuery();
        url.append('?').append(StringUtils.hasText(query) ? query + "&" : "").append("stringtype=unspecified");
        return new StorageDescriptor(Flavor.POSTGRES, url.toString(), username, password);
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "StorageDescriptor[flavor=" + flavor + ", jdbcUrl=" + jdbcUrl + "]";
    }
}
