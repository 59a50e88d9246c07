package com.linlay.carassist.geo;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.linlay.carassist.config.GeoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

@Component
public class AuctionLocationCatalog {

    private static final Logger log = LoggerFactory.getLogger(AuctionLocationCatalog.class);

    private static final Map<String, List<String>> NEIGHBORS = Map.ofEntries(
            Map.entry("AL", List.of("TN", "GA", "FL", "MS")),
            Map.entry("AK", List.of()),
            Map.entry("AZ", List.of("CA", "NV", "UT", "CO", "NM")),
            Map.entry("AR", List.of("MO", "TN", "MS", "LA", "TX", "OK")),
            Map.entry("CA", List.of("OR", "NV", "AZ")),
            Map.entry("CO", List.of("WY", "NE", "KS", "OK", "NM", "AZ", "UT")),
            Map.entry("CT", List.of("NY", "MA", "RI")),
            Map.entry("DE", List.of("MD", "PA", "NJ")),
            Map.entry("FL", List.of("AL", "GA")),
            Map.entry("GA", List.of("FL", "AL", "TN", "NC", "SC")),
            Map.entry("HI", List.of()),
            Map.entry("ID", List.of("WA", "MT", "WY", "UT", "NV", "OR")),
            Map.entry("IL", List.of("WI", "IA", "MO", "KY", "IN")),
            Map.entry("IN", List.of("MI", "OH", "KY", "IL")),
            Map.entry("IA", List.of("MN", "SD", "NE", "MO", "IL", "WI")),
            Map.entry("KS", List.of("NE", "MO", "OK", "CO")),
            Map.entry("KY", List.of("IL", "IN", "OH", "WV", "VA", "TN", "MO")),
            Map.entry("LA", List.of("TX", "AR", "MS")),
            Map.entry("ME", List.of("NH")),
            Map.entry("MD", List.of("VA", "WV", "PA", "DE")),
            Map.entry("MA", List.of("NY", "VT", "NH", "CT", "RI")),
            Map.entry("MI", List.of("OH", "IN", "WI")),
            Map.entry("MN", List.of("ND", "SD", "IA", "WI")),
            Map.entry("MS", List.of("TN", "AL", "LA", "AR")),
            Map.entry("MO", List.of("IA", "IL", "KY", "TN", "AR", "OK", "KS", "NE")),
            Map.entry("MT", List.of("ND", "SD", "WY", "ID")),
            Map.entry("NE", List.of("SD", "IA", "MO", "KS", "CO", "WY")),
            Map.entry("NV", List.of("OR", "ID", "UT", "AZ", "CA")),
            Map.entry("NH", List.of("ME", "VT", "MA")),
            Map.entry("NJ", List.of("NY", "PA", "DE")),
            Map.entry("NM", List.of("AZ", "UT", "CO", "OK", "TX")),
            Map.entry("NY", List.of("PA", "NJ", "CT", "MA", "VT")),
            Map.entry("NC", List.of("VA", "TN", "GA", "SC")),
            Map.entry("ND", List.of("MT", "SD", "MN")),
            Map.entry("OH", List.of("MI", "PA", "WV", "KY", "IN")),
            Map.entry("OK", List.of("CO", "KS", "MO", "AR", "TX", "NM")),
            Map.entry("OR", List.of("WA", "ID", "NV", "CA")),
            Map.entry("PA", List.of("NY", "NJ", "DE", "MD", "WV", "OH")),
            Map.entry("RI", List.of("CT", "MA")),
            Map.entry("SC", List.of("NC", "GA")),
            Map.entry("SD", List.of("ND", "MT", "WY", "NE", "IA", "MN")),
            Map.entry("TN", List.of("KY", "VA", "NC", "GA", "AL", "MS", "AR", "MO")),
            Map.entry("TX", List.of("NM", "OK", "AR", "LA")),
            Map.entry("UT", List.of("ID", "WY", "CO", "NM", "AZ", "NV")),
            Map.entry("VT", List.of("NY", "NH", "MA")),
            Map.entry("VA", List.of("NC", "TN", "KY", "WV", "MD")),
            Map.entry("WA", List.of("OR", "ID")),
            Map.entry("WV", List.of("OH", "PA", "MD", "VA", "KY")),
            Map.entry("WI", List.of("MN", "IA", "IL", "MI")),
            Map.entry("WY", List.of("MT", "SD", "NE", "CO", "UT", "ID")),
            Map.entry("PR", List.of())
    );

    private static final List<String> ADDRESS_COLUMNS = List.of("address_street", "city", "state", "zip");

    private final GeoProperties properties;
    private final CsvMapper csvMapper = new CsvMapper();

    public AuctionLocationCatalog(GeoProperties properties) {
        this.properties = properties;
    }

    public List<String> availableStates() {
        Path dir = directory();
        if (!Files.isDirectory(dir)) {
            log.warn("Auction CSV directory {} does not exist", dir);
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .map(name -> name.substring(0, name.length() - 4))
                    .filter(stem -> stem.length() == 2)
                    .map(stem -> stem.toUpperCase(Locale.ROOT))
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            log.warn("Cannot list auction CSV directory {}", dir, ex);
            return List.of();
        }
    }

    public List<String> neighbors(String state) {
        return NEIGHBORS.getOrDefault(normalizeState(state), List.of());
    }

    public Path csvPath(String state) {
        return directory().resolve(normalizeState(state) + ".csv");
    }

    public List<String> addresses(String state) {
        Path csv = csvPath(state);
        if (!Files.isRegularFile(csv)) {
            return List.of();
        }
        int limit = Math.max(1, properties.getAddressesPerState());
        List<String> addresses = new ArrayList<>();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (Reader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> rows = csvMapper.readerFor(Map.class).with(schema).readValues(reader)) {
            while (rows.hasNext() && addresses.size() < limit) {
                String address = joinAddress(rows.next());
                if (!address.isEmpty()) {
                    addresses.add(address);
                }
            }
        } catch (IOException | RuntimeException ex) {
            log.warn("Cannot read auction CSV {}", csv, ex);
        }
        return addresses;
    }

    static String joinAddress(Map<String, String> row) {
        List<String> parts = new ArrayList<>();
        for (String column : ADDRESS_COLUMNS) {
            String value = row.get(column);
            if (StringUtils.hasText(value) && !"nan".equalsIgnoreCase(value.trim())) {
                parts.add(value.trim());
            }
        }
        return String.join(", ", parts);
    }

    static String normalizeState(String state) {
        return state == null ? "" : state.trim().toUpperCase(Locale.ROOT);
    }

    private Path directory() {
        return Path.of(properties.getCsvDir());
    }
}
