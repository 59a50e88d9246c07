package com.linlay.carassist.geo;

import com.linlay.carassist.config.GeoProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuctionLocationCatalogTest {

    @TempDir
    Path csvDir;

    @Test
    void addressesShouldBeCappedAndJoined() throws IOException {
        StringBuilder csv = new StringBuilder("address_street,city,state,zip\n");
        for (int i = 1; i <= 4; i++) {
            csv.append(i).append(" Lot Rd,Austin,TX,7870").append(i).append('\n');
        }
        Files.writeString(csvDir.resolve("TX.csv"), csv.toString());
        Files.writeString(csvDir.resolve("notes.txt"), "ignored");
        GeoProperties properties = new GeoProperties();
        properties.setCsvDir(csvDir.toString());
        properties.setAddressesPerState(3);
        AuctionLocationCatalog catalog = new AuctionLocationCatalog(properties);

        assertThat(catalog.availableStates()).containsExactly("TX");
        assertThat(catalog.addresses("tx")).containsExactly(
                "1 Lot Rd, Austin, TX, 78701",
                "2 Lot Rd, Austin, TX, 78702",
                "3 Lot Rd, Austin, TX, 78703"
        );
        assertThat(catalog.addresses("NV")).isEmpty();
        assertThat(catalog.neighbors(" tx ")).containsExactly("NM", "OK", "AR", "LA");
    }

    @Test
    void blankAndNanPartsShouldBeSkipped() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("address_street", "9 Gate St");
        row.put("city", "nan");
        row.put("state", "NV");
        row.put("zip", " ");

        assertThat(AuctionLocationCatalog.joinAddress(row)).isEqualTo("9 Gate St, NV");
    }
}
