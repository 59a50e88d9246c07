package com.linlay.carassist.geo;

import com.linlay.carassist.config.GeoProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ClosestAuctionFinderTest {

    private static final String DALLAS = "100 Auction Way, Dallas, TX, 75001";
    private static final String TULSA = "200 Auction Rd, Tulsa, OK, 74101";
    private static final String RIVERSIDE = "300 Auction Blvd, Riverside, CA, 92501";
    private static final double METERS_PER_MILE = 1609.344;

    @TempDir
    Path csvDir;

    private final DistanceMatrixClient distanceMatrixClient = mock(DistanceMatrixClient.class);
    private ClosestAuctionFinder finder;

    @BeforeEach
    void setUp() throws IOException {
        writeCsv("TX", "100 Auction Way", "Dallas", "TX", "75001");
        writeCsv("OK", "200 Auction Rd", "Tulsa", "OK", "74101");
        writeCsv("CA", "300 Auction Blvd", "Riverside", "CA", "92501");
        GeoProperties properties = new GeoProperties();
        properties.setCsvDir(csvDir.toString());
        properties.setMaxMiles(100.0);
        finder = new ClosestAuctionFinder(new AuctionLocationCatalog(properties), distanceMatrixClient, properties);
    }

    private void writeCsv(String state, String street, String city, String stateCode, String zip) throws IOException {
        Files.writeString(csvDir.resolve(state + ".csv"),
                "address_street,city,state,zip\n" + street + "," + city + "," + stateCode + "," + zip + "\n");
    }

    private void distance(String destination, double miles) {
        when(distanceMatrixClient.closest(anyString(), eq(List.of(destination))))
                .thenReturn(Optional.of(new DistanceMatch(destination, miles * METERS_PER_MILE, "1 hour")));
    }

    @Test
    void nearbyInStateLocationShouldWin() {
        distance(DALLAS, 30);
        distance(TULSA, 80);

        ClosestAuction auction = finder.find("12 Elm St, Plano", "tx").orElseThrow();

        assertThat(auction.address()).isEqualTo(DALLAS);
        assertThat(auction.layer()).isEqualTo(SearchLayer.IN_STATE);
        assertThat(auction.distanceMiles()).isEqualTo(30.0);
        assertThat(auction.thresholdExceeded()).isFalse();
        assertThat(auction.neighborsChecked()).containsExactly("OK");
    }

    @Test
    void closerNeighborShouldWinWhenInStateIsFar() {
        distance(DALLAS, 150);
        distance(TULSA, 90);

        ClosestAuction auction = finder.find("1 Main St, Texarkana", "TX").orElseThrow();

        assertThat(auction.layer()).isEqualTo(SearchLayer.NEIGHBOR);
        assertThat(auction.state()).isEqualTo("OK");
    }

    @Test
    void nationalSearchShouldFlagExceededThreshold() {
        distance(DALLAS, 400);
        distance(TULSA, 420);
        distance(RIVERSIDE, 120);

        ClosestAuction auction = finder.find("1 Desert Rd, El Paso", "TX").orElseThrow();

        assertThat(auction.layer()).isEqualTo(SearchLayer.NATIONAL);
        assertThat(auction.address()).isEqualTo(RIVERSIDE);
        assertThat(auction.thresholdExceeded()).isTrue();
        Map<String, Object> map = auction.toMap();
        assertThat(map).containsEntry("layer", "national").containsEntry("distance_miles", 120.0);
    }

    @Test
    void noDistancesShouldFindNothing() {
        assertThat(finder.find("nowhere", "TX")).isEmpty();
    }

    @Test
    void milesShouldRoundToTwoPlaces() {
        assertThat(ClosestAuctionFinder.toMiles(10_000)).isEqualTo(6.21);
    }
}
