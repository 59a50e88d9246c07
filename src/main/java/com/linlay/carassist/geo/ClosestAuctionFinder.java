package com.linlay.carassist.geo;

import com.linlay.carassist.config.GeoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Nearest auction drop-off for an address. The user's state and its neighbors are searched
 * first; a match within {@code assistant.geo.max-miles} among them wins, otherwise the nearest
 * location anywhere is returned with {@code threshold_exceeded} set accordingly.
 */
@Component
public class ClosestAuctionFinder {

    private static final Logger log = LoggerFactory.getLogger(ClosestAuctionFinder.class);

    static final double METERS_PER_MILE = 1609.344;

    private final AuctionLocationCatalog catalog;
    private final DistanceMatrixClient distanceMatrixClient;
    private final GeoProperties properties;

    public ClosestAuctionFinder(
            AuctionLocationCatalog catalog,
            DistanceMatrixClient distanceMatrixClient,
            GeoProperties properties
    ) {
        this.catalog = catalog;
        this.distanceMatrixClient = distanceMatrixClient;
        this.properties = properties;
    }

    public Optional<ClosestAuction> find(String userAddress, String rawState) {
        String state = AuctionLocationCatalog.normalizeState(rawState);
        double maxMiles = properties.getMaxMiles();
        List<String> available = catalog.availableStates();

        ClosestAuction inState = available.contains(state) ? bestInState(userAddress, state) : null;
        List<String> neighbors = catalog.neighbors(state).stream().filter(available::contains).toList();
        ClosestAuction neighbor = neighbors.isEmpty() ? null : bestAmong(userAddress, neighbors);

        ClosestAuction nearby = closer(within(inState, maxMiles), within(neighbor, maxMiles));
        if (nearby != null) {
            SearchLayer layer = nearby == neighbor ? SearchLayer.NEIGHBOR : SearchLayer.IN_STATE;
            log.debug("Closest auction for state {} found in layer {}", state, layer);
            return Optional.of(nearby.withLayer(layer, neighbors, false));
        }

        Set<String> excluded = new LinkedHashSet<>(neighbors);
        excluded.add(state);
        List<String> remaining = new ArrayList<>();
        for (String candidate : available) {
            if (!excluded.contains(candidate)) {
                remaining.add(candidate);
            }
        }
        ClosestAuction national = remaining.isEmpty() ? null : bestAmong(userAddress, remaining);

        ClosestAuction best = closer(closer(inState, neighbor), national);
        if (best == null) {
            return Optional.empty();
        }
        SearchLayer layer = best == national ? SearchLayer.NATIONAL
                : best == neighbor ? SearchLayer.NEIGHBOR : SearchLayer.IN_STATE;
        return Optional.of(best.withLayer(layer, neighbors, best.distanceMiles() > maxMiles));
    }

    private ClosestAuction bestInState(String userAddress, String state) {
        List<String> destinations = catalog.addresses(state);
        if (destinations.isEmpty()) {
            return null;
        }
        String origin = userAddress;
        if (!state.isEmpty() && !userAddress.toUpperCase(Locale.ROOT).contains(state)) {
            origin = userAddress + ", " + state;
        }
        return distanceMatrixClient.closest(origin, destinations)
                .map(match -> new ClosestAuction(
                        match.address(),
                        state,
                        catalog.csvPath(state).toString(),
                        toMiles(match.distanceMeters()),
                        match.durationText(),
                        null,
                        List.of(),
                        false
                ))
                .orElse(null);
    }

    private ClosestAuction bestAmong(String userAddress, List<String> states) {
        ClosestAuction overall = null;
        for (String state : states) {
            overall = closer(overall, bestInState(userAddress, state));
        }
        return overall;
    }

    private static ClosestAuction within(ClosestAuction candidate, double maxMiles) {
        return candidate != null && candidate.distanceMiles() <= maxMiles ? candidate : null;
    }

    private static ClosestAuction closer(ClosestAuction left, ClosestAuction right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return right.distanceMiles() < left.distanceMiles() ? right : left;
    }

    static double toMiles(double meters) {
        return BigDecimal.valueOf(meters / METERS_PER_MILE).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
