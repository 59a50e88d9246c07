package com.linlay.carassist.geo;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ClosestAuction(
        String address,
        String state,
        String stateCsv,
        double distanceMiles,
        String durationText,
        SearchLayer layer,
        List<String> neighborsChecked,
        boolean thresholdExceeded
) {

    ClosestAuction withLayer(SearchLayer newLayer, List<String> neighbors, boolean exceeded) {
        return new ClosestAuction(address, state, stateCsv, distanceMiles, durationText, newLayer, neighbors, exceeded);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("address", address);
        map.put("duration_text", durationText);
        map.put("state", state);
        map.put("state_csv", stateCsv);
        map.put("distance_miles", distanceMiles);
        map.put("layer", layer == null ? null : layer.value());
        map.put("neighbors_checked", neighborsChecked);
        map.put("threshold_exceeded", thresholdExceeded);
        return map;
    }
}
