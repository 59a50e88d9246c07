package com.linlay.carassist.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "assistant.geo")
public class GeoProperties {

    private String apiKey;
    private String distanceMatrixUrl = "https://maps.googleapis.com/maps/api/distancematrix/json";
    private String csvDir = "manheim_auction/by_state_csv";
    private int addressesPerState = 25;
    private double maxMiles = 100.0;
    private long timeoutMs = 20_000L;

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getDistanceMatrixUrl() {
        return distanceMatrixUrl;
    }

    public void setDistanceMatrixUrl(String distanceMatrixUrl) {
        this.distanceMatrixUrl = distanceMatrixUrl;
    }

    public String getCsvDir() {
        return csvDir;
    }

    public void setCsvDir(String csvDir) {
        this.csvDir = csvDir;
    }

    public int getAddressesPerState() {
        return addressesPerState;
    }

    public void setAddressesPerState(int addressesPerState) {
        this.addressesPerState = addressesPerState;
    }

    public double getMaxMiles() {
        return maxMiles;
    }

    public void setMaxMiles(double maxMiles) {
        this.maxMiles = maxMiles;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }
}
