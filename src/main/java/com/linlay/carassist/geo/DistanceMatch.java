package com.linlay.carassist.geo;

public record DistanceMatch(String address, double distanceMeters, String durationText) {
}
