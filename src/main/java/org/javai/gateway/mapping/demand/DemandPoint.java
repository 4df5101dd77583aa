package org.javai.gateway.mapping.demand;

public record DemandPoint(String date, double value, double lowerBound, double upperBound) {
}
