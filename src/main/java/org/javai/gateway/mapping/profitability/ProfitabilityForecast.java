package org.javai.gateway.mapping.profitability;

public record ProfitabilityForecast(double nextMonth, double nextQuarter, double nextYear, double confidence) {
}
