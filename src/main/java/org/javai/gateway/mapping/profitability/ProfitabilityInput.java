package org.javai.gateway.mapping.profitability;

import java.util.List;

/**
 * Financial and operational profile of a client. Only {@code clientId} is required.
 */
public record ProfitabilityInput(
        String clientId,
        Double monthlyRevenue,
        Double totalCosts,
        Double profitMargin,
        Double revenueGrowth,
        Integer ticketCount,
        Double avgResolutionTime,
        Double slaCompliance,
        Double clientSatisfaction,
        Double serviceUtilization,
        String clientSize,
        String industry,
        Integer contractLength,
        String serviceTier,
        Integer monthsActive,
        List<Double> revenueHistory
) {

    public ProfitabilityInput {
        revenueHistory = revenueHistory == null ? null : List.copyOf(revenueHistory);
    }

    public static Builder builder(String clientId) {
        return new Builder(clientId);
    }

    public static final class Builder {
        private final String clientId;
        private Double monthlyRevenue;
        private Double totalCosts;
        private Double profitMargin;
        private Double revenueGrowth;
        private Integer ticketCount;
        private Double avgResolutionTime;
        private Double slaCompliance;
        private Double clientSatisfaction;
        private Double serviceUtilization;
        private String clientSize;
        private String industry;
        private Integer contractLength;
        private String serviceTier;
        private Integer monthsActive;
        private List<Double> revenueHistory;

        private Builder(String clientId) {
            this.clientId = clientId;
        }

        public Builder monthlyRevenue(double value) {
            this.monthlyRevenue = value;
            return this;
        }

        public Builder totalCosts(double value) {
            this.totalCosts = value;
            return this;
        }

        public Builder profitMargin(double value) {
            this.profitMargin = value;
            return this;
        }

        public Builder revenueGrowth(double value) {
            this.revenueGrowth = value;
            return this;
        }

        public Builder ticketCount(int value) {
            this.ticketCount = value;
            return this;
        }

        public Builder avgResolutionTime(double hours) {
            this.avgResolutionTime = hours;
            return this;
        }

        public Builder slaCompliance(double value) {
            this.slaCompliance = value;
            return this;
        }

        public Builder clientSatisfaction(double value) {
            this.clientSatisfaction = value;
            return this;
        }

        public Builder serviceUtilization(double value) {
            this.serviceUtilization = value;
            return this;
        }

        public Builder clientSize(String value) {
            this.clientSize = value;
            return this;
        }

        public Builder industry(String value) {
            this.industry = value;
            return this;
        }

        public Builder contractLength(int months) {
            this.contractLength = months;
            return this;
        }

        public Builder serviceTier(String value) {
            this.serviceTier = value;
            return this;
        }

        public Builder monthsActive(int value) {
            this.monthsActive = value;
            return this;
        }

        public Builder revenueHistory(List<Double> values) {
            this.revenueHistory = values;
            return this;
        }

        public ProfitabilityInput build() {
            return new ProfitabilityInput(clientId, monthlyRevenue, totalCosts, profitMargin, revenueGrowth,
                    ticketCount, avgResolutionTime, slaCompliance, clientSatisfaction, serviceUtilization,
                    clientSize, industry, contractLength, serviceTier, monthsActive, revenueHistory);
        }
    }
}
