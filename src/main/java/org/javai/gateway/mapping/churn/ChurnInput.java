package org.javai.gateway.mapping.churn;

/**
 * What the backend knows about a client when asking for a churn prediction. Only
 * {@code clientId} is required; every other field may be null and is then defaulted.
 */
public record ChurnInput(
        String clientId,
        Double engagementScore,
        Double communicationFrequency,
        Integer ticketCount,
        Double featureAdoptionRate,
        String paymentHistory,
        Integer paymentDelays,
        Double contractValue,
        String revenueTrend,
        Double serviceUtilization,
        Double slaCompliance,
        Double escalationRate,
        Integer relationshipDuration,
        Double stakeholderSatisfaction,
        Double competitivePressure
) {

    public static Builder builder(String clientId) {
        return new Builder(clientId);
    }

    public static final class Builder {
        private final String clientId;
        private Double engagementScore;
        private Double communicationFrequency;
        private Integer ticketCount;
        private Double featureAdoptionRate;
        private String paymentHistory;
        private Integer paymentDelays;
        private Double contractValue;
        private String revenueTrend;
        private Double serviceUtilization;
        private Double slaCompliance;
        private Double escalationRate;
        private Integer relationshipDuration;
        private Double stakeholderSatisfaction;
        private Double competitivePressure;

        private Builder(String clientId) {
            this.clientId = clientId;
        }

        public Builder engagementScore(double value) {
            this.engagementScore = value;
            return this;
        }

        public Builder communicationFrequency(double value) {
            this.communicationFrequency = value;
            return this;
        }

        public Builder ticketCount(int value) {
            this.ticketCount = value;
            return this;
        }

        public Builder featureAdoptionRate(double value) {
            this.featureAdoptionRate = value;
            return this;
        }

        public Builder paymentHistory(String value) {
            this.paymentHistory = value;
            return this;
        }

        public Builder paymentDelays(int value) {
            this.paymentDelays = value;
            return this;
        }

        public Builder contractValue(double value) {
            this.contractValue = value;
            return this;
        }

        public Builder revenueTrend(String value) {
            this.revenueTrend = value;
            return this;
        }

        public Builder serviceUtilization(double value) {
            this.serviceUtilization = value;
            return this;
        }

        public Builder slaCompliance(double value) {
            this.slaCompliance = value;
            return this;
        }

        public Builder escalationRate(double value) {
            this.escalationRate = value;
            return this;
        }

        public Builder relationshipDuration(int months) {
            this.relationshipDuration = months;
            return this;
        }

        public Builder stakeholderSatisfaction(double value) {
            this.stakeholderSatisfaction = value;
            return this;
        }

        public Builder competitivePressure(double value) {
            this.competitivePressure = value;
            return this;
        }

        public ChurnInput build() {
            return new ChurnInput(clientId, engagementScore, communicationFrequency, ticketCount,
                    featureAdoptionRate, paymentHistory, paymentDelays, contractValue, revenueTrend,
                    serviceUtilization, slaCompliance, escalationRate, relationshipDuration,
                    stakeholderSatisfaction, competitivePressure);
        }
    }
}
