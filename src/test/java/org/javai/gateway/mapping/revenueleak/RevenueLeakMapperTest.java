package org.javai.gateway.mapping.revenueleak;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.MutableClock;
import org.javai.gateway.mapping.MappingException;
import org.javai.gateway.mapping.MappingOptions;
import org.javai.gateway.mapping.MappingResult;
import org.javai.gateway.mapping.RiskLevel;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RevenueLeakMapperTest {

    private final ObjectMapper json = new ObjectMapper();
    private final MutableClock clock = MutableClock.at("2024-06-30T00:00:00Z");
    private final RevenueLeakMapper mapper = new RevenueLeakMapper(clock);

    @Test
    void toExternal_mapsRecordsAndDefaultsTheAnalysisPeriod() {
        RevenueLeakInput input = new RevenueLeakInput("org-7",
                List.of(new Invoice("inv-1", "c-1", null, "paid", "2024-05-01", "2024-05-31", null)),
                List.of(new ServiceRecord("svc-1", "c-1", "Backup", "managed", "active", 10.0, 14.0, 120.0)),
                List.of(new Ticket("t-1", "c-1", "high", "closed", 2.5, null)));

        ObjectNode request = mapper.toExternal(input, MappingOptions.none());

        assertThat(request.path("organization_id").asText()).isEqualTo("org-7");
        assertThat(request.at("/analysis_period/start_date").asText()).isEqualTo("2024-04-01T00:00:00Z");
        assertThat(request.at("/analysis_period/end_date").asText()).isEqualTo("2024-06-30T00:00:00Z");
        assertThat(request.at("/billing_data/invoices/0/amount").asDouble()).isZero();
        assertThat(request.at("/billing_data/invoices/0/paid_date").isNull()).isTrue();
        assertThat(request.at("/service_delivery_data/services/0/actual_hours").asDouble()).isEqualTo(14.0);
        assertThat(request.at("/operational_data/tickets/0/billable").asBoolean()).isTrue();
        assertThat(request.at("/detection_options/sensitivity_level").asText()).isEqualTo("medium");
        assertThat(request.at("/detection_options/minimum_leak_threshold").asInt()).isEqualTo(1000);
    }

    @Test
    void toExternal_honoursExplicitPeriodAndSensitivity() {
        ObjectNode request = mapper.toExternal(new RevenueLeakInput("org-7", List.of(), List.of(), null),
                MappingOptions.of(RevenueLeakMapper.START_DATE, "2024-01-01")
                        .with(RevenueLeakMapper.END_DATE, "2024-03-31")
                        .with(RevenueLeakMapper.SENSITIVITY_LEVEL, "high"));

        assertThat(request.at("/analysis_period/start_date").asText()).isEqualTo("2024-01-01");
        assertThat(request.at("/analysis_period/end_date").asText()).isEqualTo("2024-03-31");
        assertThat(request.at("/detection_options/sensitivity_level").asText()).isEqualTo("high");
        assertThat(request.at("/operational_data/tickets").size()).isZero();
    }

    @Test
    void validateInternal_distinguishesMissingFromEmpty() {
        MappingResult missing = mapper.validateInternal(new RevenueLeakInput("org-7", null, null, null));
        MappingResult empty = mapper.validateInternal(new RevenueLeakInput("org-7", List.of(), List.of(), null));

        assertThat(missing.warnings()).containsExactly(
                "Invoice data is missing or invalid", "Service data is missing or invalid");
        assertThat(empty.warnings()).containsExactly("No invoice data available for analysis");
        assertThatThrownBy(() -> mapper.toExternal(new RevenueLeakInput(null, null, null, null), MappingOptions.none()))
                .isInstanceOf(MappingException.class)
                .hasMessageContaining("Organization ID is required");
    }

    @Test
    void fromExternal_derivesSeverityAndCountsHighSeverityLeaks() throws Exception {
        JsonNode response = json.readTree("""
                {"data": {
                  "organization_id": "org-7",
                  "total_leak_amount": 77000,
                  "leaks_detected": [
                    {"leak_id": "L-1", "category": "unbilled_hours", "amount": 52000, "severity": "low"},
                    {"category": "pricing_gaps", "amount": 21000},
                    {"category": "billing_errors", "amount": 4000, "affected_clients": ["c-1", "c-2"]}
                  ],
                  "leak_categories": {"unbilled_hours": {"amount": 52000}, "pricing_gaps": {"amount": 25000}},
                  "recommendations": [
                    {"category": "billing", "description": "Bill overtime", "estimated_savings": 9000},
                    "Audit contracts"
                  ],
                  "root_causes": {"primary": ["manual time entry"]},
                  "overall_confidence": 0.66
                }}
                """);

        RevenueLeakReport report = mapper.fromExternal(response, MappingOptions.none());

        assertThat(report.leaks()).extracting(DetectedLeak::leakId).containsExactly("L-1", "leak_1", "leak_2");
        assertThat(report.leaks()).extracting(DetectedLeak::severity)
                .containsExactly(RiskLevel.CRITICAL, RiskLevel.HIGH, RiskLevel.LOW);
        assertThat(report.highSeverityLeaks()).isEqualTo(2);
        assertThat(report.totalLeaks()).isEqualTo(3);
        assertThat(report.leaks().get(2).affectedClients()).containsExactly("c-1", "c-2");
        assertThat(report.categoryAmounts()).containsEntry("unbilled_hours", 52000.0).containsEntry("pricing_gaps", 25000.0);
        assertThat(report.financialImpact().totalLeakAmount()).isEqualTo(77000);
        assertThat(report.recommendations().get(0).estimatedSavings()).isEqualTo(9000);
        assertThat(report.recommendations().get(1).description()).isEqualTo("Audit contracts");
        assertThat(report.primaryCauses()).containsExactly("manual time entry");
        assertThat(report.confidenceScore()).isEqualTo(0.66);
    }

    @Test
    void fromExternal_acceptsCategoryListFromDegradedPayload() throws Exception {
        JsonNode response = json.readTree("""
                {"total_leak_amount": 5000,
                 "leak_categories": [{"category": "pricing_gaps", "amount": 1500, "percentage": 30}],
                 "is_fallback": true}
                """);

        RevenueLeakReport report = mapper.fromExternal(response, MappingOptions.none());

        assertThat(report.categoryAmounts()).containsExactly(entry("pricing_gaps", 1500.0));
        assertThat(report.leaks()).isEmpty();
        assertThat(report.confidenceScore()).isEqualTo(0.8);
        assertThat(report.metadata().fallback()).isTrue();
    }

    @Test
    void severityFor_usesAmountThresholds() {
        assertThat(RevenueLeakMapper.severityFor(4_999)).isEqualTo(RiskLevel.LOW);
        assertThat(RevenueLeakMapper.severityFor(5_000)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RevenueLeakMapper.severityFor(20_000)).isEqualTo(RiskLevel.HIGH);
        assertThat(RevenueLeakMapper.severityFor(50_000)).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void validateExternal_requiresNonNegativeTotal() throws Exception {
        assertThat(mapper.validateExternal(json.readTree("{\"total_leak_amount\": -1}")).errors())
                .containsExactly("Total leak amount cannot be negative");
        assertThat(mapper.validateExternal(json.readTree("{\"data\": {\"total_leak_amount\": \"lots\"}}")).errors())
                .containsExactly("Total leak amount is missing or invalid");
        assertThat(mapper.validateExternal(json.readTree("[1, 2]")).errors())
                .containsExactly("Response data is missing");
    }

    @Test
    void cacheKey_bucketsByTwelveHours() {
        RevenueLeakInput input = new RevenueLeakInput("org-7", List.of(), List.of(), List.of());
        String key = mapper.cacheKey(input, MappingOptions.none());

        clock.advance(Duration.ofHours(11));
        assertThat(mapper.cacheKey(input, MappingOptions.none())).isEqualTo(key);
        clock.advance(Duration.ofHours(2));
        assertThat(mapper.cacheKey(input, MappingOptions.none())).isNotEqualTo(key);
        assertThat(key).startsWith("revenue_leak_org-7_90d_");
    }

    @Test
    void roundTrip_preservesOrganization() {
        RevenueLeakInput input = new RevenueLeakInput("org-7", List.of(), List.of(), List.of());

        RevenueLeakReport echoed = mapper.fromExternal(mapper.toExternal(input, MappingOptions.none()),
                MappingOptions.none());

        assertThat(echoed.organizationId()).isEqualTo("org-7");
        assertThat(echoed.leaks()).isEmpty();
    }
}
