package org.javai.gateway.mapping.revenueleak;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.ModelType;
import org.javai.gateway.mapping.AbstractDataMapper;
import org.javai.gateway.mapping.MappingOptions;
import org.javai.gateway.mapping.MappingResult;
import org.javai.gateway.mapping.RiskLevel;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps revenue leak detection.
 *
 * <p>Options: {@value #START_DATE} and {@value #END_DATE} (ISO-8601, default the last 90 days),
 * {@value #SENSITIVITY_LEVEL} (default medium), {@value #MINIMUM_LEAK_THRESHOLD} (default 1000)
 * and {@value #ANALYSIS_PERIOD}, the label used in the cache key (default 90d).
 */
public final class RevenueLeakMapper extends AbstractDataMapper<RevenueLeakInput, RevenueLeakReport> {

    public static final String START_DATE = "startDate";
    public static final String END_DATE = "endDate";
    public static final String SENSITIVITY_LEVEL = "sensitivityLevel";
    public static final String MINIMUM_LEAK_THRESHOLD = "minimumLeakThreshold";
    public static final String ANALYSIS_PERIOD = "analysisPeriod";
    public static final Duration DEFAULT_ANALYSIS_WINDOW = Duration.ofDays(90);

    public RevenueLeakMapper() {
        this(Clock.systemUTC());
    }

    public RevenueLeakMapper(Clock clock) {
        super(ModelType.REVENUE_LEAK, RevenueLeakReport.class, clock);
    }

    public static RiskLevel severityFor(double amount) {
        if (amount >= 50_000) {
            return RiskLevel.CRITICAL;
        }
        if (amount >= 20_000) {
            return RiskLevel.HIGH;
        }
        if (amount >= 5_000) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    @Override
    public MappingResult validateInternal(RevenueLeakInput input) {
        return MappingResult.collector()
                .errorIf(isBlank(input.organizationId()), "Organization ID is required")
                .warnIf(input.invoices() == null, "Invoice data is missing or invalid")
                .warnIf(input.services() == null, "Service data is missing or invalid")
                .warnIf(input.invoices() != null && input.invoices().isEmpty(), "No invoice data available for analysis")
                .result();
    }

    @Override
    protected ObjectNode buildRequest(RevenueLeakInput input, MappingOptions options) {
        ObjectNode request = JSON.objectNode();
        request.put("organization_id", input.organizationId());

        ObjectNode period = request.putObject("analysis_period");
        period.put("start_date", options.text(START_DATE, clock.instant().minus(DEFAULT_ANALYSIS_WINDOW).toString()));
        period.put("end_date", options.text(END_DATE, now()));

        ArrayNode invoices = request.putObject("billing_data").putArray("invoices");
        if (input.invoices() != null) {
            for (Invoice invoice : input.invoices()) {
                ObjectNode node = invoices.addObject();
                node.put("invoice_id", invoice.id());
                node.put("client_id", invoice.clientId());
                node.put("amount", or(invoice.totalAmount(), 0));
                node.put("status", invoice.status());
                node.put("issue_date", invoice.invoiceDate());
                node.put("due_date", invoice.dueDate());
                node.put("paid_date", invoice.paidDate());
            }
        }

        ArrayNode services = request.putObject("service_delivery_data").putArray("services");
        if (input.services() != null) {
            for (ServiceRecord service : input.services()) {
                ObjectNode node = services.addObject();
                node.put("service_id", service.id());
                node.put("client_id", service.clientId());
                node.put("name", service.name());
                node.put("type", service.type());
                node.put("status", service.status());
                node.put("billable_hours", or(service.billableHours(), 0));
                node.put("actual_hours", or(service.actualHours(), 0));
                node.put("hourly_rate", or(service.hourlyRate(), 0));
            }
        }

        ArrayNode tickets = request.putObject("operational_data").putArray("tickets");
        if (input.tickets() != null) {
            for (Ticket ticket : input.tickets()) {
                ObjectNode node = tickets.addObject();
                node.put("ticket_id", ticket.id());
                node.put("client_id", ticket.clientId());
                node.put("priority", ticket.priority());
                node.put("status", ticket.status());
                node.put("hours_spent", or(ticket.hoursSpent(), 0));
                node.put("billable", ticket.billable() == null || ticket.billable());
            }
        }

        ObjectNode detection = request.putObject("detection_options");
        detection.put("sensitivity_level", options.text(SENSITIVITY_LEVEL, "medium"));
        detection.put("minimum_leak_threshold", options.integer(MINIMUM_LEAK_THRESHOLD, 1000));
        detection.put("include_recommendations", true);
        detection.put("include_root_causes", true);
        return request;
    }

    @Override
    protected RevenueLeakReport readResult(JsonNode data, MappingOptions options) {
        List<DetectedLeak> leaks = new ArrayList<>();
        JsonNode detected = data.path("leaks_detected");
        if (detected.isArray()) {
            int index = 0;
            for (JsonNode leak : detected) {
                double amount = number(leak, "amount", 0);
                leaks.add(new DetectedLeak(
                        text(leak, "leak_id", "leak_" + index),
                        text(leak, "category", "unknown"),
                        text(leak, "description", "Revenue leak detected"),
                        amount,
                        number(leak, "confidence", 0.7),
                        severityFor(amount),
                        text(leak, "source", "unknown"),
                        texts(leak, "affected_clients")));
                index++;
            }
        }
        int highSeverity = (int) leaks.stream().filter(leak -> leak.severity().isAtLeast(RiskLevel.HIGH)).count();

        return new RevenueLeakReport(
                text(data, "organization_id", null),
                List.copyOf(leaks),
                categoryAmounts(data.path("leak_categories")),
                new FinancialImpact(
                        number(data, "total_leak_amount", 0),
                        number(data, "monthly_leak_rate", 0),
                        number(data, "annualized_impact", 0),
                        number(data, "recovery_potential", 0),
                        number(data, "prevention_savings", 0)),
                objects(data, "recommendations", RevenueLeakMapper::leakRecommendation),
                texts(data.path("root_causes"), "primary"),
                highSeverity,
                number(data, "overall_confidence", 0.8),
                metadata(data, "analysis_date"));
    }

    @Override
    protected void checkResponse(JsonNode data, MappingResult.Collector findings) {
        JsonNode amount = data.path("total_leak_amount");
        if (!amount.isNumber()) {
            findings.error("Total leak amount is missing or invalid");
        } else {
            findings.errorIf(amount.asDouble() < 0, "Total leak amount cannot be negative");
        }
    }

    @Override
    public String cacheKey(RevenueLeakInput input, MappingOptions options) {
        String period = options.text(ANALYSIS_PERIOD, "90d");
        return "revenue_leak_" + input.organizationId() + "_" + period + "_" + bucket(Duration.ofHours(12));
    }

    /**
     * The live service sends {@code {"unbilled_hours": {"amount": ..}}}; degraded payloads send a
     * list of {@code {"category": .., "amount": ..}}. Both are accepted.
     */
    private static Map<String, Double> categoryAmounts(JsonNode categories) {
        Map<String, Double> amounts = new LinkedHashMap<>();
        if (categories.isObject()) {
            categories.fields().forEachRemaining(entry ->
                    amounts.put(entry.getKey(), number(entry.getValue(), "amount", 0)));
        } else if (categories.isArray()) {
            for (JsonNode category : categories) {
                amounts.put(text(category, "category", "unknown"), number(category, "amount", 0));
            }
        }
        return Map.copyOf(amounts);
    }

    private static LeakRecommendation leakRecommendation(JsonNode node) {
        if (node.isValueNode()) {
            return new LeakRecommendation("general", "medium", node.asText(), 0, "medium", "short-term");
        }
        return new LeakRecommendation(
                text(node, "category", "general"),
                text(node, "priority", "medium"),
                text(node, "description", node.toString()),
                number(node, "estimated_savings", 0),
                text(node, "implementation_effort", "medium"),
                text(node, "timeframe", "short-term"));
    }
}
