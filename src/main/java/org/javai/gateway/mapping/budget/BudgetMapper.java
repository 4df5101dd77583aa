package org.javai.gateway.mapping.budget;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.ModelType;
import org.javai.gateway.mapping.AbstractDataMapper;
import org.javai.gateway.mapping.MappingOptions;
import org.javai.gateway.mapping.MappingResult;

import java.time.Clock;
import java.time.Duration;

/**
 * Maps budget optimizations. Options: {@value #OPTIMIZATION_GOAL} (default maximize_roi),
 * {@value #RISK_TOLERANCE} (default medium), {@value #TIME_HORIZON} (months, default 12).
 */
public final class BudgetMapper extends AbstractDataMapper<BudgetInput, BudgetOptimization> {

    public static final String OPTIMIZATION_GOAL = "optimizationGoal";
    public static final String RISK_TOLERANCE = "riskTolerance";
    public static final String TIME_HORIZON = "timeHorizon";
    public static final String DEFAULT_BUDGET_PERIOD = "annual";

    public BudgetMapper() {
        this(Clock.systemUTC());
    }

    public BudgetMapper(Clock clock) {
        super(ModelType.BUDGET, BudgetOptimization.class, clock);
    }

    @Override
    public MappingResult validateInternal(BudgetInput input) {
        return MappingResult.collector()
                .errorIf(isBlank(input.organizationId()), "Organization ID is required")
                .warnIf(input.totalBudget() == null || input.totalBudget() <= 0, "Total budget is missing or invalid")
                .warnIf(input.departments() == null, "Department data is missing")
                .result();
    }

    @Override
    protected ObjectNode buildRequest(BudgetInput input, MappingOptions options) {
        ObjectNode request = JSON.objectNode();
        request.put("organization_id", input.organizationId());

        ObjectNode budget = request.putObject("budget_data");
        budget.put("total_budget", or(input.totalBudget(), 0));
        budget.set("current_allocation", numberObject(input.currentAllocation()));
        budget.put("budget_period", or(input.budgetPeriod(), DEFAULT_BUDGET_PERIOD));

        ArrayNode departments = request.putArray("department_data");
        if (input.departments() != null) {
            for (Department department : input.departments()) {
                ObjectNode node = departments.addObject();
                node.put("department_id", department.id());
                node.put("name", department.name());
                node.put("current_budget", or(department.currentBudget(), 0));
                node.put("spent_amount", or(department.spentAmount(), 0));
                node.put("priority_level", or(department.priorityLevel(), "medium"));
            }
        }

        ObjectNode optimization = request.putObject("optimization_options");
        optimization.put("optimization_goal", options.text(OPTIMIZATION_GOAL, "maximize_roi"));
        optimization.put("risk_tolerance", options.text(RISK_TOLERANCE, "medium"));
        optimization.put("time_horizon", options.integer(TIME_HORIZON, 12));
        optimization.put("include_scenarios", true);
        return request;
    }

    @Override
    protected BudgetOptimization readResult(JsonNode data, MappingOptions options) {
        JsonNode risks = data.path("risk_analysis");
        return new BudgetOptimization(
                text(data, "organization_id", null),
                text(data, "budget_period", text(data.path("budget_data"), "budget_period", DEFAULT_BUDGET_PERIOD)),
                number(data, "optimization_score", 0),
                number(data, "potential_savings", 0),
                numbers(data, "recommended_allocation"),
                number(data, "confidence", 0.7),
                objects(data, "optimizations", node -> new BudgetAdjustment(
                        text(node, "category", "general"),
                        number(node, "current_spend", 0),
                        number(node, "recommended_spend", 0),
                        number(node, "savings", 0),
                        text(node, "rationale", ""),
                        number(node, "confidence", 0.7))),
                texts(data, "recommendations"),
                texts(risks, "budget_risks"),
                texts(risks, "mitigation_strategies"),
                metadata(data, "optimization_date"));
    }

    @Override
    protected void checkResponse(JsonNode data, MappingResult.Collector findings) {
        findings.errorIf(!data.path("optimization_score").isNumber(), "Optimization score is missing or invalid");
    }

    @Override
    public String cacheKey(BudgetInput input, MappingOptions options) {
        String period = or(input.budgetPeriod(), DEFAULT_BUDGET_PERIOD);
        return "budget_" + input.organizationId() + "_" + period + "_" + bucket(Duration.ofDays(1));
    }
}
