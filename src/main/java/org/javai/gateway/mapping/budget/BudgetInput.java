package org.javai.gateway.mapping.budget;

import java.util.List;
import java.util.Map;

/**
 * An organization's budget and how it is spread today. Only {@code organizationId} is required.
 *
 * @param budgetPeriod {@code annual} when null
 */
public record BudgetInput(
        String organizationId,
        Double totalBudget,
        Map<String, Double> currentAllocation,
        String budgetPeriod,
        List<Department> departments
) {

    public BudgetInput {
        currentAllocation = currentAllocation == null ? null : Map.copyOf(currentAllocation);
        departments = departments == null ? null : List.copyOf(departments);
    }
}
