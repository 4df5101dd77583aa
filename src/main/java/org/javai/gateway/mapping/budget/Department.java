package org.javai.gateway.mapping.budget;

public record Department(String id, String name, Double currentBudget, Double spentAmount, String priorityLevel) {
}
