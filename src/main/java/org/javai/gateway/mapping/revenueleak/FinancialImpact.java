package org.javai.gateway.mapping.revenueleak;

public record FinancialImpact(
        double totalLeakAmount,
        double monthlyLeakRate,
        double annualizedImpact,
        double recoveryPotential,
        double preventionSavings
) {
}
