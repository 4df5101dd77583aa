package org.javai.gateway.mapping.revenueleak;

public record ServiceRecord(
        String id,
        String clientId,
        String name,
        String type,
        String status,
        Double billableHours,
        Double actualHours,
        Double hourlyRate
) {
}
