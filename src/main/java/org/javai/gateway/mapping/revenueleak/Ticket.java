package org.javai.gateway.mapping.revenueleak;

/**
 * @param billable treated as true when null
 */
public record Ticket(
        String id,
        String clientId,
        String priority,
        String status,
        Double hoursSpent,
        Boolean billable
) {
}
