package org.javai.gateway.mapping.revenueleak;

public record Invoice(
        String id,
        String clientId,
        Double totalAmount,
        String status,
        String invoiceDate,
        String dueDate,
        String paidDate
) {
}
