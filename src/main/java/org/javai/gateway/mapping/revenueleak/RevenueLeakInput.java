package org.javai.gateway.mapping.revenueleak;

import java.util.List;

/**
 * Billing, delivery and support records to reconcile. A null list means the data was not
 * supplied at all, which is reported differently from an empty one.
 */
public record RevenueLeakInput(
        String organizationId,
        List<Invoice> invoices,
        List<ServiceRecord> services,
        List<Ticket> tickets
) {

    public RevenueLeakInput {
        invoices = invoices == null ? null : List.copyOf(invoices);
        services = services == null ? null : List.copyOf(services);
        tickets = tickets == null ? null : List.copyOf(tickets);
    }
}
