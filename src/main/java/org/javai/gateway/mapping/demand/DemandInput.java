package org.javai.gateway.mapping.demand;

import java.util.List;

/**
 * @param demandHistory one observation per period, oldest first; thirty or more are needed for a
 *                      confident forecast
 */
public record DemandInput(
        String organizationId,
        List<Double> demandHistory,
        List<Double> capacityUtilization,
        List<String> serviceTypes
) {

    public DemandInput {
        demandHistory = demandHistory == null ? null : List.copyOf(demandHistory);
        capacityUtilization = capacityUtilization == null ? null : List.copyOf(capacityUtilization);
        serviceTypes = serviceTypes == null ? null : List.copyOf(serviceTypes);
    }
}
