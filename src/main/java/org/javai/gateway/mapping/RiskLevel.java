package org.javai.gateway.mapping;

import java.util.Locale;

/**
 * Four-step severity scale shared by the risk and severity fields of several models.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of a label such as {@code "high"}; unknown or missing labels yield
     * {@code defaultLevel}.
     */
    public static RiskLevel fromLabel(String label, RiskLevel defaultLevel) {
        if (label == null || label.isBlank()) {
            return defaultLevel;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return defaultLevel;
        }
    }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }
}
