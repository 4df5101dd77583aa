package org.javai.gateway.mapping;

/**
 * Grades an input record by how many defaults had to be substituted for it.
 */
public enum DataQuality {
    EXCELLENT,
    GOOD,
    POOR;

    public static DataQuality forWarningCount(int warnings) {
        if (warnings <= 0) {
            return EXCELLENT;
        }
        return warnings <= 2 ? GOOD : POOR;
    }

    public String label() {
        return name().toLowerCase();
    }
}
