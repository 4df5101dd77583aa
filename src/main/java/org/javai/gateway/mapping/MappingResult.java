package org.javai.gateway.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating one side of a mapping.
 *
 * <p>Errors make the record unusable. Warnings flag degraded input that was still mapped, with
 * defaults standing in for what was missing; they drive {@link #dataQuality()}.
 */
public record MappingResult(List<String> errors, List<String> warnings, DataQuality dataQuality) {

    public MappingResult {
        errors = List.copyOf(Objects.requireNonNull(errors, "errors must not be null"));
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
        Objects.requireNonNull(dataQuality, "dataQuality must not be null");
    }

    public static MappingResult of(List<String> errors, List<String> warnings) {
        return new MappingResult(errors, warnings, DataQuality.forWarningCount(warnings.size()));
    }

    public static MappingResult valid() {
        return of(List.of(), List.of());
    }

    public static MappingResult invalid(String... errors) {
        return of(List.of(errors), List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public static Collector collector() {
        return new Collector();
    }

    /**
     * Accumulates findings while a mapper walks its input.
     */
    public static final class Collector {
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        private Collector() {
        }

        public Collector error(String message) {
            errors.add(message);
            return this;
        }

        public Collector errorIf(boolean condition, String message) {
            if (condition) {
                errors.add(message);
            }
            return this;
        }

        public Collector warnIf(boolean condition, String message) {
            if (condition) {
                warnings.add(message);
            }
            return this;
        }

        public MappingResult result() {
            return MappingResult.of(errors, warnings);
        }
    }
}
