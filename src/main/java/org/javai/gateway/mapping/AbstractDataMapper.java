package org.javai.gateway.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Shared plumbing for the per-model mappers: the validate-then-build request flow, response
 * envelope handling, and lenient field readers that default anything missing or mistyped.
 */
public abstract class AbstractDataMapper<I, R> implements DataMapper<I, R> {

    protected static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final Logger log = LoggerFactory.getLogger(getClass());
    private final ModelType modelType;
    private final Class<R> resultType;
    protected final Clock clock;

    protected AbstractDataMapper(ModelType modelType, Class<R> resultType, Clock clock) {
        this.modelType = Objects.requireNonNull(modelType, "modelType must not be null");
        this.resultType = Objects.requireNonNull(resultType, "resultType must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public final ModelType modelType() {
        return modelType;
    }

    @Override
    public final Class<R> resultType() {
        return resultType;
    }

    @Override
    public final ObjectNode toExternal(I input, MappingOptions options) {
        Objects.requireNonNull(input, "input must not be null");
        MappingResult validation = validateInternal(input);
        if (!validation.isValid()) {
            throw new MappingException(modelType.qualifiedOperation(), validation);
        }
        ObjectNode request = buildRequest(input, options == null ? MappingOptions.none() : options);
        log.debug("Mapped {} request ({} warnings, quality {})",
                modelType.qualifiedOperation(), validation.warnings().size(), validation.dataQuality().label());
        return request;
    }

    @Override
    public final R fromExternal(JsonNode response, MappingOptions options) {
        JsonNode data = data(response);
        if (!data.isObject()) {
            throw new IllegalArgumentException("Response for [" + modelType.qualifiedOperation() + "] is not a JSON object");
        }
        return readResult(data, options == null ? MappingOptions.none() : options);
    }

    @Override
    public final MappingResult validateExternal(JsonNode response) {
        if (response == null || response.isNull() || response.isMissingNode()) {
            return MappingResult.invalid("Response is null");
        }
        JsonNode data = data(response);
        if (!data.isObject()) {
            return MappingResult.invalid("Response data is missing");
        }
        MappingResult.Collector findings = MappingResult.collector();
        checkResponse(data, findings);
        return findings.result();
    }

    protected abstract ObjectNode buildRequest(I input, MappingOptions options);

    protected abstract R readResult(JsonNode data, MappingOptions options);

    protected abstract void checkResponse(JsonNode data, MappingResult.Collector findings);

    /**
     * Unwraps {@code {"data": {...}}}; anything else is taken as the bare document.
     */
    protected static JsonNode data(JsonNode response) {
        if (response == null) {
            return MissingNode.getInstance();
        }
        JsonNode data = response.get("data");
        return data != null && data.isObject() ? data : response;
    }

    /**
     * Index of the current time bucket, for cache keys.
     */
    protected long bucket(Duration size) {
        return clock.millis() / size.toMillis();
    }

    protected String now() {
        return clock.instant().toString();
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // Response readers. Missing, null and mistyped fields all fall back to the default.

    protected static JsonNode path(JsonNode node, String... fields) {
        JsonNode current = node;
        for (String field : fields) {
            current = current.path(field);
        }
        return current;
    }

    protected static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() && !value.asText().isEmpty() ? value.asText() : defaultValue;
    }

    protected static double number(JsonNode node, String field, double defaultValue) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asDouble() : defaultValue;
    }

    protected static int integer(JsonNode node, String field, int defaultValue) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asInt() : defaultValue;
    }

    protected static boolean flag(JsonNode node, String field, boolean defaultValue) {
        JsonNode value = node.path(field);
        return value.isBoolean() ? value.asBoolean() : defaultValue;
    }

    protected static List<String> texts(JsonNode node, String field) {
        JsonNode array = node.path(field);
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode element : array) {
                if (element.isValueNode()) {
                    values.add(element.asText());
                } else if (element.has("description")) {
                    values.add(element.path("description").asText());
                } else {
                    values.add(element.toString());
                }
            }
        }
        return List.copyOf(values);
    }

    protected static <T> List<T> objects(JsonNode node, String field, Function<JsonNode, T> reader) {
        JsonNode array = node.path(field);
        List<T> values = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode element : array) {
                values.add(reader.apply(element));
            }
        }
        return List.copyOf(values);
    }

    protected static Map<String, Double> numbers(JsonNode node, String field) {
        JsonNode object = node.path(field);
        Map<String, Double> values = new LinkedHashMap<>();
        if (object.isObject()) {
            object.fields().forEachRemaining(entry -> {
                if (entry.getValue().isNumber()) {
                    values.put(entry.getKey(), entry.getValue().asDouble());
                }
            });
        }
        return Map.copyOf(values);
    }

    /**
     * Reads a recommendation that may be a bare string or an object.
     */
    protected static Recommendation recommendation(JsonNode node) {
        if (node.isValueNode()) {
            return new Recommendation("general", "medium", node.asText(), "medium", "medium", "short-term");
        }
        String description = text(node, "description", text(node, "strategy", node.toString()));
        return new Recommendation(
                text(node, "category", "general"),
                text(node, "priority", "medium"),
                description,
                text(node, "impact", "medium"),
                text(node, "effort", "medium"),
                text(node, "timeframe", "short-term"));
    }

    protected PredictionMetadata metadata(JsonNode data, String dateField) {
        return new PredictionMetadata(
                text(data, "model_version", "v1.0"),
                text(data, dateField, now()),
                number(data, "processing_time", 0),
                text(data, "data_quality", "good"),
                flag(data, "is_fallback", false));
    }

    // Request writers. Nulls become the supplied default.

    protected static ArrayNode numberArray(Collection<? extends Number> values) {
        ArrayNode array = JSON.arrayNode();
        if (values != null) {
            values.forEach(v -> array.add(v.doubleValue()));
        }
        return array;
    }

    protected static ArrayNode textArray(Collection<String> values) {
        ArrayNode array = JSON.arrayNode();
        if (values != null) {
            values.forEach(array::add);
        }
        return array;
    }

    protected static ObjectNode numberObject(Map<String, ? extends Number> values) {
        ObjectNode object = JSON.objectNode();
        if (values != null) {
            values.forEach((key, value) -> object.put(key, value.doubleValue()));
        }
        return object;
    }

    protected static double or(Double value, double defaultValue) {
        return value == null ? defaultValue : value;
    }

    protected static int or(Integer value, int defaultValue) {
        return value == null ? defaultValue : value;
    }

    protected static String or(String value, String defaultValue) {
        return isBlank(value) ? defaultValue : value;
    }
}
