package org.javai.gateway.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.ModelType;

/**
 * Translates one model's internal records to and from the prediction service's JSON schema.
 *
 * @param <I> internal input record
 * @param <R> typed result decoded from the service's answer
 */
public interface DataMapper<I, R> {

    ModelType modelType();

    Class<R> resultType();

    /**
     * Builds the request document. Missing optional fields are replaced by documented defaults.
     *
     * @throws MappingException if a required identifying field is missing
     */
    ObjectNode toExternal(I input, MappingOptions options);

    /**
     * Decodes a response, either enveloped as {@code {"data": {...}}} or bare. Every optional
     * field is defaulted, so a partial response still yields a complete result.
     */
    R fromExternal(JsonNode response, MappingOptions options);

    MappingResult validateInternal(I input);

    MappingResult validateExternal(JsonNode response);

    /**
     * A deterministic key, bucketed by time, under which equal requests may share a cached answer.
     */
    String cacheKey(I input, MappingOptions options);
}
