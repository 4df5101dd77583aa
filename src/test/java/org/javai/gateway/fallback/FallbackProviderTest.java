package org.javai.gateway.fallback;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.ModelType;
import org.javai.gateway.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FallbackProviderTest {

    private final MutableClock clock = MutableClock.at("2026-05-04T10:15:30Z");

    @Test
    void withDefaults_registersEveryCategory() {
        FallbackProvider provider = FallbackProvider.withDefaults(clock);

        assertThat(provider.registeredCategories()).containsExactlyInAnyOrder(ModelType.values());
        assertThatCode(() -> provider.requireRegistered(EnumSet.allOf(ModelType.class))).doesNotThrowAnyException();
    }

    @Test
    void get_stampsCorrelationAndTime() {
        FallbackProvider provider = FallbackProvider.withDefaults(clock);

        FallbackEntry entry = provider.get(ModelType.CHURN, "corr-42");

        assertThat(entry.isFallback()).isTrue();
        assertThat(entry.configured()).isTrue();
        assertThat(entry.category()).isEqualTo(ModelType.CHURN);
        assertThat(entry.correlationId()).isEqualTo("corr-42");
        assertThat(entry.servedAt()).isEqualTo(clock.instant());
        assertThat(entry.reason()).isEqualTo(FallbackProvider.DEFAULT_REASON);
        assertThat(entry.payload().path("churn_probability").asDouble()).isEqualTo(0.35);
        assertThat(entry.payload().path("is_fallback").asBoolean()).isTrue();
    }

    @Test
    void get_unregisteredCategory_returnsGenericEntry() {
        FallbackProvider provider = new FallbackProvider(clock);

        FallbackEntry entry = provider.get(ModelType.PRICING, "corr-1");

        assertThat(entry.configured()).isFalse();
        assertThat(entry.isFallback()).isTrue();
        assertThat(entry.reason()).isEqualTo(FallbackProvider.NOT_CONFIGURED_REASON);
        assertThat(entry.payload().path("error").asText()).isEqualTo("Service temporarily unavailable");
        assertThat(entry.payload().path("is_fallback").asBoolean()).isTrue();
    }

    @Test
    void get_nullCategory_neverThrows() {
        FallbackEntry entry = new FallbackProvider(clock).get(null, null);

        assertThat(entry.configured()).isFalse();
        assertThat(entry.category()).isNull();
    }

    @Test
    void set_isIdempotentAndCopiesThePayload() {
        FallbackProvider provider = new FallbackProvider(clock);
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("recommended_price", 99);

        provider.set(ModelType.PRICING, payload, "Cached price");
        provider.set(ModelType.PRICING, payload, "Cached price");
        payload.put("recommended_price", 1);

        FallbackEntry entry = provider.get(ModelType.PRICING, null);
        assertThat(entry.payload().path("recommended_price").asInt()).isEqualTo(99);
        assertThat(entry.reason()).isEqualTo("Cached price");
        assertThat(provider.registeredCategories()).containsExactly(ModelType.PRICING);
    }

    @Test
    void get_returnsIndependentCopies() {
        FallbackProvider provider = FallbackProvider.withDefaults(clock);

        ((ObjectNode) provider.get(ModelType.BUDGET, null).payload()).put("projected_savings", 0);

        assertThat(provider.get(ModelType.BUDGET, null).payload().path("projected_savings").asInt()).isEqualTo(8500);
    }

    @Test
    void requireRegistered_namesMissingCategories() {
        FallbackProvider provider = new FallbackProvider(clock);
        provider.set(ModelType.CHURN, JsonNodeFactory.instance.objectNode());

        assertThatThrownBy(() -> provider.requireRegistered(List.of(ModelType.CHURN, ModelType.DEMAND, ModelType.ANOMALY)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("demand")
                .hasMessageContaining("anomaly")
                .hasMessageNotContaining("churn");
    }

    @Test
    void catalog_matchesDocumentedValues() {
        var defaults = FallbackCatalog.defaults();

        assertThat(defaults.get(ModelType.PROFITABILITY).path("profitability_score").asDouble()).isEqualTo(0.75);
        assertThat(defaults.get(ModelType.REVENUE_LEAK).path("leak_categories")).hasSize(3);
        assertThat(defaults.get(ModelType.PRICING).path("price_range").path("max").asInt()).isEqualTo(180);
        assertThat(defaults.get(ModelType.DEMAND).path("trend").asText()).isEqualTo("stable");
        assertThat(defaults.get(ModelType.ANOMALY).path("anomalies_detected").asInt()).isEqualTo(2);
        assertThat(defaults.values()).allSatisfy(payload ->
                assertThat(payload.path("fallback_reason").asText()).isEqualTo(FallbackProvider.DEFAULT_REASON));
    }
}
