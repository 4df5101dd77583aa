package org.javai.gateway;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ModelTypeTest {

    @Test
    void fromCategory_resolvesWireNames() {
        assertThat(ModelType.fromCategory("revenue_leak")).contains(ModelType.REVENUE_LEAK);
        assertThat(ModelType.fromCategory("forecast")).isEmpty();
        assertThat(ModelType.fromCategory(null)).isEmpty();
    }

    @Test
    void qualifiedOperation_joinsCategoryAndOperation() {
        assertThat(ModelType.CHURN.qualifiedOperation()).isEqualTo("churn.predict");
        assertThat(ModelType.ANOMALY.qualifiedOperation()).isEqualTo("anomaly.detect");
    }
}
