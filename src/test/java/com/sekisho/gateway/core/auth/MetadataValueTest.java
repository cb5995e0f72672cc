package com.sekisho.gateway.core.auth;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetadataValueTest {

    @Test
    void numbers_compareByValue() {
        assertThat(MetadataValue.of(3)).isEqualTo(MetadataValue.of(3L));
        assertThat(MetadataValue.of(3)).isEqualTo(MetadataValue.of(3.0));
        assertThat(MetadataValue.of(3).hashCode()).isEqualTo(MetadataValue.of(3.0).hashCode());
        assertThat(MetadataValue.of(3)).isNotEqualTo(MetadataValue.of(3.5));
    }

    @Test
    void of_rejectsNonFiniteNumbers() {
        assertThatThrownBy(() -> MetadataValue.of(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MetadataValue.of(Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromObject_convertsNestedValues() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("name", "acme");
        raw.put("tags", List.of("a", 1, false));

        MetadataValue value = MetadataValue.fromObject(raw);

        assertThat(value.getType()).isEqualTo(MetadataValue.Type.MAP);
        assertThat(value.asMap().get("name").asString()).isEqualTo("acme");
        List<MetadataValue> tags = value.asMap().get("tags").asList();
        assertThat(tags).extracting(MetadataValue::getType)
                .containsExactly(MetadataValue.Type.STRING, MetadataValue.Type.NUMBER, MetadataValue.Type.BOOLEAN);
        assertThat(value.toObject()).isEqualTo(raw);
    }

    @Test
    void fromObject_rejectsUnsupportedTypes() {
        assertThatThrownBy(() -> MetadataValue.fromObject(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MetadataValue.fromObject(new Object())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MetadataValue.fromObject(Map.of(1, "x"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void accessor_wrongType_throws() {
        assertThatThrownBy(() -> MetadataValue.of("x").asNumber()).isInstanceOf(IllegalStateException.class);
        assertThat(MetadataValue.of(true).asBoolean()).isTrue();
    }

    @Test
    void fromMap_null_isEmpty() {
        assertThat(MetadataValue.fromMap(null)).isEmpty();
    }
}
