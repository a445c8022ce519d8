package com.ghga.eventschemas;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventSerializerTest {

    record Pair(String left, List<Integer> right) {}

    @Test
    void parsePayloadKeepsDocumentOrder() {
        Map<String, Object> payload =
                EventSerializer.parsePayload("{\"b\":1,\"a\":[true,null],\"c\":{\"d\":\"e\"}}");

        assertThat(payload.keySet()).containsExactly("b", "a", "c");
        assertThat(payload.get("a")).isEqualTo(java.util.Arrays.asList(true, null));
        assertThat(payload.get("c")).isEqualTo(Map.of("d", "e"));
    }

    @Test
    void parsePayloadRejectsNonObjects() {
        assertThatThrownBy(() -> EventSerializer.parsePayload("[1,2]"))
                .isInstanceOf(EventSerializer.EventSerializationException.class);
        assertThatThrownBy(() -> EventSerializer.parsePayload("{\"a\":"))
                .isInstanceOf(EventSerializer.EventSerializationException.class);
        assertThatThrownBy(() -> EventSerializer.parsePayload("null"))
                .isInstanceOf(EventSerializer.EventSerializationException.class);
        assertThatThrownBy(() -> EventSerializer.parsePayload(null))
                .isInstanceOf(EventSerializer.EventSerializationException.class);
    }

    @Test
    void datetimesAreWrittenAsIsoStrings() {
        var value = Map.of("at", OffsetDateTime.of(2024, 2, 29, 12, 0, 0, 0, ZoneOffset.UTC));
        assertThat(EventSerializer.toJson(value)).isEqualTo("{\"at\":\"2024-02-29T12:00:00Z\"}");
    }

    @Test
    void convertMapsIntoRecords() {
        assertThatThrownBy(() -> EventSerializer.convert(Map.of("left", List.of()), Integer.class))
                .isInstanceOf(EventSerializer.EventSerializationException.class)
                .hasMessageContaining("Integer");
        assertThat(EventSerializer.convert(Map.of("left", "x", "right", List.of(1)), Pair.class))
                .isEqualTo(new Pair("x", List.of(1)));
    }
}
