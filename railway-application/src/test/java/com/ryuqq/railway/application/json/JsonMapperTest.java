package com.ryuqq.railway.application.json;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JsonMapper 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JsonMapperTest {

    public record Shipment(String carrier, Instant shippedAt) {
    }

    private final JsonMapper jsonMapper = new JsonMapper();

    @Test
    void write_날짜는_ISO_문자열로_직렬화() {
        // when
        String json = jsonMapper.write(new Shipment("dhl", Instant.parse("2026-01-01T09:30:00Z")));

        // then
        assertThat(json).isEqualTo("{\"carrier\":\"dhl\",\"shippedAt\":\"2026-01-01T09:30:00Z\"}");
        assertThat(jsonMapper.write(null)).isNull();
    }

    @Test
    void read_모르는_속성은_무시() {
        // when
        Shipment shipment = jsonMapper.read("{\"carrier\":\"ups\",\"weight\":3}", Shipment.class);

        // then
        assertThat(shipment.carrier()).isEqualTo("ups");
        assertThat(shipment.shippedAt()).isNull();
    }

    @Test
    void read_잘못된_JSON이면_IllegalStateException() {
        // when & then
        assertThatThrownBy(() -> jsonMapper.read("{not json", Shipment.class))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to deserialize JSON into");
        assertThatThrownBy(() -> jsonMapper.read(null, Shipment.class))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
