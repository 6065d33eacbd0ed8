package com.otcswap.infra.kafka.serde;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.otcswap.infra.kafka.contract.EventEnvelope;
import com.otcswap.infra.kafka.contract.EventTypes;
import com.otcswap.infra.kafka.contract.payload.ClaimBalanceChangedV1;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class EventEnvelopeJsonCodecTest {
  private final EventEnvelopeJsonCodec codec =
      new EventEnvelopeJsonCodec(EventObjectMapperFactory.create());

  @Test
  void shouldDecodeWhatItEncodesWithIsoTimestamps() {
    ClaimBalanceChangedV1 payload =
        new ClaimBalanceChangedV1(
            "alice",
            "USDC",
            "WITHDRAWN",
            new BigDecimal("12.5"),
            new BigDecimal("0"),
            null,
            null,
            Instant.parse("2026-03-01T12:00:00Z"));
    EventEnvelope<ClaimBalanceChangedV1> source =
        EventEnvelope.of(EventTypes.CLAIM_BALANCE_CHANGED, 1, "swap-engine", "alice", "alice", payload);

    String json = codec.encode(source);
    EventEnvelope<ClaimBalanceChangedV1> decoded = codec.decode(json, ClaimBalanceChangedV1.class);

    assertTrue(json.contains("\"occurredAt\":\"2026-03-01T12:00:00Z\""));
    assertFalse(json.contains("causationId"));
    assertNotNull(decoded.eventId());
    assertEquals(source.eventType(), decoded.eventType());
    assertEquals(source.key(), decoded.key());
    assertEquals(0, payload.amount().compareTo(decoded.payload().amount()));
    assertEquals(payload.principal(), decoded.payload().principal());
  }
}
