package com.flagship.fund_quarantine.quarantine.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of quarantine lifecycle events published through the outbox.
 *
 * Consumers de-duplicate on {@link #getEventId()}; {@link #getEventType()} is
 * the topic-style name (e.g. "quarantine.created") and is also sent as a Kafka header.
 */
public interface QuarantineEvent {

    UUID getEventId();

    UUID getQuarantineId();

    Instant getOccurredAt();

    String getEventType();
}
