/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.allocation.async;

import static io.github.suppierk.allocation.jooq.Schema.OUTBOX_EVENTS;
import static io.github.suppierk.allocation.jooq.Schema.OUTBOX_EVENTS_CHANNEL;
import static io.github.suppierk.allocation.jooq.Schema.OUTBOX_EVENTS_CREATED_AT;
import static io.github.suppierk.allocation.jooq.Schema.OUTBOX_EVENTS_ID;
import static io.github.suppierk.allocation.jooq.Schema.OUTBOX_EVENTS_PAYLOAD;
import static io.github.suppierk.allocation.jooq.Schema.OUTBOX_EVENTS_TYPE;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.allocation.cqrs.Event;
import java.time.OffsetDateTime;
import java.util.UUID;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventPublisher} which appends events as JSON to the {@code outbox_events} table. A relay
 * outside of this service forwards stored rows to the message broker.
 */
public final class OutboxEventPublisher implements EventPublisher {
  private static final Logger LOG = LoggerFactory.getLogger(OutboxEventPublisher.class);

  private final DSLContext dsl;
  private final ObjectMapper objectMapper;

  public OutboxEventPublisher(final DSLContext dsl, final ObjectMapper objectMapper) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSL context cannot be null");
    }
    if (objectMapper == null) {
      throw new IllegalArgumentException("Object mapper cannot be null");
    }

    this.dsl = dsl;
    this.objectMapper = objectMapper;
  }

  /**
   * @throws IllegalArgumentException if the event cannot be serialized
   * @throws org.jooq.exception.DataAccessException if the row cannot be stored
   */
  @Override
  public void publish(final String channel, final Event event) {
    final String payload;
    try {
      payload = objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Cannot serialize event to JSON: " + event.getClass().getSimpleName(), e);
    }

    final String id = UUID.randomUUID().toString();
    dsl.insertInto(OUTBOX_EVENTS)
        .set(OUTBOX_EVENTS_ID, id)
        .set(OUTBOX_EVENTS_CHANNEL, channel)
        .set(OUTBOX_EVENTS_TYPE, event.getClass().getSimpleName())
        .set(OUTBOX_EVENTS_PAYLOAD, payload)
        .set(OUTBOX_EVENTS_CREATED_AT, OffsetDateTime.now())
        .execute();

    LOG.debug("Outbox record appended: id={}, channel={}, payload={}", id, channel, payload);
  }
}
