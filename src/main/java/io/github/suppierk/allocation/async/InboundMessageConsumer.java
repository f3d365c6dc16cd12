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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.allocation.cqrs.Command;
import io.github.suppierk.allocation.cqrs.MessageBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns messages received from other systems into commands.
 *
 * <p>Only {@value #CHANGE_BATCH_QUANTITY_CHANNEL} is understood, with payloads like {@code
 * {"batchref": "batch-001", "qty": 20}}. Messages from other channels are ignored.
 */
public final class InboundMessageConsumer {
  /** Channel carrying purchased quantity changes. */
  public static final String CHANGE_BATCH_QUANTITY_CHANNEL = "change_batch_quantity";

  private static final Logger LOG = LoggerFactory.getLogger(InboundMessageConsumer.class);

  private final MessageBus<?> bus;
  private final ObjectMapper objectMapper;

  public InboundMessageConsumer(final MessageBus<?> bus, final ObjectMapper objectMapper) {
    if (bus == null) {
      throw new IllegalArgumentException("Message bus cannot be null");
    }
    if (objectMapper == null) {
      throw new IllegalArgumentException("Object mapper cannot be null");
    }

    this.bus = bus;
    this.objectMapper = objectMapper;
  }

  /**
   * @param channel the payload came from
   * @param payload as JSON
   * @return {@code true} if the message was turned into a command and handled
   * @throws IllegalArgumentException if the payload is malformed
   */
  public boolean consume(final String channel, final String payload) {
    if (!CHANGE_BATCH_QUANTITY_CHANNEL.equals(channel)) {
      LOG.warn("Ignoring message from unknown channel {}", channel);
      return false;
    }

    final Command.ChangeBatchQuantity command = parseChangeBatchQuantity(payload);
    LOG.info("Handling {} received from {}", command, channel);
    bus.handle(command);
    return true;
  }

  private Command.ChangeBatchQuantity parseChangeBatchQuantity(final String payload) {
    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null");
    }

    final JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot parse payload as JSON: " + payload, e);
    }

    final JsonNode reference = root == null ? null : root.get("batchref");
    final JsonNode qty = root == null ? null : root.get("qty");

    if (reference == null || !reference.isTextual()) {
      throw new IllegalArgumentException("Payload has no textual 'batchref': " + payload);
    }
    if (qty == null || !qty.canConvertToInt() || !qty.isIntegralNumber()) {
      throw new IllegalArgumentException("Payload has no integer 'qty': " + payload);
    }

    return new Command.ChangeBatchQuantity(reference.asText(), qty.intValue());
  }
}
