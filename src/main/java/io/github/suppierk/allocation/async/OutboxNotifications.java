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

import static io.github.suppierk.allocation.jooq.Schema.OUTBOX_NOTIFICATIONS;
import static io.github.suppierk.allocation.jooq.Schema.OUTBOX_NOTIFICATIONS_CREATED_AT;
import static io.github.suppierk.allocation.jooq.Schema.OUTBOX_NOTIFICATIONS_DESTINATION;
import static io.github.suppierk.allocation.jooq.Schema.OUTBOX_NOTIFICATIONS_ID;
import static io.github.suppierk.allocation.jooq.Schema.OUTBOX_NOTIFICATIONS_MESSAGE;

import java.time.OffsetDateTime;
import java.util.UUID;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link Notifications} stored in the {@code outbox_notifications} table for later delivery. */
public final class OutboxNotifications implements Notifications {
  private static final Logger LOG = LoggerFactory.getLogger(OutboxNotifications.class);

  private final DSLContext dsl;

  public OutboxNotifications(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSL context cannot be null");
    }

    this.dsl = dsl;
  }

  @Override
  public void send(final String destination, final String message) {
    final String id = UUID.randomUUID().toString();
    dsl.insertInto(OUTBOX_NOTIFICATIONS)
        .set(OUTBOX_NOTIFICATIONS_ID, id)
        .set(OUTBOX_NOTIFICATIONS_DESTINATION, destination)
        .set(OUTBOX_NOTIFICATIONS_MESSAGE, message)
        .set(OUTBOX_NOTIFICATIONS_CREATED_AT, OffsetDateTime.now())
        .execute();

    LOG.info("Notification {} to {} stored", id, destination);
  }
}
