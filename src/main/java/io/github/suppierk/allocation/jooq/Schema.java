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

package io.github.suppierk.allocation.jooq;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.primaryKey;
import static org.jooq.impl.DSL.table;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.SQLDataType;

/**
 * Tables and columns of the allocation database, declared with the plain SQL API so that no code
 * generation step is needed.
 *
 * <p>Write-side tables ({@code products}, {@code batches}, {@code allocations}) and the read-side
 * table ({@code allocations_view}) share no keys: the view only copies identifiers.
 */
public final class Schema {
  public static final Table<Record> PRODUCTS = table(name("products"));
  public static final Field<String> PRODUCTS_SKU =
      field(name("sku"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<Integer> PRODUCTS_VERSION_NUMBER =
      field(name("version_number"), SQLDataType.INTEGER.nullable(false));

  public static final Table<Record> BATCHES = table(name("batches"));
  public static final Field<String> BATCHES_REFERENCE =
      field(name("reference"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<String> BATCHES_SKU =
      field(name("sku"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<Integer> BATCHES_PURCHASED_QUANTITY =
      field(name("purchased_quantity"), SQLDataType.INTEGER.nullable(false));
  public static final Field<LocalDate> BATCHES_ETA =
      field(name("eta"), SQLDataType.LOCALDATE.nullable(true));

  public static final Table<Record> ALLOCATIONS = table(name("allocations"));
  public static final Field<String> ALLOCATIONS_ORDER_ID =
      field(name("order_id"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<String> ALLOCATIONS_SKU =
      field(name("sku"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<String> ALLOCATIONS_BATCH_REFERENCE =
      field(name("batch_reference"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<Integer> ALLOCATIONS_QTY =
      field(name("qty"), SQLDataType.INTEGER.nullable(false));
  public static final Field<Integer> ALLOCATIONS_POSITION =
      field(name("line_position"), SQLDataType.INTEGER.nullable(false));

  public static final Table<Record> ALLOCATIONS_VIEW = table(name("allocations_view"));
  public static final Field<String> ALLOCATIONS_VIEW_ORDER_ID =
      field(name("order_id"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<String> ALLOCATIONS_VIEW_SKU =
      field(name("sku"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<String> ALLOCATIONS_VIEW_BATCH_REFERENCE =
      field(name("batch_reference"), SQLDataType.VARCHAR(255).nullable(false));

  public static final Table<Record> KNOWN_ORDERS = table(name("known_orders"));
  public static final Field<String> KNOWN_ORDERS_ORDER_ID =
      field(name("order_id"), SQLDataType.VARCHAR(255).nullable(false));

  public static final Table<Record> OUTBOX_EVENTS = table(name("outbox_events"));
  public static final Field<String> OUTBOX_EVENTS_ID =
      field(name("id"), SQLDataType.VARCHAR(36).nullable(false));
  public static final Field<String> OUTBOX_EVENTS_CHANNEL =
      field(name("channel"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<String> OUTBOX_EVENTS_TYPE =
      field(name("event_type"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<String> OUTBOX_EVENTS_PAYLOAD =
      field(name("payload"), SQLDataType.CLOB.nullable(false));
  public static final Field<OffsetDateTime> OUTBOX_EVENTS_CREATED_AT =
      field(name("created_at"), SQLDataType.TIMESTAMPWITHTIMEZONE.nullable(false));

  public static final Table<Record> OUTBOX_NOTIFICATIONS = table(name("outbox_notifications"));
  public static final Field<String> OUTBOX_NOTIFICATIONS_ID =
      field(name("id"), SQLDataType.VARCHAR(36).nullable(false));
  public static final Field<String> OUTBOX_NOTIFICATIONS_DESTINATION =
      field(name("destination"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<String> OUTBOX_NOTIFICATIONS_MESSAGE =
      field(name("message"), SQLDataType.CLOB.nullable(false));
  public static final Field<OffsetDateTime> OUTBOX_NOTIFICATIONS_CREATED_AT =
      field(name("created_at"), SQLDataType.TIMESTAMPWITHTIMEZONE.nullable(false));

  private Schema() {
    // No instance
  }

  /**
   * @return every table, write side first
   */
  public static List<Table<Record>> tables() {
    return List.of(
        PRODUCTS,
        BATCHES,
        ALLOCATIONS,
        ALLOCATIONS_VIEW,
        KNOWN_ORDERS,
        OUTBOX_EVENTS,
        OUTBOX_NOTIFICATIONS);
  }

  /**
   * Creates missing tables. Existing tables are left untouched.
   *
   * @param dsl to create tables with
   */
  public static void install(final DSLContext dsl) {
    dsl.createTableIfNotExists(PRODUCTS)
        .columns(PRODUCTS_SKU, PRODUCTS_VERSION_NUMBER)
        .constraints(primaryKey(PRODUCTS_SKU))
        .execute();

    dsl.createTableIfNotExists(BATCHES)
        .columns(BATCHES_REFERENCE, BATCHES_SKU, BATCHES_PURCHASED_QUANTITY, BATCHES_ETA)
        .constraints(primaryKey(BATCHES_REFERENCE))
        .execute();

    dsl.createTableIfNotExists(ALLOCATIONS)
        .columns(
            ALLOCATIONS_ORDER_ID,
            ALLOCATIONS_SKU,
            ALLOCATIONS_BATCH_REFERENCE,
            ALLOCATIONS_QTY,
            ALLOCATIONS_POSITION)
        .constraints(primaryKey(ALLOCATIONS_ORDER_ID, ALLOCATIONS_SKU))
        .execute();

    dsl.createTableIfNotExists(ALLOCATIONS_VIEW)
        .columns(
            ALLOCATIONS_VIEW_ORDER_ID, ALLOCATIONS_VIEW_SKU, ALLOCATIONS_VIEW_BATCH_REFERENCE)
        .constraints(primaryKey(ALLOCATIONS_VIEW_ORDER_ID, ALLOCATIONS_VIEW_SKU))
        .execute();

    dsl.createTableIfNotExists(KNOWN_ORDERS)
        .columns(KNOWN_ORDERS_ORDER_ID)
        .constraints(primaryKey(KNOWN_ORDERS_ORDER_ID))
        .execute();

    dsl.createTableIfNotExists(OUTBOX_EVENTS)
        .columns(
            OUTBOX_EVENTS_ID,
            OUTBOX_EVENTS_CHANNEL,
            OUTBOX_EVENTS_TYPE,
            OUTBOX_EVENTS_PAYLOAD,
            OUTBOX_EVENTS_CREATED_AT)
        .constraints(primaryKey(OUTBOX_EVENTS_ID))
        .execute();

    dsl.createTableIfNotExists(OUTBOX_NOTIFICATIONS)
        .columns(
            OUTBOX_NOTIFICATIONS_ID,
            OUTBOX_NOTIFICATIONS_DESTINATION,
            OUTBOX_NOTIFICATIONS_MESSAGE,
            OUTBOX_NOTIFICATIONS_CREATED_AT)
        .constraints(primaryKey(OUTBOX_NOTIFICATIONS_ID))
        .execute();
  }
}
