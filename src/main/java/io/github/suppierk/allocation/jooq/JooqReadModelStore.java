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

import static io.github.suppierk.allocation.jooq.Schema.ALLOCATIONS_VIEW;
import static io.github.suppierk.allocation.jooq.Schema.ALLOCATIONS_VIEW_BATCH_REFERENCE;
import static io.github.suppierk.allocation.jooq.Schema.ALLOCATIONS_VIEW_ORDER_ID;
import static io.github.suppierk.allocation.jooq.Schema.ALLOCATIONS_VIEW_SKU;
import static io.github.suppierk.allocation.jooq.Schema.KNOWN_ORDERS;
import static io.github.suppierk.allocation.jooq.Schema.KNOWN_ORDERS_ORDER_ID;

import io.github.suppierk.allocation.readmodel.AllocationRecord;
import io.github.suppierk.allocation.readmodel.OrderAllocation;
import io.github.suppierk.allocation.readmodel.ReadModelStore;
import java.util.List;
import org.jooq.DSLContext;

/** {@link ReadModelStore} over the {@code allocations_view} and {@code known_orders} tables. */
final class JooqReadModelStore implements ReadModelStore {
  private final DSLContext dsl;

  JooqReadModelStore(final DSLContext dsl) {
    this.dsl = dsl;
  }

  @Override
  public boolean add(final AllocationRecord record) {
    if (record == null) {
      throw new IllegalArgumentException("Record cannot be null");
    }

    if (!knowsOrder(record.orderId())) {
      dsl.insertInto(KNOWN_ORDERS).set(KNOWN_ORDERS_ORDER_ID, record.orderId()).execute();
    }

    final boolean present =
        dsl.fetchExists(
            ALLOCATIONS_VIEW,
            ALLOCATIONS_VIEW_ORDER_ID
                .eq(record.orderId())
                .and(ALLOCATIONS_VIEW_SKU.eq(record.sku())));

    if (present) {
      return false;
    }

    return dsl.insertInto(ALLOCATIONS_VIEW)
            .set(ALLOCATIONS_VIEW_ORDER_ID, record.orderId())
            .set(ALLOCATIONS_VIEW_SKU, record.sku())
            .set(ALLOCATIONS_VIEW_BATCH_REFERENCE, record.batchReference())
            .execute()
        > 0;
  }

  @Override
  public boolean remove(final String orderId, final String sku) {
    return dsl.deleteFrom(ALLOCATIONS_VIEW)
            .where(ALLOCATIONS_VIEW_ORDER_ID.eq(orderId))
            .and(ALLOCATIONS_VIEW_SKU.eq(sku))
            .execute()
        > 0;
  }

  @Override
  public List<OrderAllocation> findByOrderId(final String orderId) {
    return dsl.select(ALLOCATIONS_VIEW_SKU, ALLOCATIONS_VIEW_BATCH_REFERENCE)
        .from(ALLOCATIONS_VIEW)
        .where(ALLOCATIONS_VIEW_ORDER_ID.eq(orderId))
        .orderBy(ALLOCATIONS_VIEW_SKU)
        .fetch(row -> new OrderAllocation(row.value1(), row.value2()));
  }

  @Override
  public boolean knowsOrder(final String orderId) {
    return dsl.fetchExists(KNOWN_ORDERS, KNOWN_ORDERS_ORDER_ID.eq(orderId));
  }

  @Override
  public void clear() {
    dsl.deleteFrom(ALLOCATIONS_VIEW).execute();
    dsl.deleteFrom(KNOWN_ORDERS).execute();
  }
}
