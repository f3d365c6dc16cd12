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

package io.github.suppierk.allocation.readmodel;

import java.util.List;

/**
 * Storage of the denormalized allocations projection, keyed by order ID and SKU.
 *
 * <p>Rows are only ever inserted and deleted: moving an allocation to another batch is a delete
 * followed by an insert. Orders which ever had an allocation stay known after their last row is
 * deleted, so an order without allocations can be told apart from an order nobody placed.
 */
public interface ReadModelStore {
  /**
   * Inserts the record unless a record for the same order ID and SKU is already present. The order
   * of the record becomes known either way.
   *
   * @param record to insert
   * @return {@code true} if the record was inserted
   */
  boolean add(AllocationRecord record);

  /**
   * Deletes the record of the given order ID and SKU. Deleting a missing record is not an error.
   *
   * @param orderId of the order
   * @param sku of the product
   * @return {@code true} if a record was deleted
   */
  boolean remove(String orderId, String sku);

  /**
   * @param orderId of the order
   * @return allocations of the order, empty if there are none
   */
  List<OrderAllocation> findByOrderId(String orderId);

  /**
   * @param orderId of the order
   * @return {@code true} if a record of the order was ever added since the last {@link #clear()}
   */
  boolean knowsOrder(String orderId);

  /** Deletes every record and forgets every known order. */
  void clear();
}
