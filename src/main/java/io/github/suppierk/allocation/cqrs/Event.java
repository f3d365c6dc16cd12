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

package io.github.suppierk.allocation.cqrs;

/**
 * Represents a fact which already happened in the system.
 *
 * <p>Events may have zero, one or many handlers. A failure of one handler is logged by the {@link
 * MessageBus} and never stops other handlers of the same event.
 */
public sealed interface Event extends Message
    permits Event.Allocated, Event.Deallocated, Event.OutOfStock {

  /** {@inheritDoc} */
  @Override
  default Kind kind() {
    return Kind.EVENT;
  }

  /**
   * An order line was allocated to a batch.
   *
   * @param orderId of the order the line belongs to
   * @param sku of the ordered product
   * @param qty allocated quantity
   * @param batchReference of the batch holding the stock
   */
  record Allocated(String orderId, String sku, int qty, String batchReference) implements Event {
    public Allocated {
      Messages.requireText(orderId, "Order ID");
      Messages.requireText(sku, "SKU");
      Messages.requirePositive(qty, "Quantity");
      Messages.requireText(batchReference, "Batch reference");
    }
  }

  /**
   * An order line lost its allocation.
   *
   * @param orderId of the order the line belongs to
   * @param sku of the ordered product
   * @param qty released quantity
   */
  record Deallocated(String orderId, String sku, int qty) implements Event {
    public Deallocated {
      Messages.requireText(orderId, "Order ID");
      Messages.requireText(sku, "SKU");
      Messages.requirePositive(qty, "Quantity");
    }
  }

  /**
   * No batch of the product could take an order line.
   *
   * @param sku of the product
   */
  record OutOfStock(String sku) implements Event {
    public OutOfStock {
      Messages.requireText(sku, "SKU");
    }
  }
}
