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

import java.time.LocalDate;

/**
 * Represents an immutable command which must update the underlying model as per CQRS paradigm.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Allocate' instead of 'Set batch
 * reference of the order line'.
 *
 * <p>Each command has exactly one handler. If that handler fails, the failure reaches whoever
 * called {@link MessageBus#handle(Message)}.
 */
public sealed interface Command extends Message
    permits Command.CreateBatch,
        Command.Allocate,
        Command.Deallocate,
        Command.ChangeBatchQuantity {

  /** {@inheritDoc} */
  @Override
  default Kind kind() {
    return Kind.COMMAND;
  }

  /**
   * Registers a new batch of stock.
   *
   * @param reference unique batch reference
   * @param sku of the product the batch contains
   * @param qty purchased quantity
   * @param eta expected arrival date, {@code null} when the batch is already in the warehouse
   */
  record CreateBatch(String reference, String sku, int qty, LocalDate eta) implements Command {
    public CreateBatch {
      Messages.requireText(reference, "Batch reference");
      Messages.requireText(sku, "SKU");
      Messages.requirePositive(qty, "Quantity");
    }

    public CreateBatch(String reference, String sku, int qty) {
      this(reference, sku, qty, null);
    }
  }

  /**
   * Asks to allocate an order line to one of the batches of its product.
   *
   * @param orderId of the order the line belongs to
   * @param sku of the ordered product
   * @param qty ordered quantity
   */
  record Allocate(String orderId, String sku, int qty) implements Command {
    public Allocate {
      Messages.requireText(orderId, "Order ID");
      Messages.requireText(sku, "SKU");
      Messages.requirePositive(qty, "Quantity");
    }
  }

  /**
   * Asks to release the stock held by an order line.
   *
   * @param orderId of the order the line belongs to
   * @param sku of the ordered product
   */
  record Deallocate(String orderId, String sku) implements Command {
    public Deallocate {
      Messages.requireText(orderId, "Order ID");
      Messages.requireText(sku, "SKU");
    }
  }

  /**
   * Reports that a batch turned out to be smaller (or bigger) than purchased.
   *
   * @param reference of the batch
   * @param qty new purchased quantity, may be zero
   */
  record ChangeBatchQuantity(String reference, int qty) implements Command {
    public ChangeBatchQuantity {
      Messages.requireText(reference, "Batch reference");
      if (qty < 0) {
        throw new IllegalArgumentException("Quantity cannot be negative");
      }
    }
  }
}
