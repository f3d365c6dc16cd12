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

package io.github.suppierk.allocation.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A quantity of a product ordered by the purchasing department, either already in the warehouse or
 * on its way there.
 *
 * <p>Batches are entities: two batches are the same batch if their references match.
 */
public final class Batch {
  /** Batches in the warehouse come first, shipments follow by earliest arrival. */
  public static final Comparator<Batch> PREFERENCE_ORDER =
      Comparator.comparing(Batch::getEta, Comparator.nullsFirst(Comparator.naturalOrder()));

  private final String reference;
  private final String sku;
  private final LocalDate eta;
  private final List<OrderLine> allocations;
  private int purchasedQuantity;

  public Batch(
      final String reference, final String sku, final int purchasedQuantity, final LocalDate eta) {
    if (reference == null || reference.isBlank()) {
      throw new IllegalArgumentException("Batch reference cannot be blank");
    }
    if (sku == null || sku.isBlank()) {
      throw new IllegalArgumentException("SKU cannot be blank");
    }
    if (purchasedQuantity < 0) {
      throw new IllegalArgumentException("Purchased quantity cannot be negative");
    }

    this.reference = reference;
    this.sku = sku;
    this.purchasedQuantity = purchasedQuantity;
    this.eta = eta;
    this.allocations = new ArrayList<>();
  }

  public String getReference() {
    return reference;
  }

  public String getSku() {
    return sku;
  }

  /**
   * @return expected arrival date, {@code null} for stock already in the warehouse
   */
  public LocalDate getEta() {
    return eta;
  }

  public int getPurchasedQuantity() {
    return purchasedQuantity;
  }

  /**
   * @return order lines allocated to this batch, oldest first
   */
  public List<OrderLine> getAllocations() {
    return Collections.unmodifiableList(allocations);
  }

  public int allocatedQuantity() {
    return allocations.stream().mapToInt(OrderLine::qty).sum();
  }

  /**
   * @return quantity left for new allocations, negative when the batch is over-allocated
   */
  public int availableQuantity() {
    return purchasedQuantity - allocatedQuantity();
  }

  public boolean canAllocate(final OrderLine line) {
    return sku.equals(line.sku()) && availableQuantity() >= line.qty();
  }

  /**
   * Adds the line to this batch if there is room for it. Allocating the same line twice has no
   * effect.
   *
   * @param line to allocate
   * @return {@code true} if the line is allocated to this batch afterwards
   */
  public boolean allocate(final OrderLine line) {
    if (allocations.contains(line)) {
      return true;
    }

    if (!canAllocate(line)) {
      return false;
    }

    allocations.add(line);
    return true;
  }

  /**
   * @param orderId of the order line
   * @return the line of the given order if it is allocated here
   */
  public Optional<OrderLine> findAllocation(final String orderId) {
    return allocations.stream().filter(line -> line.orderId().equals(orderId)).findFirst();
  }

  /**
   * @param orderId of the order line to release
   * @return the released line, or empty if the order had nothing allocated here
   */
  public Optional<OrderLine> deallocate(final String orderId) {
    final Optional<OrderLine> line = findAllocation(orderId);
    line.ifPresent(allocations::remove);
    return line;
  }

  /**
   * Releases the most recently allocated line.
   *
   * @return the released line
   * @throws IllegalStateException if nothing is allocated
   */
  OrderLine deallocateOne() {
    if (allocations.isEmpty()) {
      throw new IllegalStateException("Batch %s has no allocations".formatted(reference));
    }

    return allocations.remove(allocations.size() - 1);
  }

  void changePurchasedQuantity(final int purchasedQuantity) {
    if (purchasedQuantity < 0) {
      throw new IllegalArgumentException("Purchased quantity cannot be negative");
    }

    this.purchasedQuantity = purchasedQuantity;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Batch that = (Batch) o;
    return reference.equals(that.reference);
  }

  @Override
  public int hashCode() {
    return Objects.hash(reference);
  }

  @Override
  public String toString() {
    return "Batch[" + reference + "]";
  }
}
