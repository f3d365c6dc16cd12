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

import io.github.suppierk.allocation.cqrs.Event;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Aggregate root owning every {@link Batch} of one SKU.
 *
 * <p>All changes to batches go through the product, which records the {@link Event}s describing
 * them and bumps {@link #getVersionNumber()} so that concurrent writers can be detected when the
 * product is saved.
 */
public final class Product {
  private final String sku;
  private final List<Batch> batches;
  private final List<Event> events;
  private Consumer<Event> eventSink;
  private int versionNumber;

  public Product(final String sku) {
    this(sku, List.of(), 0);
  }

  public Product(final String sku, final Collection<Batch> batches, final int versionNumber) {
    if (sku == null || sku.isBlank()) {
      throw new IllegalArgumentException("SKU cannot be blank");
    }
    if (batches == null) {
      throw new IllegalArgumentException("Batches cannot be null");
    }

    this.sku = sku;
    this.batches = new ArrayList<>();
    this.events = new ArrayList<>();
    this.versionNumber = versionNumber;

    batches.forEach(this::attach);
  }

  public String getSku() {
    return sku;
  }

  public List<Batch> getBatches() {
    return Collections.unmodifiableList(batches);
  }

  public int getVersionNumber() {
    return versionNumber;
  }

  public Optional<Batch> findBatch(final String reference) {
    return batches.stream().filter(batch -> batch.getReference().equals(reference)).findFirst();
  }

  /**
   * @param batch to add
   * @throws IllegalArgumentException if the batch belongs to another SKU or is already present
   */
  public void addBatch(final Batch batch) {
    attach(batch);
    versionNumber++;
  }

  /**
   * Allocates the line to the preferred batch which can take it.
   *
   * <p>An order which already holds this product stays where it is and no event is recorded.
   *
   * @param line to allocate
   * @return reference of the batch holding the line
   * @throws OutOfStockException if no batch can take the line
   */
  public String allocate(final OrderLine line) {
    verifySku(line.sku());

    final Optional<Batch> current =
        batches.stream()
            .filter(batch -> batch.findAllocation(line.orderId()).isPresent())
            .findFirst();
    if (current.isPresent()) {
      return current.get().getReference();
    }

    final Batch batch =
        preferredBatchFor(line, null).orElseThrow(() -> new OutOfStockException(sku));

    batch.allocate(line);
    versionNumber++;
    raise(new Event.Allocated(line.orderId(), sku, line.qty(), batch.getReference()));
    return batch.getReference();
  }

  /**
   * Releases whatever the order holds of this product. Does nothing if the order holds nothing.
   *
   * @param orderId of the order line
   * @return the released line
   */
  public Optional<OrderLine> deallocate(final String orderId) {
    for (Batch batch : batches) {
      final Optional<OrderLine> released = batch.deallocate(orderId);
      if (released.isPresent()) {
        final OrderLine line = released.get();
        versionNumber++;
        raise(new Event.Deallocated(line.orderId(), line.sku(), line.qty()));
        return released;
      }
    }

    return Optional.empty();
  }

  /**
   * Changes the purchased quantity of a batch.
   *
   * <p>When the batch no longer holds what was allocated to it, lines are released from it, newest
   * first, and moved to other batches. A line which fits nowhere is dropped and reported with
   * {@link Event.OutOfStock}.
   *
   * @param reference of the batch
   * @param qty new purchased quantity
   * @throws IllegalArgumentException if the product has no such batch
   */
  public void changeBatchQuantity(final String reference, final int qty) {
    final Batch batch =
        findBatch(reference)
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "Product %s has no batch %s".formatted(sku, reference)));

    batch.changePurchasedQuantity(qty);
    versionNumber++;

    final List<OrderLine> displaced = new ArrayList<>();
    while (batch.availableQuantity() < 0) {
      final OrderLine line = batch.deallocateOne();
      displaced.add(line);
      raise(new Event.Deallocated(line.orderId(), line.sku(), line.qty()));
    }

    for (OrderLine line : displaced) {
      final Optional<Batch> replacement = preferredBatchFor(line, batch);
      if (replacement.isPresent()) {
        replacement.get().allocate(line);
        raise(
            new Event.Allocated(
                line.orderId(), sku, line.qty(), replacement.get().getReference()));
      } else {
        raise(new Event.OutOfStock(sku));
      }
    }
  }

  /**
   * Sends pending events and every event raised from now on to the sink instead of keeping them.
   *
   * @param sink receiving events in the order they are raised
   */
  public void attachEventSink(final Consumer<Event> sink) {
    if (sink == null) {
      throw new IllegalArgumentException("Event sink cannot be null");
    }

    drainEvents().forEach(sink);
    eventSink = sink;
  }

  /** Keeps events raised from now on until {@link #drainEvents()}. */
  public void detachEventSink() {
    eventSink = null;
  }

  /**
   * @return events recorded since the previous call, oldest first
   */
  public List<Event> drainEvents() {
    final List<Event> drained = List.copyOf(events);
    events.clear();
    return drained;
  }

  private void raise(final Event event) {
    if (eventSink == null) {
      events.add(event);
    } else {
      eventSink.accept(event);
    }
  }

  private Optional<Batch> preferredBatchFor(final OrderLine line, final Batch excluded) {
    return batches.stream()
        .filter(batch -> !batch.equals(excluded))
        .filter(batch -> batch.canAllocate(line))
        .min(Batch.PREFERENCE_ORDER);
  }

  private void attach(final Batch batch) {
    if (batch == null) {
      throw new IllegalArgumentException("Batch cannot be null");
    }

    verifySku(batch.getSku());

    if (findBatch(batch.getReference()).isPresent()) {
      throw new IllegalArgumentException(
          "Batch %s already exists".formatted(batch.getReference()));
    }

    batches.add(batch);
  }

  private void verifySku(final String otherSku) {
    if (!sku.equals(otherSku)) {
      throw new IllegalArgumentException(
          "SKU %s does not belong to product %s".formatted(otherSku, sku));
    }
  }

  @Override
  public String toString() {
    return "Product[" + sku + ", version " + versionNumber + "]";
  }
}
