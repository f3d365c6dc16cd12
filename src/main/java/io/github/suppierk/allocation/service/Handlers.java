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

package io.github.suppierk.allocation.service;

import static io.github.suppierk.allocation.service.DependencyNames.PUBLISH;
import static io.github.suppierk.allocation.service.DependencyNames.SEND_MAIL;
import static io.github.suppierk.allocation.service.DependencyNames.UNIT_OF_WORK;

import io.github.suppierk.allocation.async.EventPublisher;
import io.github.suppierk.allocation.async.Notifications;
import io.github.suppierk.allocation.cqrs.Command;
import io.github.suppierk.allocation.cqrs.Dependency;
import io.github.suppierk.allocation.cqrs.Event;
import io.github.suppierk.allocation.domain.Batch;
import io.github.suppierk.allocation.domain.OrderLine;
import io.github.suppierk.allocation.domain.Product;
import io.github.suppierk.allocation.readmodel.AllocationRecord;
import io.github.suppierk.allocation.unitofwork.UnitOfWork;

/**
 * Handlers of every {@link Command} and {@link Event} of the allocation service.
 *
 * <p>Each handler takes the message first and declares its collaborators afterwards; {@link
 * HandlerRegistry} lists which handler serves which message, the bootstrap binds collaborators.
 */
public final class Handlers {
  /** Channel allocations are published to. */
  public static final String LINE_ALLOCATED_CHANNEL = "line_allocated";

  /** Who hears about products running out of stock. */
  public static final String STOCK_DESTINATION = "stock@made.com";

  private Handlers() {
    // No instance
  }

  public static void addBatch(
      final Command.CreateBatch command, @Dependency(UNIT_OF_WORK) final UnitOfWork unitOfWork) {
    unitOfWork.transaction(
        transaction -> {
          final Product product =
              transaction
                  .products()
                  .get(command.sku())
                  .orElseGet(
                      () -> {
                        final Product created = new Product(command.sku());
                        transaction.products().add(created);
                        return created;
                      });

          product.addBatch(
              new Batch(command.reference(), command.sku(), command.qty(), command.eta()));
        });
  }

  /**
   * @throws InvalidSkuException if the product does not exist
   * @throws io.github.suppierk.allocation.domain.OutOfStockException if no batch can take the line
   */
  public static void allocate(
      final Command.Allocate command, @Dependency(UNIT_OF_WORK) final UnitOfWork unitOfWork) {
    final OrderLine line = new OrderLine(command.orderId(), command.sku(), command.qty());

    unitOfWork.transaction(
        transaction ->
            transaction
                .products()
                .get(line.sku())
                .orElseThrow(() -> new InvalidSkuException(line.sku()))
                .allocate(line));
  }

  /**
   * @throws InvalidSkuException if the product does not exist
   */
  public static void deallocate(
      final Command.Deallocate command, @Dependency(UNIT_OF_WORK) final UnitOfWork unitOfWork) {
    unitOfWork.transaction(
        transaction ->
            transaction
                .products()
                .get(command.sku())
                .orElseThrow(() -> new InvalidSkuException(command.sku()))
                .deallocate(command.orderId()));
  }

  /**
   * @throws UnknownBatchException if the batch does not exist
   */
  public static void changeBatchQuantity(
      final Command.ChangeBatchQuantity command,
      @Dependency(UNIT_OF_WORK) final UnitOfWork unitOfWork) {
    unitOfWork.transaction(
        transaction ->
            transaction
                .products()
                .getByBatchReference(command.reference())
                .orElseThrow(() -> new UnknownBatchException(command.reference()))
                .changeBatchQuantity(command.reference(), command.qty()));
  }

  public static void publishAllocatedEvent(
      final Event.Allocated event, @Dependency(PUBLISH) final EventPublisher publisher) {
    publisher.publish(LINE_ALLOCATED_CHANNEL, event);
  }

  public static void sendOutOfStockNotification(
      final Event.OutOfStock event, @Dependency(SEND_MAIL) final Notifications notifications) {
    notifications.send(STOCK_DESTINATION, "Out of stock for %s".formatted(event.sku()));
  }

  public static void addAllocationToReadModel(
      final Event.Allocated event, @Dependency(UNIT_OF_WORK) final UnitOfWork unitOfWork) {
    unitOfWork.transaction(
        transaction ->
            transaction
                .readModel()
                .add(new AllocationRecord(event.orderId(), event.sku(), event.batchReference())));
  }

  public static void removeAllocationFromReadModel(
      final Event.Deallocated event, @Dependency(UNIT_OF_WORK) final UnitOfWork unitOfWork) {
    unitOfWork.transaction(
        transaction -> transaction.readModel().remove(event.orderId(), event.sku()));
  }
}
