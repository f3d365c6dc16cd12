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

package io.github.suppierk.allocation.entrypoints;

import io.github.suppierk.allocation.cqrs.Command;
import io.github.suppierk.allocation.cqrs.MessageBus;
import io.github.suppierk.allocation.domain.DomainException;
import io.github.suppierk.allocation.readmodel.OrderAllocation;
import io.github.suppierk.allocation.unitofwork.UnitOfWork;
import io.github.suppierk.allocation.views.AllocationsView;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request handling of the allocation API, kept free of any web framework: each method maps to one
 * route and answers with a status code and a body.
 *
 * <ul>
 *   <li>{@code POST /add_batch} - {@link #addBatch(String, String, int, LocalDate)}
 *   <li>{@code POST /allocate} - {@link #allocate(String, String, int)}
 *   <li>{@code POST /deallocate} - {@link #deallocate(String, String)}
 *   <li>{@code GET /allocations/{orderId}} - {@link #allocationsFor(String)}
 * </ul>
 */
public final class AllocationEndpoint {
  private static final Logger LOG = LoggerFactory.getLogger(AllocationEndpoint.class);

  private final MessageBus<? extends UnitOfWork> bus;

  public AllocationEndpoint(final MessageBus<? extends UnitOfWork> bus) {
    if (bus == null) {
      throw new IllegalArgumentException("Message bus cannot be null");
    }

    this.bus = bus;
  }

  public Response addBatch(
      final String reference, final String sku, final int qty, final LocalDate eta) {
    return submit(() -> new Command.CreateBatch(reference, sku, qty, eta))
        .orElseGet(() -> new Response(Response.CREATED, "OK"));
  }

  public Response allocate(final String orderId, final String sku, final int qty) {
    return submit(() -> new Command.Allocate(orderId, sku, qty))
        .orElseGet(() -> new Response(Response.ACCEPTED, "OK"));
  }

  public Response deallocate(final String orderId, final String sku) {
    return submit(() -> new Command.Deallocate(orderId, sku))
        .orElseGet(() -> new Response(Response.ACCEPTED, "OK"));
  }

  /**
   * @param orderId of the order
   * @return allocations of the order, possibly empty, or {@link Response#NOT_FOUND} if the order
   *     never had any
   */
  public Response allocationsFor(final String orderId) {
    final List<OrderAllocation> allocations =
        AllocationsView.allocationsForOrder(orderId, bus.unitOfWork());

    if (allocations.isEmpty() && !AllocationsView.isKnownOrder(orderId, bus.unitOfWork())) {
      return new Response(Response.NOT_FOUND, Map.of("message", "not found"));
    }

    return new Response(Response.OK, allocations);
  }

  /**
   * @return empty when the command was handled, the rejection otherwise
   */
  private Optional<Response> submit(final Supplier<Command> command) {
    try {
      bus.handle(command.get());
      return Optional.empty();
    } catch (DomainException | IllegalArgumentException e) {
      LOG.info("Request rejected: {}", e.getMessage());
      return Optional.of(new Response(Response.BAD_REQUEST, Map.of("message", e.getMessage())));
    }
  }
}
