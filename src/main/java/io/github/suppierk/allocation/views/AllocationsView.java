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

package io.github.suppierk.allocation.views;

import io.github.suppierk.allocation.cqrs.Event;
import io.github.suppierk.allocation.readmodel.AllocationRecord;
import io.github.suppierk.allocation.readmodel.OrderAllocation;
import io.github.suppierk.allocation.readmodel.ReadModelStore;
import io.github.suppierk.allocation.unitofwork.UnitOfWork;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read side of the allocations: queries against the projection only, never against products.
 *
 * <p>The projection can lag behind the write model, or miss updates if the process stopped between
 * a write and the projection update. {@link #rebuild(Iterable, UnitOfWork)} restores it from the
 * event history.
 */
public final class AllocationsView {
  private static final Logger LOG = LoggerFactory.getLogger(AllocationsView.class);

  private AllocationsView() {
    // No instance
  }

  /**
   * @param orderId of the order
   * @param unitOfWork to read through
   * @return allocations of the order, empty if the order has none or is unknown
   */
  public static List<OrderAllocation> allocationsForOrder(
      final String orderId, final UnitOfWork unitOfWork) {
    if (orderId == null) {
      throw new IllegalArgumentException("Order ID cannot be null");
    }

    return unitOfWork.transactionResult(
        transaction -> List.copyOf(transaction.readModel().findByOrderId(orderId)));
  }

  /**
   * @param orderId of the order
   * @param unitOfWork to read through
   * @return {@code true} if the order ever had an allocation, even if it holds none now
   */
  public static boolean isKnownOrder(final String orderId, final UnitOfWork unitOfWork) {
    if (orderId == null) {
      throw new IllegalArgumentException("Order ID cannot be null");
    }

    return unitOfWork.transactionResult(transaction -> transaction.readModel().knowsOrder(orderId));
  }

  /**
   * Empties the projection and replays the history into it, in one transaction.
   *
   * <p>Events other than {@link Event.Allocated} and {@link Event.Deallocated} are ignored.
   *
   * @param history of events, oldest first
   * @param unitOfWork to write through
   */
  public static void rebuild(final Iterable<? extends Event> history, final UnitOfWork unitOfWork) {
    if (history == null) {
      throw new IllegalArgumentException("History cannot be null");
    }

    unitOfWork.transaction(
        transaction -> {
          final ReadModelStore store = transaction.readModel();
          store.clear();

          int replayed = 0;
          for (Event event : history) {
            if (event instanceof Event.Allocated allocated) {
              store.add(
                  new AllocationRecord(
                      allocated.orderId(), allocated.sku(), allocated.batchReference()));
              replayed++;
            } else if (event instanceof Event.Deallocated deallocated) {
              store.remove(deallocated.orderId(), deallocated.sku());
              replayed++;
            }
          }

          LOG.info("Rebuilt allocations view from {} events", replayed);
        });
  }
}
