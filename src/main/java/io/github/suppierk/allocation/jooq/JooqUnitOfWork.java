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

import io.github.suppierk.allocation.cqrs.Event;
import io.github.suppierk.allocation.domain.Product;
import io.github.suppierk.allocation.readmodel.ReadModelStore;
import io.github.suppierk.allocation.unitofwork.ProductRepository;
import io.github.suppierk.allocation.unitofwork.UnitOfWork;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UnitOfWork} backed by jOOQ transactions.
 *
 * <p>Products handed out inside a transaction send their events to a buffer of that transaction,
 * so events of several products keep the order they were raised in. The buffer of a committed
 * transaction is kept per thread until {@link #collectNewEvents()} drains it. The buffer of a
 * transaction which rolled back is dropped, so nothing is ever announced about changes that were
 * not saved.
 */
public final class JooqUnitOfWork implements UnitOfWork {
  private static final Logger LOG = LoggerFactory.getLogger(JooqUnitOfWork.class);

  private final DSLContext dsl;
  private final ThreadLocal<List<Event>> committed;

  public JooqUnitOfWork(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSL context cannot be null");
    }

    this.dsl = dsl;
    this.committed = new ThreadLocal<>();
  }

  /**
   * @return the context transactions are started from
   */
  public DSLContext dsl() {
    return dsl;
  }

  @Override
  public <T> T transactionResult(final Function<Transaction, T> work) {
    if (work == null) {
      throw new IllegalArgumentException("Work cannot be null");
    }

    final List<Product> touched = new ArrayList<>();
    final List<Event> raised = new ArrayList<>();
    final Consumer<Product> track =
        product -> {
          touched.add(product);
          product.attachEventSink(raised::add);
        };

    try {
      final T result =
          dsl.transactionResult(
              configuration -> {
                final DSLContext trx = configuration.dsl();
                final JooqProductRepository products = new JooqProductRepository(trx, track);
                final T value =
                    work.apply(new JooqTransaction(products, new JooqReadModelStore(trx)));
                products.flush();
                return value;
              });

      keep(raised);
      return result;
    } catch (RuntimeException | Error e) {
      if (!raised.isEmpty()) {
        LOG.debug("Rolled back transaction dropped {} events", raised.size());
      }

      throw e;
    } finally {
      touched.forEach(Product::detachEventSink);
    }
  }

  @Override
  public List<Event> collectNewEvents() {
    final List<Event> events = committed.get();
    committed.remove();
    return events == null ? List.of() : List.copyOf(events);
  }

  /**
   * @return {@code true} if the current thread has committed events nobody collected yet
   */
  boolean holdsEventsOfCurrentThread() {
    return committed.get() != null;
  }

  private void keep(final List<Event> raised) {
    if (raised.isEmpty()) {
      return;
    }

    List<Event> events = committed.get();
    if (events == null) {
      events = new ArrayList<>();
      committed.set(events);
    }

    events.addAll(raised);
  }

  /** Creates the tables this unit of work needs, if they are missing. */
  @Override
  public void startMappings() {
    Schema.install(dsl);
  }

  private record JooqTransaction(ProductRepository products, ReadModelStore readModel)
      implements Transaction {}
}
