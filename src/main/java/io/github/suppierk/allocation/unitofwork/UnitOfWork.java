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

package io.github.suppierk.allocation.unitofwork;

import io.github.suppierk.allocation.cqrs.EventCollector;
import io.github.suppierk.allocation.readmodel.ReadModelStore;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Transactional boundary used by handlers.
 *
 * <p>The work passed to {@link #transactionResult(Function)} either commits as a whole when it
 * returns normally, or rolls back as a whole when it throws - the exception then reaches the caller
 * unchanged. Events raised by products touched inside a committed transaction are kept until {@link
 * #collectNewEvents()} drains them. Events raised inside a transaction which rolled back are
 * discarded.
 *
 * <p>Implementations must tolerate being shared across threads: each thread works in its own
 * transactions and collects its own events.
 */
public interface UnitOfWork extends EventCollector {
  /**
   * Runs the work in a new transaction.
   *
   * @param work to run
   * @param <T> is the type of the result
   * @return whatever the work returned
   */
  <T> T transactionResult(Function<Transaction, T> work);

  /**
   * Runs the work in a new transaction.
   *
   * @param work to run
   */
  default void transaction(final Consumer<Transaction> work) {
    transactionResult(
        transaction -> {
          work.accept(transaction);
          return Boolean.TRUE;
        });
  }

  /**
   * Prepares the storage this unit of work writes to. Called at most once per process by the
   * bootstrap.
   */
  default void startMappings() {
    // Nothing to prepare by default
  }

  /** Stores available inside a transaction. */
  interface Transaction {
    /**
     * @return the write-side aggregates
     */
    ProductRepository products();

    /**
     * @return the allocations projection
     */
    ReadModelStore readModel();
  }
}
