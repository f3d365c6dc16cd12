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

package io.github.suppierk.allocation.bootstrap;

import io.github.suppierk.allocation.unitofwork.UnitOfWork;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Makes sure storage mappings are started at most once per process. */
final class PersistenceMappings {
  private static final Logger LOG = LoggerFactory.getLogger(PersistenceMappings.class);
  private static final AtomicBoolean STARTED = new AtomicBoolean(false);

  private PersistenceMappings() {
    // No instance
  }

  /**
   * @param unitOfWork to start mappings of
   * @return {@code true} if this call started the mappings
   */
  static boolean start(final UnitOfWork unitOfWork) {
    if (!STARTED.compareAndSet(false, true)) {
      LOG.info("Persistence mappings already started, skipping");
      return false;
    }

    try {
      unitOfWork.startMappings();
    } catch (RuntimeException | Error e) {
      STARTED.set(false);
      throw e;
    }

    LOG.info("Persistence mappings started");
    return true;
  }

  static boolean isStarted() {
    return STARTED.get();
  }

  /** Lets the next {@link #start(UnitOfWork)} call start the mappings again. */
  static void reset() {
    STARTED.set(false);
  }
}
