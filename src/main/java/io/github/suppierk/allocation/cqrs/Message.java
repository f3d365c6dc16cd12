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
 * Describes anything which can travel through the {@link MessageBus}.
 *
 * <p>There are exactly two kinds of messages, and the set is closed on purpose: the bus treats
 * them differently, so each message states its {@link Kind} explicitly rather than letting the bus
 * guess it from the runtime class.
 *
 * <p>Implementations are expected to be Java {@link Record}s - immutable carriers of data without
 * behavior.
 */
public sealed interface Message permits Command, Event {
  /**
   * @return the discriminant the {@link MessageBus} switches on
   */
  Kind kind();

  /** Discriminant of the {@link Message} variants. */
  enum Kind {
    /** An intent to change state, handled by exactly one handler. */
    COMMAND,

    /** A fact which already happened, handled by zero or more handlers. */
    EVENT
  }
}
