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
 * A handler with all of its collaborators already in place: the only thing left to supply is the
 * {@link Message} itself.
 *
 * <p>Commands and events share this signature, which lets the {@link MessageBus} treat both
 * registries the same way.
 */
@FunctionalInterface
public interface MessageHandler {
  /**
   * @param message to process
   */
  void handle(Message message);

  /**
   * @return the name used to identify this handler in logs
   */
  default String name() {
    return getClass().getSimpleName();
  }
}
