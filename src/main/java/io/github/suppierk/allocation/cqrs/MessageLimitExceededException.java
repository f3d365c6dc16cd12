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

import java.io.Serial;

/**
 * Thrown when a single {@link MessageBus#handle(Message)} call keeps producing messages beyond the
 * configured limit, which usually means two handlers trigger each other in a cycle.
 */
public class MessageLimitExceededException extends RuntimeException {
  @Serial private static final long serialVersionUID = -6321180440979712263L;

  public MessageLimitExceededException(final Message origin, final int limit) {
    super("Handling %s produced more than %d messages".formatted(origin, limit));
  }
}
