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

package io.github.suppierk.allocation.async;

import io.github.suppierk.allocation.cqrs.Event;

/**
 * Abstract contract for an entity which is able to publish {@link Event}s for consumption by other
 * systems.
 *
 * <p>Delivery is at-least-once: subscribers must tolerate duplicates, and the order of events
 * across process restarts is not guaranteed.
 */
@FunctionalInterface
public interface EventPublisher {
  /**
   * @param channel to publish to
   * @param event to publish
   */
  void publish(String channel, Event event);
}
