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

import java.util.List;

/**
 * The part of a unit of work the {@link MessageBus} relies on: harvesting the events domain
 * objects raised while handlers were working with them.
 */
@FunctionalInterface
public interface EventCollector {
  /**
   * Returns every event raised since the previous call, in the order they were raised, and
   * forgets them - an event is returned by exactly one call.
   *
   * @return new events, possibly empty
   */
  List<Event> collectNewEvents();
}
