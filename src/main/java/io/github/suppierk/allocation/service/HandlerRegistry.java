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

package io.github.suppierk.allocation.service;

import io.github.suppierk.allocation.cqrs.Command;
import io.github.suppierk.allocation.cqrs.Event;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declares which {@link Handlers} method serves which message.
 *
 * <p>The order of event handlers matters: it is the order in which their side effects happen.
 */
public final class HandlerRegistry {
  private static final Map<Class<? extends Command>, Method> COMMAND_HANDLERS;
  private static final Map<Class<? extends Event>, List<Method>> EVENT_HANDLERS;

  static {
    final Map<Class<? extends Command>, Method> commandHandlers = new LinkedHashMap<>();
    commandHandlers.put(Command.CreateBatch.class, handler("addBatch"));
    commandHandlers.put(Command.Allocate.class, handler("allocate"));
    commandHandlers.put(Command.Deallocate.class, handler("deallocate"));
    commandHandlers.put(Command.ChangeBatchQuantity.class, handler("changeBatchQuantity"));
    COMMAND_HANDLERS = Collections.unmodifiableMap(commandHandlers);

    final Map<Class<? extends Event>, List<Method>> eventHandlers = new LinkedHashMap<>();
    eventHandlers.put(
        Event.Allocated.class,
        List.of(handler("publishAllocatedEvent"), handler("addAllocationToReadModel")));
    eventHandlers.put(Event.Deallocated.class, List.of(handler("removeAllocationFromReadModel")));
    eventHandlers.put(Event.OutOfStock.class, List.of(handler("sendOutOfStockNotification")));
    EVENT_HANDLERS = Collections.unmodifiableMap(eventHandlers);
  }

  private HandlerRegistry() {
    // No instance
  }

  /**
   * @return command type to its only handler
   */
  public static Map<Class<? extends Command>, Method> commandHandlers() {
    return COMMAND_HANDLERS;
  }

  /**
   * @return event type to its handlers, in invocation order
   */
  public static Map<Class<? extends Event>, List<Method>> eventHandlers() {
    return EVENT_HANDLERS;
  }

  private static Method handler(final String name) {
    final List<Method> candidates =
        Arrays.stream(Handlers.class.getDeclaredMethods())
            .filter(method -> method.getName().equals(name))
            .filter(method -> Modifier.isPublic(method.getModifiers()))
            .toList();

    if (candidates.size() != 1) {
      throw new IllegalStateException(
          "Expected exactly one handler named '%s', found %d".formatted(name, candidates.size()));
    }

    return candidates.get(0);
  }
}
