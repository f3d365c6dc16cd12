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

import io.github.suppierk.java.Try;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-consumer dispatcher of {@link Command}s and {@link Event}s:
 *
 * <ul>
 *   <li>A {@link Command} goes to exactly one handler. If the handler fails, the failure is
 *       propagated to the caller and the rest of the work is abandoned.
 *   <li>An {@link Event} goes to every handler registered for it, in registration order. A failing
 *       handler is logged and skipped, its siblings still run.
 *   <li>After every handler invocation new events are harvested from the unit of work and put at
 *       the back of the queue, so direct consequences of a message are processed before the
 *       consequences of those consequences.
 * </ul>
 *
 * <p>Each {@link #handle(Message)} call owns its queue, which makes the bus safe to share between
 * threads as long as the unit of work is. Handler tables are immutable after construction.
 *
 * @param <U> is the type of the unit of work handlers were bound to
 */
public final class MessageBus<U extends EventCollector> extends Suspicious {
  /** Default cap on the number of messages a single {@link #handle(Message)} call may process. */
  public static final int DEFAULT_MAX_MESSAGES_PER_CALL = 10_000;

  private static final Logger LOG = LoggerFactory.getLogger(MessageBus.class);

  private final U unitOfWork;
  private final Map<Class<? extends Event>, List<MessageHandler>> eventHandlers;
  private final Map<Class<? extends Command>, MessageHandler> commandHandlers;
  private final int maxMessagesPerCall;

  public MessageBus(
      final U unitOfWork,
      final Map<Class<? extends Event>, List<MessageHandler>> eventHandlers,
      final Map<Class<? extends Command>, MessageHandler> commandHandlers) {
    this(unitOfWork, eventHandlers, commandHandlers, DEFAULT_MAX_MESSAGES_PER_CALL);
  }

  public MessageBus(
      final U unitOfWork,
      final Map<Class<? extends Event>, List<MessageHandler>> eventHandlers,
      final Map<Class<? extends Command>, MessageHandler> commandHandlers,
      final int maxMessagesPerCall) {
    this.unitOfWork = throwIllegalArgumentIfNull(unitOfWork, "Unit of work");
    this.eventHandlers = copyEventHandlers(throwIllegalArgumentIfNull(eventHandlers, "Events"));
    this.commandHandlers =
        Collections.unmodifiableMap(
            new LinkedHashMap<>(throwIllegalArgumentIfNull(commandHandlers, "Commands")));

    if (maxMessagesPerCall <= 0) {
      throw new IllegalArgumentException("Message limit must be positive");
    }
    this.maxMessagesPerCall = maxMessagesPerCall;
  }

  /**
   * @return the unit of work shared by handlers of this bus, also used by read paths
   */
  public U unitOfWork() {
    return unitOfWork;
  }

  /**
   * @param eventType to inspect
   * @return names of the handlers of the given event type, in invocation order
   */
  public List<String> eventHandlerNames(final Class<? extends Event> eventType) {
    return eventHandlers.getOrDefault(eventType, List.of()).stream()
        .map(MessageHandler::name)
        .toList();
  }

  /**
   * @param commandType to inspect
   * @return name of the handler of the given command type
   * @throws UnsupportedOperationException if there is no such handler
   */
  public String commandHandlerName(final Class<? extends Command> commandType) {
    return throwUnsupportedOperationIfNull(
            commandHandlers.get(commandType), "Handler for " + commandType.getSimpleName())
        .name();
  }

  /**
   * Processes the message and everything it causes, returning once the queue is empty.
   *
   * @param message to process
   * @throws IllegalArgumentException if the message is {@code null}
   * @throws UnsupportedOperationException if a command has no handler
   * @throws MessageLimitExceededException if the call produced too many messages
   * @throws RuntimeException thrown by a command handler, as is
   */
  public void handle(final Message message) {
    final Message nonNullMessage = throwIllegalArgumentIfNull(message, "Message");
    final Deque<Message> queue = new ArrayDeque<>();
    queue.add(nonNullMessage);

    int processed = 0;
    while (!queue.isEmpty()) {
      if (++processed > maxMessagesPerCall) {
        queue.clear();
        discardPendingEvents();
        throw new MessageLimitExceededException(nonNullMessage, maxMessagesPerCall);
      }

      final Message next = queue.poll();
      switch (next.kind()) {
        case COMMAND -> handleCommand((Command) next, queue);
        case EVENT -> handleEvent((Event) next, queue);
      }
    }
  }

  private void handleCommand(final Command command, final Deque<Message> queue) {
    LOG.debug("Handling command {}", command);

    final MessageHandler handler =
        throwUnsupportedOperationIfNull(
            commandHandlers.get(command.getClass()),
            "Handler for " + command.getClass().getSimpleName());

    try {
      handler.handle(command);
    } catch (RuntimeException | Error e) {
      LOG.error("Exception handling command {} with handler {}", command, handler.name(), e);
      queue.clear();
      discardPendingEvents();
      throw e;
    }

    queue.addAll(collectNewEvents());
  }

  private void handleEvent(final Event event, final Deque<Message> queue) {
    for (MessageHandler handler : eventHandlers.getOrDefault(event.getClass(), List.of())) {
      LOG.debug("Handling event {} with handler {}", event, handler.name());

      final Try<Event> attempt =
          Try.of(
              () -> {
                handler.handle(event);
                return event;
              });

      attempt.ifFailure(
          reason ->
              LOG.error(
                  "Exception handling event {} with handler {}",
                  event.getClass().getSimpleName(),
                  handler.name(),
                  reason));

      queue.addAll(collectNewEvents());
    }
  }

  private List<Event> collectNewEvents() {
    return throwIllegalStateIfNull(unitOfWork.collectNewEvents(), "Collected events");
  }

  private void discardPendingEvents() {
    final List<Event> discarded = unitOfWork.collectNewEvents();
    if (discarded != null && !discarded.isEmpty()) {
      LOG.debug("Discarded {} events raised before the failure", discarded.size());
    }
  }

  private static Map<Class<? extends Event>, List<MessageHandler>> copyEventHandlers(
      final Map<Class<? extends Event>, List<MessageHandler>> eventHandlers) {
    final Map<Class<? extends Event>, List<MessageHandler>> copy = new LinkedHashMap<>();
    eventHandlers.forEach((type, handlers) -> copy.put(type, List.copyOf(handlers)));
    return Collections.unmodifiableMap(copy);
  }
}
