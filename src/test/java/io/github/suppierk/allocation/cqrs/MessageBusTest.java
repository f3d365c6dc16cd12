package io.github.suppierk.allocation.cqrs;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MessageBusTest {
  static final Command.Allocate ALLOCATE = new Command.Allocate("o1", "LAMP", 1);
  static final Event.Allocated ALLOCATED = new Event.Allocated("o1", "LAMP", 1, "b1");
  static final Event.OutOfStock OUT_OF_STOCK = new Event.OutOfStock("LAMP");
  static final Event.Deallocated DEALLOCATED = new Event.Deallocated("o1", "LAMP", 1);

  ScriptedCollector collector;
  List<String> handled;
  Map<Class<? extends Event>, List<MessageHandler>> eventHandlers;
  Map<Class<? extends Command>, MessageHandler> commandHandlers;

  @BeforeEach
  void setUp() {
    collector = new ScriptedCollector();
    handled = new ArrayList<>();
    eventHandlers = new LinkedHashMap<>();
    commandHandlers = new LinkedHashMap<>();
  }

  MessageHandler recording(String name, Event... raises) {
    return new NamedHandler(
        name,
        message -> {
          handled.add(name);
          collector.raise(raises);
        });
  }

  MessageBus<ScriptedCollector> bus() {
    return new MessageBus<>(collector, eventHandlers, commandHandlers);
  }

  @Nested
  class Create {
    @Test
    void when_unit_of_work_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () -> new MessageBus<ScriptedCollector>(null, eventHandlers, commandHandlers));
    }

    @Test
    void when_handler_tables_are_null_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class, () -> new MessageBus<>(collector, null, commandHandlers));
      assertThrows(
          IllegalArgumentException.class, () -> new MessageBus<>(collector, eventHandlers, null));
    }

    @Test
    void when_message_limit_is_not_positive_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () -> new MessageBus<>(collector, eventHandlers, commandHandlers, 0));
    }

    @Test
    void later_changes_to_handler_tables_do_not_affect_the_bus() {
      commandHandlers.put(Command.Allocate.class, recording("allocate"));
      final var bus = bus();
      commandHandlers.clear();

      bus.handle(ALLOCATE);

      assertEquals(List.of("allocate"), handled);
    }
  }

  @Nested
  class Commands {
    @Test
    void when_message_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> bus().handle(null));
    }

    @Test
    void when_command_has_no_handler_unsupported_operation_exception_is_thrown() {
      assertThrows(UnsupportedOperationException.class, () -> bus().handle(ALLOCATE));
    }

    @Test
    void when_command_is_handled_its_events_are_handled_afterwards() {
      commandHandlers.put(Command.Allocate.class, recording("allocate", ALLOCATED));
      eventHandlers.put(Event.Allocated.class, List.of(recording("publish"), recording("view")));

      bus().handle(ALLOCATE);

      assertEquals(List.of("allocate", "publish", "view"), handled);
    }

    @Test
    void when_command_handler_fails_the_same_exception_reaches_the_caller() {
      final var failure = new IllegalStateException("boom");
      commandHandlers.put(
          Command.Allocate.class,
          new NamedHandler(
              "allocate",
              message -> {
                collector.raise(ALLOCATED);
                throw failure;
              }));
      eventHandlers.put(Event.Allocated.class, List.of(recording("publish")));

      final var thrown = assertThrows(IllegalStateException.class, () -> bus().handle(ALLOCATE));

      assertSame(failure, thrown);
      assertTrue(handled.isEmpty());
      assertTrue(collector.pending.isEmpty());
    }

    @Test
    void after_a_failure_the_bus_keeps_working() {
      final var attempts = new ArrayList<String>();
      commandHandlers.put(
          Command.Allocate.class,
          new NamedHandler(
              "allocate",
              message -> {
                attempts.add("attempt");
                if (attempts.size() == 1) {
                  throw new IllegalStateException("first attempt fails");
                }
                collector.raise(ALLOCATED);
              }));
      eventHandlers.put(Event.Allocated.class, List.of(recording("publish")));
      final var bus = bus();

      assertThrows(IllegalStateException.class, () -> bus.handle(ALLOCATE));
      bus.handle(ALLOCATE);

      assertEquals(List.of("publish"), handled);
    }
  }

  @Nested
  class Events {
    @Test
    void when_event_has_no_handlers_nothing_happens() {
      assertDoesNotThrow(() -> bus().handle(OUT_OF_STOCK));
      assertTrue(handled.isEmpty());
    }

    @Test
    void when_event_handler_fails_its_siblings_still_run_and_nothing_is_thrown() {
      eventHandlers.put(
          Event.Allocated.class,
          List.of(
              recording("first"),
              new NamedHandler(
                  "failing",
                  message -> {
                    throw new IllegalStateException("event handler failure");
                  }),
              recording("third")));

      assertDoesNotThrow(() -> bus().handle(ALLOCATED));
      assertEquals(List.of("first", "third"), handled);
    }

    @Test
    void events_raised_by_a_failing_event_handler_are_still_processed() {
      eventHandlers.put(
          Event.Allocated.class,
          List.of(
              new NamedHandler(
                  "failing",
                  message -> {
                    collector.raise(OUT_OF_STOCK);
                    throw new IllegalStateException("event handler failure");
                  })));
      eventHandlers.put(Event.OutOfStock.class, List.of(recording("notify")));

      bus().handle(ALLOCATED);

      assertEquals(List.of("notify"), handled);
    }

    @Test
    void consequences_are_processed_breadth_first() {
      commandHandlers.put(Command.Allocate.class, recording("allocate", ALLOCATED, OUT_OF_STOCK));
      eventHandlers.put(Event.Allocated.class, List.of(recording("allocated", DEALLOCATED)));
      eventHandlers.put(Event.OutOfStock.class, List.of(recording("out-of-stock")));
      eventHandlers.put(Event.Deallocated.class, List.of(recording("deallocated")));

      bus().handle(ALLOCATE);

      assertEquals(List.of("allocate", "allocated", "out-of-stock", "deallocated"), handled);
    }

    @Test
    void when_handlers_keep_raising_events_message_limit_exceeded_exception_is_thrown() {
      eventHandlers.put(Event.OutOfStock.class, List.of(recording("loop", OUT_OF_STOCK)));
      final var bus = new MessageBus<>(collector, eventHandlers, commandHandlers, 50);

      assertThrows(MessageLimitExceededException.class, () -> bus.handle(OUT_OF_STOCK));
      assertEquals(50, handled.size());
      assertTrue(collector.pending.isEmpty());
    }
  }

  @Nested
  class Introspection {
    @Test
    void handler_names_are_reported_in_invocation_order() {
      commandHandlers.put(Command.Allocate.class, recording("allocate"));
      eventHandlers.put(Event.Allocated.class, List.of(recording("publish"), recording("view")));
      final var bus = bus();

      assertEquals("allocate", bus.commandHandlerName(Command.Allocate.class));
      assertEquals(List.of("publish", "view"), bus.eventHandlerNames(Event.Allocated.class));
      assertTrue(bus.eventHandlerNames(Event.OutOfStock.class).isEmpty());
      assertSame(collector, bus.unitOfWork());
    }

    @Test
    void when_command_has_no_handler_its_name_cannot_be_reported() {
      assertThrows(
          UnsupportedOperationException.class,
          () -> bus().commandHandlerName(Command.Deallocate.class));
    }
  }

  static final class ScriptedCollector implements EventCollector {
    final List<Event> pending = new ArrayList<>();

    void raise(Event... events) {
      pending.addAll(List.of(events));
    }

    @Override
    public List<Event> collectNewEvents() {
      final var events = List.copyOf(pending);
      pending.clear();
      return events;
    }
  }

  record NamedHandler(String name, MessageHandler delegate) implements MessageHandler {
    @Override
    public void handle(Message message) {
      delegate.handle(message);
    }
  }
}
