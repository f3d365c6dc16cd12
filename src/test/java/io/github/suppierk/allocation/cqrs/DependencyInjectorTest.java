package io.github.suppierk.allocation.cqrs;

import static org.junit.jupiter.api.Assertions.*;

import java.lang.reflect.Method;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DependencyInjectorTest {
  static final DependencyInjector INJECTOR = new DependencyInjector();
  static final List<String> CALLS = new ArrayList<>();

  @BeforeEach
  void setUp() {
    CALLS.clear();
  }

  static Method method(String name) {
    for (Method method : TestHandlers.class.getDeclaredMethods()) {
      if (method.getName().equals(name)) {
        return method;
      }
    }
    throw new IllegalStateException("No method " + name);
  }

  @Nested
  class Inject {
    @Test
    void when_handler_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> INJECTOR.inject(null, Map.of()));
    }

    @Test
    void when_dependencies_are_null_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class, () -> INJECTOR.inject(method("allocate"), null));
    }

    @Test
    void when_handler_is_not_static_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class, () -> INJECTOR.inject(method("instance"), Map.of()));
    }

    @Test
    void when_handler_does_not_accept_a_message_first_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class, () -> INJECTOR.inject(method("notAMessage"), Map.of()));
    }

    @Test
    void when_dependency_has_wrong_type_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () -> INJECTOR.inject(method("allocate"), Map.of("prefix", 42)));
    }

    @Test
    void when_every_dependency_is_present_handler_is_fully_bound() {
      final var handler = INJECTOR.inject(method("allocate"), Map.of("prefix", "seen "));

      assertTrue(handler.isFullyBound());
      assertTrue(handler.missingDependencies().isEmpty());
      assertEquals(Command.Allocate.class, handler.messageType());
      assertEquals("TestHandlers.allocate", handler.name());
    }

    @Test
    void when_extra_dependencies_are_present_they_are_ignored() {
      final var handler =
          INJECTOR.inject(method("allocate"), Map.of("prefix", "seen ", "unused", new Object()));

      handler.handle(new Command.Allocate("o1", "LAMP", 1));

      assertEquals(List.of("seen o1"), CALLS);
    }

    @Test
    void when_handler_has_no_dependencies_it_needs_none() {
      final var handler = INJECTOR.inject(method("outOfStock"), Map.of());

      handler.handle(new Event.OutOfStock("LAMP"));

      assertTrue(handler.isFullyBound());
      assertEquals(List.of("LAMP"), CALLS);
    }

    @Test
    void when_annotation_is_absent_compiled_parameter_name_is_used() {
      final var handler = INJECTOR.inject(method("deallocate"), Map.of("suffix", "!"));

      handler.handle(new Command.Deallocate("o1", "LAMP"));

      assertEquals(List.of("o1!"), CALLS);
    }

    @Test
    void injection_does_not_call_the_handler() {
      INJECTOR.inject(method("allocate"), Map.of("prefix", "seen "));

      assertTrue(CALLS.isEmpty());
    }
  }

  @Nested
  class Handle {
    @Test
    void when_dependency_is_missing_handler_is_returned_but_refuses_to_run() {
      final var handler = INJECTOR.inject(method("allocate"), Map.of());

      assertFalse(handler.isFullyBound());
      assertEquals(Set.of("prefix"), handler.missingDependencies());

      final var exception =
          assertThrows(
              MissingDependencyException.class,
              () -> handler.handle(new Command.Allocate("o1", "LAMP", 1)));

      assertEquals("TestHandlers.allocate", exception.getHandlerName());
      assertEquals(Set.of("prefix"), exception.getMissingDependencies());
      assertTrue(CALLS.isEmpty());
    }

    @Test
    void when_message_has_wrong_type_illegal_argument_exception_is_thrown() {
      final var handler = INJECTOR.inject(method("allocate"), Map.of("prefix", ""));

      assertThrows(
          IllegalArgumentException.class, () -> handler.handle(new Event.OutOfStock("LAMP")));
    }

    @Test
    void when_handler_throws_unchecked_exception_it_is_not_wrapped() {
      final var handler = INJECTOR.inject(method("failing"), Map.of());

      final var exception =
          assertThrows(
              IllegalStateException.class,
              () -> handler.handle(new Command.Allocate("o1", "LAMP", 1)));

      assertEquals("failing handler", exception.getMessage());
    }

    @Test
    void when_handler_throws_checked_exception_it_is_wrapped() {
      final var handler = INJECTOR.inject(method("failingChecked"), Map.of());

      final var exception =
          assertThrows(
              UndeclaredThrowableException.class,
              () -> handler.handle(new Command.Allocate("o1", "LAMP", 1)));

      assertEquals("checked", exception.getCause().getMessage());
    }

    @Test
    void same_method_can_be_bound_to_different_dependencies() {
      final var first = INJECTOR.inject(method("allocate"), Map.of("prefix", "first "));
      final var second = INJECTOR.inject(method("allocate"), Map.of("prefix", "second "));

      first.handle(new Command.Allocate("o1", "LAMP", 1));
      second.handle(new Command.Allocate("o2", "LAMP", 1));

      assertEquals(List.of("first o1", "second o2"), CALLS);
    }
  }

  static final class TestHandlers {
    private TestHandlers() {}

    public static void allocate(Command.Allocate command, @Dependency("prefix") String prefix) {
      CALLS.add(prefix + command.orderId());
    }

    public static void deallocate(Command.Deallocate command, String suffix) {
      CALLS.add(command.orderId() + suffix);
    }

    public static void outOfStock(Event.OutOfStock event) {
      CALLS.add(event.sku());
    }

    public static void failing(Command.Allocate command) {
      throw new IllegalStateException("failing handler");
    }

    public static void failingChecked(Command.Allocate command) throws Exception {
      throw new Exception("checked");
    }

    public static void notAMessage(String value) {
      CALLS.add(value);
    }

    public void instance(Command.Allocate command) {
      CALLS.add(command.orderId());
    }
  }
}
