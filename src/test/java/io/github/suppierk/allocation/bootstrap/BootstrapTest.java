package io.github.suppierk.allocation.bootstrap;

import static io.github.suppierk.allocation.jooq.Schema.OUTBOX_EVENTS;
import static org.junit.jupiter.api.Assertions.*;

import io.github.suppierk.allocation.cqrs.Command;
import io.github.suppierk.allocation.cqrs.Event;
import io.github.suppierk.allocation.cqrs.MessageBus;
import io.github.suppierk.allocation.jooq.JooqUnitOfWork;
import io.github.suppierk.allocation.service.HandlerRegistry;
import io.github.suppierk.allocation.unitofwork.UnitOfWork;
import io.github.suppierk.test.FakeUnitOfWork;
import io.github.suppierk.test.RecordingEventPublisher;
import io.github.suppierk.test.RecordingNotifications;
import io.github.suppierk.test.TestDatabase;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.jooq.SQLDialect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BootstrapTest {
  static final Settings H2_SETTINGS =
      new Settings(TestDatabase.URL, "sa", "", SQLDialect.POSTGRES, 1_000);

  static MessageBus<UnitOfWork> fakeBus(FakeUnitOfWork unitOfWork) {
    return Bootstrap.bootstrap(
        Map.of(
            BootstrapConfig.START_PERSISTENCE_MAPPINGS, false,
            BootstrapConfig.UNIT_OF_WORK, unitOfWork,
            BootstrapConfig.SEND_MAIL, new RecordingNotifications(),
            BootstrapConfig.PUBLISH, new RecordingEventPublisher()));
  }

  @Nested
  class Options {
    @Test
    void when_options_are_null_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class, () -> Bootstrap.bootstrap((Map<String, ?>) null));
    }

    @Test
    void when_option_is_unknown_illegal_argument_exception_is_thrown() {
      final var exception =
          assertThrows(
              IllegalArgumentException.class,
              () -> BootstrapConfig.fromOptions(Map.of("uow", new FakeUnitOfWork())));

      assertTrue(exception.getMessage().contains("uow"));
    }

    @Test
    void when_option_has_wrong_type_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              BootstrapConfig.fromOptions(
                  Map.of(BootstrapConfig.START_PERSISTENCE_MAPPINGS, "no")));
      assertThrows(
          IllegalArgumentException.class,
          () -> BootstrapConfig.fromOptions(Map.of(BootstrapConfig.SEND_MAIL, new Object())));
    }

    @Test
    void when_option_is_null_illegal_argument_exception_is_thrown() {
      final Map<String, Object> options = new HashMap<>();
      options.put(BootstrapConfig.UNIT_OF_WORK, null);

      assertThrows(IllegalArgumentException.class, () -> BootstrapConfig.fromOptions(options));
    }

    @Test
    void omitted_options_fall_back_to_defaults() {
      final var config = BootstrapConfig.fromOptions(Map.of());

      assertTrue(config.startPersistenceMappings());
      assertTrue(config.unitOfWork().isEmpty());
      assertTrue(config.sendMail().isEmpty());
      assertTrue(config.publish().isEmpty());
      assertTrue(config.settings().isEmpty());
    }

    @Test
    void given_options_are_kept() {
      final var unitOfWork = new FakeUnitOfWork();
      final var notifications = new RecordingNotifications();

      final var config =
          BootstrapConfig.fromOptions(
              Map.of(
                  BootstrapConfig.START_PERSISTENCE_MAPPINGS, false,
                  BootstrapConfig.UNIT_OF_WORK, unitOfWork,
                  BootstrapConfig.SEND_MAIL, notifications));

      assertFalse(config.startPersistenceMappings());
      assertSame(unitOfWork, config.unitOfWork().orElseThrow());
      assertSame(notifications, config.sendMail().orElseThrow());
      assertTrue(config.publish().isEmpty());
    }
  }

  @Nested
  class Wiring {
    @Test
    void bus_holds_the_given_unit_of_work() {
      final var unitOfWork = new FakeUnitOfWork();

      assertSame(unitOfWork, fakeBus(unitOfWork).unitOfWork());
    }

    @Test
    void every_registered_handler_is_wired() {
      final var bus = fakeBus(new FakeUnitOfWork());

      HandlerRegistry.commandHandlers()
          .forEach(
              (type, method) ->
                  assertEquals("Handlers." + method.getName(), bus.commandHandlerName(type)));
      HandlerRegistry.eventHandlers()
          .forEach(
              (type, methods) ->
                  assertEquals(
                      methods.stream().map(method -> "Handlers." + method.getName()).toList(),
                      bus.eventHandlerNames(type)));
    }

    @Test
    void fake_and_production_dependencies_run_the_same_handlers_in_the_same_order() {
      final var fake = fakeBus(new FakeUnitOfWork());
      final var production =
          Bootstrap.bootstrap(
              BootstrapConfig.builder()
                  .startPersistenceMappings(false)
                  .settings(H2_SETTINGS)
                  .build());

      assertInstanceOf(JooqUnitOfWork.class, production.unitOfWork());

      for (Class<? extends Command> type : HandlerRegistry.commandHandlers().keySet()) {
        assertEquals(fake.commandHandlerName(type), production.commandHandlerName(type));
      }
      for (Class<? extends Event> type :
          List.of(Event.Allocated.class, Event.Deallocated.class, Event.OutOfStock.class)) {
        assertEquals(fake.eventHandlerNames(type), production.eventHandlerNames(type));
      }
    }

    @Test
    void without_options_production_defaults_are_read_from_system_properties() {
      TestDatabase.reset();
      System.setProperty(Settings.DB_URL, TestDatabase.URL);
      System.setProperty(Settings.DB_USER, "sa");
      System.setProperty(Settings.DB_PASSWORD, "");

      try {
        final var bus = Bootstrap.bootstrap();

        bus.handle(new Command.CreateBatch("batch-001", "CHAIR", 10));
        bus.handle(new Command.Allocate("order-1", "CHAIR", 2));

        assertInstanceOf(JooqUnitOfWork.class, bus.unitOfWork());
        assertEquals(1, TestDatabase.dsl().fetchCount(OUTBOX_EVENTS));
      } finally {
        System.clearProperty(Settings.DB_URL);
        System.clearProperty(Settings.DB_USER);
        System.clearProperty(Settings.DB_PASSWORD);
      }
    }
  }

  @Nested
  class Mappings {
    @BeforeEach
    void setUp() {
      PersistenceMappings.reset();
    }

    @Test
    void persistence_mappings_are_started_at_most_once_per_process() {
      final var first = new FakeUnitOfWork();
      final var second = new FakeUnitOfWork();

      Bootstrap.bootstrap(
          BootstrapConfig.builder()
              .unitOfWork(first)
              .sendMail(new RecordingNotifications())
              .publish(new RecordingEventPublisher())
              .build());
      Bootstrap.bootstrap(
          BootstrapConfig.builder()
              .unitOfWork(second)
              .sendMail(new RecordingNotifications())
              .publish(new RecordingEventPublisher())
              .build());

      assertTrue(PersistenceMappings.isStarted());
      assertEquals(1, first.mappingsStarted());
      assertEquals(0, second.mappingsStarted());
      assertFalse(PersistenceMappings.start(new FakeUnitOfWork()));
    }

    @Test
    void when_starting_mappings_fails_the_next_bootstrap_tries_again() {
      final UnitOfWork broken =
          new UnitOfWork() {
            @Override
            public <T> T transactionResult(Function<Transaction, T> work) {
              throw new UnsupportedOperationException();
            }

            @Override
            public List<Event> collectNewEvents() {
              return List.of();
            }

            @Override
            public void startMappings() {
              throw new IllegalStateException("Database is down");
            }
          };
      final var working = new FakeUnitOfWork();

      assertThrows(IllegalStateException.class, () -> PersistenceMappings.start(broken));
      assertFalse(PersistenceMappings.isStarted());

      assertTrue(PersistenceMappings.start(working));
      assertEquals(1, working.mappingsStarted());
    }

    @Test
    void when_mappings_are_not_requested_they_are_not_started() {
      final var unitOfWork = new FakeUnitOfWork();

      fakeBus(unitOfWork);

      assertEquals(0, unitOfWork.mappingsStarted());
    }
  }
}
