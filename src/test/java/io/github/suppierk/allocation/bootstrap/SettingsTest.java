package io.github.suppierk.allocation.bootstrap;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.jooq.SQLDialect;
import org.junit.jupiter.api.Test;

class SettingsTest {
  @Test
  void when_nothing_is_configured_defaults_are_used() {
    final var settings = Settings.resolve(key -> null, key -> null);

    assertEquals(Settings.DEFAULT_DB_URL, settings.dbUrl());
    assertEquals(Settings.DEFAULT_DB_USER, settings.dbUser());
    assertEquals(Settings.DEFAULT_DB_PASSWORD, settings.dbPassword());
    assertEquals(SQLDialect.POSTGRES, settings.dialect());
    assertEquals(10_000, settings.maxMessagesPerCall());
  }

  @Test
  void system_properties_win_over_environment_variables() {
    final var properties = Map.of("allocation.db.url", "jdbc:h2:mem:props");
    final var environment =
        Map.of("ALLOCATION_DB_URL", "jdbc:h2:mem:env", "ALLOCATION_DB_USER", "env-user");

    final var settings = Settings.resolve(properties::get, environment::get);

    assertEquals("jdbc:h2:mem:props", settings.dbUrl());
    assertEquals("env-user", settings.dbUser());
  }

  @Test
  void dashed_keys_map_to_underscored_environment_variables() {
    final var environment =
        Map.of("ALLOCATION_BUS_MAX_MESSAGES", "25", "ALLOCATION_DB_DIALECT", "h2");

    final var settings = Settings.resolve(key -> null, environment::get);

    assertEquals(25, settings.maxMessagesPerCall());
    assertEquals(SQLDialect.H2, settings.dialect());
  }

  @Test
  void when_values_cannot_be_parsed_illegal_argument_exception_is_thrown() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Settings.resolve(Map.of("allocation.db.dialect", "COBOL")::get, key -> null));
    assertThrows(
        IllegalArgumentException.class,
        () -> Settings.resolve(Map.of("allocation.bus.max-messages", "many")::get, key -> null));
    assertThrows(
        IllegalArgumentException.class,
        () -> Settings.resolve(Map.of("allocation.bus.max-messages", "0")::get, key -> null));
  }

  @Test
  void password_is_not_printed() {
    final var settings = Settings.resolve(key -> null, key -> null);

    assertFalse(settings.toString().contains(Settings.DEFAULT_DB_PASSWORD));
  }
}
