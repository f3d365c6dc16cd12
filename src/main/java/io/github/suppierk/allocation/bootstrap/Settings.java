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

package io.github.suppierk.allocation.bootstrap;

import io.github.suppierk.allocation.cqrs.MessageBus;
import java.util.Locale;
import java.util.function.UnaryOperator;
import org.jooq.SQLDialect;

/**
 * Process-wide configuration of the production collaborators.
 *
 * <p>Every value is looked up in system properties first ({@code allocation.db.url}), then in
 * environment variables ({@code ALLOCATION_DB_URL}), then falls back to a default matching the
 * local development database.
 *
 * @param dbUrl JDBC URL of the allocation database
 * @param dbUser to connect as
 * @param dbPassword to connect with
 * @param dialect of the allocation database
 * @param maxMessagesPerCall cap on messages processed by a single bus call
 */
public record Settings(
    String dbUrl, String dbUser, String dbPassword, SQLDialect dialect, int maxMessagesPerCall) {
  public static final String DB_URL = "allocation.db.url";
  public static final String DB_USER = "allocation.db.user";
  public static final String DB_PASSWORD = "allocation.db.password";
  public static final String DB_DIALECT = "allocation.db.dialect";
  public static final String BUS_MAX_MESSAGES = "allocation.bus.max-messages";

  static final String DEFAULT_DB_URL = "jdbc:postgresql://localhost:54321/allocation";
  static final String DEFAULT_DB_USER = "allocation";
  static final String DEFAULT_DB_PASSWORD = "abc123";

  public Settings {
    if (dbUrl == null || dbUrl.isBlank()) {
      throw new IllegalArgumentException("Database URL cannot be blank");
    }
    if (dialect == null) {
      throw new IllegalArgumentException("Dialect cannot be null");
    }
    if (maxMessagesPerCall <= 0) {
      throw new IllegalArgumentException("Message limit must be positive");
    }
  }

  /**
   * @return settings of this process
   * @throws IllegalArgumentException if a configured value cannot be parsed
   */
  public static Settings fromEnvironment() {
    return resolve(System::getProperty, System::getenv);
  }

  static Settings resolve(
      final UnaryOperator<String> properties, final UnaryOperator<String> environment) {
    final Lookup lookup = new Lookup(properties, environment);

    return new Settings(
        lookup.get(DB_URL, DEFAULT_DB_URL),
        lookup.get(DB_USER, DEFAULT_DB_USER),
        lookup.get(DB_PASSWORD, DEFAULT_DB_PASSWORD),
        parseDialect(lookup.get(DB_DIALECT, SQLDialect.POSTGRES.name())),
        parseLimit(
            lookup.get(
                BUS_MAX_MESSAGES, String.valueOf(MessageBus.DEFAULT_MAX_MESSAGES_PER_CALL))));
  }

  private static SQLDialect parseDialect(final String value) {
    try {
      return SQLDialect.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown SQL dialect: " + value, e);
    }
  }

  private static int parseLimit(final String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Message limit is not a number: " + value, e);
    }
  }

  private record Lookup(UnaryOperator<String> properties, UnaryOperator<String> environment) {
    String get(final String key, final String defaultValue) {
      final String property = properties.apply(key);
      if (property != null) {
        return property;
      }

      final String variable =
          environment.apply(key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_'));
      return variable != null ? variable : defaultValue;
    }
  }

  @Override
  public String toString() {
    return "Settings[dbUrl=%s, dbUser=%s, dialect=%s, maxMessagesPerCall=%d]"
        .formatted(dbUrl, dbUser, dialect, maxMessagesPerCall);
  }
}
