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

import io.github.suppierk.allocation.async.EventPublisher;
import io.github.suppierk.allocation.async.Notifications;
import io.github.suppierk.allocation.unitofwork.UnitOfWork;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * What {@link Bootstrap} should wire. Every collaborator left out is replaced by its production
 * default.
 */
public final class BootstrapConfig {
  public static final String START_PERSISTENCE_MAPPINGS = "start_persistence_mappings";
  public static final String UNIT_OF_WORK = "unit_of_work";
  public static final String SEND_MAIL = "send_mail";
  public static final String PUBLISH = "publish";

  private static final Set<String> OPTIONS =
      Set.of(START_PERSISTENCE_MAPPINGS, UNIT_OF_WORK, SEND_MAIL, PUBLISH);

  private final boolean startPersistenceMappings;
  private final UnitOfWork unitOfWork;
  private final Notifications sendMail;
  private final EventPublisher publish;
  private final Settings settings;

  private BootstrapConfig(final Builder builder) {
    this.startPersistenceMappings = builder.startPersistenceMappings;
    this.unitOfWork = builder.unitOfWork;
    this.sendMail = builder.sendMail;
    this.publish = builder.publish;
    this.settings = builder.settings;
  }

  /**
   * @return configuration where everything is a production default
   */
  public static BootstrapConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads configuration from named options: {@value #START_PERSISTENCE_MAPPINGS} ({@link
   * Boolean}), {@value #UNIT_OF_WORK} ({@link UnitOfWork}), {@value #SEND_MAIL} ({@link
   * Notifications}) and {@value #PUBLISH} ({@link EventPublisher}).
   *
   * @param options by name
   * @return configuration
   * @throws IllegalArgumentException if an option is unknown or has a value of the wrong type
   */
  public static BootstrapConfig fromOptions(final Map<String, ?> options) {
    if (options == null) {
      throw new IllegalArgumentException("Options cannot be null");
    }

    final Set<String> unknown = new TreeSet<>(options.keySet());
    unknown.removeAll(OPTIONS);
    if (!unknown.isEmpty()) {
      throw new IllegalArgumentException(
          "Unknown bootstrap options %s, expected some of %s"
              .formatted(unknown, new TreeSet<>(OPTIONS)));
    }

    final Builder builder = builder();
    if (options.containsKey(START_PERSISTENCE_MAPPINGS)) {
      builder.startPersistenceMappings(option(options, START_PERSISTENCE_MAPPINGS, Boolean.class));
    }
    if (options.containsKey(UNIT_OF_WORK)) {
      builder.unitOfWork(option(options, UNIT_OF_WORK, UnitOfWork.class));
    }
    if (options.containsKey(SEND_MAIL)) {
      builder.sendMail(option(options, SEND_MAIL, Notifications.class));
    }
    if (options.containsKey(PUBLISH)) {
      builder.publish(option(options, PUBLISH, EventPublisher.class));
    }
    return builder.build();
  }

  public boolean startPersistenceMappings() {
    return startPersistenceMappings;
  }

  public Optional<UnitOfWork> unitOfWork() {
    return Optional.ofNullable(unitOfWork);
  }

  public Optional<Notifications> sendMail() {
    return Optional.ofNullable(sendMail);
  }

  public Optional<EventPublisher> publish() {
    return Optional.ofNullable(publish);
  }

  public Optional<Settings> settings() {
    return Optional.ofNullable(settings);
  }

  private static <T> T option(
      final Map<String, ?> options, final String name, final Class<T> type) {
    final Object value = options.get(name);
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException(
          "Option '%s' must be %s, got %s"
              .formatted(
                  name,
                  type.getSimpleName(),
                  value == null ? "null" : value.getClass().getSimpleName()));
    }

    return type.cast(value);
  }

  public static final class Builder {
    private boolean startPersistenceMappings = true;
    private UnitOfWork unitOfWork;
    private Notifications sendMail;
    private EventPublisher publish;
    private Settings settings;

    private Builder() {}

    public Builder startPersistenceMappings(final boolean startPersistenceMappings) {
      this.startPersistenceMappings = startPersistenceMappings;
      return this;
    }

    public Builder unitOfWork(final UnitOfWork unitOfWork) {
      this.unitOfWork = unitOfWork;
      return this;
    }

    public Builder sendMail(final Notifications sendMail) {
      this.sendMail = sendMail;
      return this;
    }

    public Builder publish(final EventPublisher publish) {
      this.publish = publish;
      return this;
    }

    /** Settings for production defaults, read from the environment when not given. */
    public Builder settings(final Settings settings) {
      this.settings = settings;
      return this;
    }

    public BootstrapConfig build() {
      return new BootstrapConfig(this);
    }
  }
}
