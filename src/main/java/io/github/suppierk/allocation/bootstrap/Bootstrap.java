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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.allocation.async.EventPublisher;
import io.github.suppierk.allocation.async.Notifications;
import io.github.suppierk.allocation.async.OutboxEventPublisher;
import io.github.suppierk.allocation.async.OutboxNotifications;
import io.github.suppierk.allocation.cqrs.Command;
import io.github.suppierk.allocation.cqrs.DependencyInjector;
import io.github.suppierk.allocation.cqrs.Event;
import io.github.suppierk.allocation.cqrs.InjectedHandler;
import io.github.suppierk.allocation.cqrs.MessageBus;
import io.github.suppierk.allocation.cqrs.MessageHandler;
import io.github.suppierk.allocation.cqrs.MissingDependencyException;
import io.github.suppierk.allocation.jooq.DriverManagerConnectionProvider;
import io.github.suppierk.allocation.jooq.JooqUnitOfWork;
import io.github.suppierk.allocation.service.DependencyNames;
import io.github.suppierk.allocation.service.HandlerRegistry;
import io.github.suppierk.allocation.unitofwork.UnitOfWork;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.jooq.DSLContext;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composition root: the only place which builds production collaborators and binds them to the
 * handlers listed in {@link HandlerRegistry}.
 */
public final class Bootstrap {
  private static final Logger LOG = LoggerFactory.getLogger(Bootstrap.class);

  private Bootstrap() {
    // No instance
  }

  /**
   * @return a bus wired to production collaborators
   */
  public static MessageBus<UnitOfWork> bootstrap() {
    return bootstrap(BootstrapConfig.defaults());
  }

  /**
   * @param options by name, see {@link BootstrapConfig#fromOptions(Map)}
   * @return a bus wired to the given collaborators and production defaults for the rest
   */
  public static MessageBus<UnitOfWork> bootstrap(final Map<String, ?> options) {
    return bootstrap(BootstrapConfig.fromOptions(options));
  }

  /**
   * @param config of the collaborators
   * @return a bus wired to the given collaborators and production defaults for the rest
   * @throws MissingDependencyException if a registered handler needs something nobody provides
   */
  public static MessageBus<UnitOfWork> bootstrap(final BootstrapConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Bootstrap config cannot be null");
    }

    final Settings settings = config.settings().orElseGet(Settings::fromEnvironment);
    final Supplier<DSLContext> dsl = new ProductionDsl(settings);

    final UnitOfWork unitOfWork =
        config.unitOfWork().orElseGet(() -> new JooqUnitOfWork(dsl.get()));
    final Notifications sendMail =
        config.sendMail().orElseGet(() -> new OutboxNotifications(dsl.get()));
    final EventPublisher publish =
        config.publish().orElseGet(() -> new OutboxEventPublisher(dsl.get(), new ObjectMapper()));

    if (config.startPersistenceMappings()) {
      PersistenceMappings.start(unitOfWork);
    }

    final Map<String, Object> dependencies = new LinkedHashMap<>();
    dependencies.put(DependencyNames.UNIT_OF_WORK, unitOfWork);
    dependencies.put(DependencyNames.SEND_MAIL, sendMail);
    dependencies.put(DependencyNames.PUBLISH, publish);

    final DependencyInjector injector = new DependencyInjector();

    final Map<Class<? extends Command>, MessageHandler> commandHandlers = new LinkedHashMap<>();
    HandlerRegistry.commandHandlers()
        .forEach(
            (type, method) -> commandHandlers.put(type, inject(injector, method, dependencies)));

    final Map<Class<? extends Event>, List<MessageHandler>> eventHandlers = new LinkedHashMap<>();
    HandlerRegistry.eventHandlers()
        .forEach(
            (type, methods) -> {
              final List<MessageHandler> handlers = new ArrayList<>();
              methods.forEach(method -> handlers.add(inject(injector, method, dependencies)));
              eventHandlers.put(type, handlers);
            });

    LOG.info(
        "Bootstrapped {} command and {} event handler groups with {}",
        commandHandlers.size(),
        eventHandlers.size(),
        settings);

    return new MessageBus<>(
        unitOfWork, eventHandlers, commandHandlers, settings.maxMessagesPerCall());
  }

  private static MessageHandler inject(
      final DependencyInjector injector,
      final Method method,
      final Map<String, Object> dependencies) {
    final InjectedHandler handler = injector.inject(method, dependencies);
    if (!handler.isFullyBound()) {
      throw new MissingDependencyException(handler.name(), handler.missingDependencies());
    }

    return handler;
  }

  /** Builds the production {@link DSLContext} on first use and shares it afterwards. */
  private static final class ProductionDsl implements Supplier<DSLContext> {
    private final Settings settings;
    private DSLContext dsl;

    private ProductionDsl(final Settings settings) {
      this.settings = settings;
    }

    @Override
    public DSLContext get() {
      if (dsl == null) {
        dsl =
            DSL.using(
                new DriverManagerConnectionProvider(
                    settings.dbUrl(), settings.dbUser(), settings.dbPassword()),
                settings.dialect());
      }

      return dsl;
    }
  }
}
