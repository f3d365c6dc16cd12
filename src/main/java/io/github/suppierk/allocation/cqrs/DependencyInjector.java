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

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Binds handler methods to the collaborators they declare.
 *
 * <p>A handler is a {@code static} method whose first parameter is the {@link Message} it handles.
 * Every other parameter is a dependency, looked up by name in the dependency map:
 *
 * <pre>{@code
 * public static void allocate(
 *     final Command.Allocate command, @Dependency("uow") final UnitOfWork unitOfWork) {
 *   ...
 * }
 * }</pre>
 *
 * <p>Names missing from the map are left unbound: {@link #inject(Method, Map)} still succeeds, and
 * the returned {@link InjectedHandler} reports them via {@link
 * InjectedHandler#missingDependencies()} and refuses to run with {@link
 * MissingDependencyException}.
 *
 * <p>Injection has no side effects, so the same handler registry can be bound against production
 * and fake dependency maps alike.
 */
public final class DependencyInjector extends Suspicious {
  /**
   * @param handler is a static method accepting the message first and dependencies afterwards
   * @param dependencies by name
   * @return a handler which only needs the message to run
   * @throws IllegalArgumentException if the method is not a valid handler, or if a dependency
   *     cannot be assigned to the parameter declaring it
   */
  public InjectedHandler inject(final Method handler, final Map<String, ?> dependencies) {
    final Method nonNullHandler = throwIllegalArgumentIfNull(handler, "Handler");
    final Map<String, ?> nonNullDependencies =
        throwIllegalArgumentIfNull(dependencies, "Dependencies");

    verifyHandlerShape(nonNullHandler);

    final Parameter[] parameters = nonNullHandler.getParameters();
    final Object[] boundArguments = new Object[parameters.length];
    final Set<String> missingDependencies = new LinkedHashSet<>();

    for (int i = 1; i < parameters.length; i++) {
      final Parameter parameter = parameters[i];
      final String dependencyName = dependencyName(nonNullHandler, parameter);

      if (!nonNullDependencies.containsKey(dependencyName)) {
        missingDependencies.add(dependencyName);
        continue;
      }

      final Object dependency = nonNullDependencies.get(dependencyName);
      if (!parameter.getType().isInstance(dependency)) {
        throw new IllegalArgumentException(
            "Dependency '%s' of handler '%s' must be %s, got %s"
                .formatted(
                    dependencyName,
                    nonNullHandler.getName(),
                    parameter.getType().getSimpleName(),
                    dependency == null ? "null" : dependency.getClass().getSimpleName()));
      }

      boundArguments[i] = dependency;
    }

    nonNullHandler.trySetAccessible();
    return new InjectedHandler(nonNullHandler, boundArguments, missingDependencies);
  }

  private void verifyHandlerShape(final Method handler) {
    if (!Modifier.isStatic(handler.getModifiers())) {
      throw new IllegalArgumentException(
          "Handler '%s' must be static".formatted(handler.getName()));
    }

    if (handler.getParameterCount() == 0
        || !Message.class.isAssignableFrom(handler.getParameterTypes()[0])) {
      throw new IllegalArgumentException(
          "Handler '%s' must accept a Message as its first parameter"
              .formatted(handler.getName()));
    }
  }

  private String dependencyName(final Method handler, final Parameter parameter) {
    final Dependency dependency = parameter.getAnnotation(Dependency.class);
    if (dependency != null) {
      return dependency.value();
    }

    if (!parameter.isNamePresent()) {
      throw new IllegalArgumentException(
          "Cannot resolve the name of parameter '%s' of handler '%s': annotate it with @%s"
              .formatted(
                  parameter.getName(), handler.getName(), Dependency.class.getSimpleName()));
    }

    return parameter.getName();
  }
}
