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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A {@link MessageHandler} produced by {@link DependencyInjector}: a static handler method plus the
 * collaborators bound to its parameters.
 *
 * <p>Instances are immutable - once bound, the set of collaborators never changes.
 */
public final class InjectedHandler implements MessageHandler {
  private final Method method;
  private final Class<?> messageType;
  private final Object[] boundArguments;
  private final Set<String> missingDependencies;

  InjectedHandler(
      final Method method, final Object[] boundArguments, final Set<String> missingDependencies) {
    this.method = method;
    this.messageType = method.getParameterTypes()[0];
    this.boundArguments = boundArguments.clone();
    this.missingDependencies =
        Collections.unmodifiableSet(new LinkedHashSet<>(missingDependencies));
  }

  /**
   * @return names of the declared dependencies which were absent at bind time
   */
  public Set<String> missingDependencies() {
    return missingDependencies;
  }

  /**
   * @return {@code true} if every declared dependency was bound
   */
  public boolean isFullyBound() {
    return missingDependencies.isEmpty();
  }

  /**
   * @return the {@link Message} type the underlying method accepts
   */
  public Class<?> messageType() {
    return messageType;
  }

  /**
   * Invokes the underlying method.
   *
   * <p>Exceptions thrown by the method reach the caller as they were thrown; checked exceptions,
   * which handlers are not supposed to declare, arrive wrapped in {@link
   * UndeclaredThrowableException}.
   *
   * @param message to process
   * @throws MissingDependencyException if any dependency was not bound
   * @throws IllegalArgumentException if the message does not match the handler
   */
  @Override
  public void handle(final Message message) {
    if (!missingDependencies.isEmpty()) {
      throw new MissingDependencyException(name(), missingDependencies);
    }

    if (!messageType.isInstance(message)) {
      throw new IllegalArgumentException(
          "Handler '%s' cannot process %s"
              .formatted(name(), message == null ? "null" : message.getClass().getSimpleName()));
    }

    final Object[] arguments = Arrays.copyOf(boundArguments, boundArguments.length);
    arguments[0] = message;

    try {
      method.invoke(null, arguments);
    } catch (InvocationTargetException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new UndeclaredThrowableException(cause);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Handler '%s' is not accessible".formatted(name()), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public String name() {
    return method.getDeclaringClass().getSimpleName() + "." + method.getName();
  }

  @Override
  public String toString() {
    return name();
  }
}
