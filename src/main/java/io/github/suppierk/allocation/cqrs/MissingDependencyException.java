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

import java.io.Serial;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/** Thrown when a handler needs a collaborator which the dependency map does not provide. */
public class MissingDependencyException extends RuntimeException {
  @Serial private static final long serialVersionUID = 4127836452093761450L;

  private final String handlerName;
  private final Set<String> missingDependencies;

  public MissingDependencyException(
      final String handlerName, final Set<String> missingDependencies) {
    super(
        "Handler '%s' is missing dependencies %s"
            .formatted(handlerName, new TreeSet<>(missingDependencies)));
    this.handlerName = handlerName;
    this.missingDependencies = Collections.unmodifiableSet(new TreeSet<>(missingDependencies));
  }

  public String getHandlerName() {
    return handlerName;
  }

  public Set<String> getMissingDependencies() {
    return missingDependencies;
  }
}
