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

package io.github.suppierk.allocation.domain;

import java.io.Serial;

/**
 * Base class of the failures the allocation rules can produce.
 *
 * <p>Entrypoints catch this type to turn business rule violations into client errors, while
 * everything else is treated as a server-side problem.
 */
public abstract class DomainException extends RuntimeException {
  @Serial private static final long serialVersionUID = 2319563404829474052L;

  protected DomainException(final String message) {
    super(message);
  }
}
