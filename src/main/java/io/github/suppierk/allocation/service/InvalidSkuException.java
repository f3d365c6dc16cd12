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

package io.github.suppierk.allocation.service;

import io.github.suppierk.allocation.domain.DomainException;
import java.io.Serial;

/** Thrown when a command refers to a product nobody has created a batch for. */
public class InvalidSkuException extends DomainException {
  @Serial private static final long serialVersionUID = 7711960391440536302L;

  public InvalidSkuException(final String sku) {
    super("Invalid sku %s".formatted(sku));
  }
}
