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

/** Thrown when none of the batches of a product can take an order line. */
public class OutOfStockException extends DomainException {
  @Serial private static final long serialVersionUID = -1403591829154209618L;

  private final String sku;

  public OutOfStockException(final String sku) {
    super("Out of stock for sku %s".formatted(sku));
    this.sku = sku;
  }

  public String getSku() {
    return sku;
  }
}
