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

/**
 * A value object describing a quantity of a product requested by an order.
 *
 * @param orderId of the order the line belongs to
 * @param sku of the ordered product
 * @param qty ordered quantity
 */
public record OrderLine(String orderId, String sku, int qty) {
  public OrderLine {
    if (orderId == null || orderId.isBlank()) {
      throw new IllegalArgumentException("Order ID cannot be blank");
    }
    if (sku == null || sku.isBlank()) {
      throw new IllegalArgumentException("SKU cannot be blank");
    }
    if (qty <= 0) {
      throw new IllegalArgumentException("Quantity must be positive");
    }
  }
}
