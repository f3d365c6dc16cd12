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

package io.github.suppierk.allocation.unitofwork;

import io.github.suppierk.allocation.domain.Product;
import java.util.Optional;

/**
 * Collection-like access to {@link Product} aggregates within one transaction.
 *
 * <p>Every product returned or added here is remembered by the owning {@link UnitOfWork}, which
 * saves it on commit and harvests its events afterwards.
 */
public interface ProductRepository {
  /**
   * @param product to start tracking
   */
  void add(Product product);

  /**
   * @param sku of the product
   * @return the product, or empty if it does not exist
   */
  Optional<Product> get(String sku);

  /**
   * @param batchReference of one of the batches of the product
   * @return the product owning the batch, or empty if there is no such batch
   */
  Optional<Product> getByBatchReference(String batchReference);
}
