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

package io.github.suppierk.allocation.jooq;

import static io.github.suppierk.allocation.jooq.Schema.ALLOCATIONS;
import static io.github.suppierk.allocation.jooq.Schema.ALLOCATIONS_BATCH_REFERENCE;
import static io.github.suppierk.allocation.jooq.Schema.ALLOCATIONS_ORDER_ID;
import static io.github.suppierk.allocation.jooq.Schema.ALLOCATIONS_POSITION;
import static io.github.suppierk.allocation.jooq.Schema.ALLOCATIONS_QTY;
import static io.github.suppierk.allocation.jooq.Schema.ALLOCATIONS_SKU;
import static io.github.suppierk.allocation.jooq.Schema.BATCHES;
import static io.github.suppierk.allocation.jooq.Schema.BATCHES_ETA;
import static io.github.suppierk.allocation.jooq.Schema.BATCHES_PURCHASED_QUANTITY;
import static io.github.suppierk.allocation.jooq.Schema.BATCHES_REFERENCE;
import static io.github.suppierk.allocation.jooq.Schema.BATCHES_SKU;
import static io.github.suppierk.allocation.jooq.Schema.PRODUCTS;
import static io.github.suppierk.allocation.jooq.Schema.PRODUCTS_SKU;
import static io.github.suppierk.allocation.jooq.Schema.PRODUCTS_VERSION_NUMBER;

import io.github.suppierk.allocation.domain.Batch;
import io.github.suppierk.allocation.domain.OrderLine;
import io.github.suppierk.allocation.domain.Product;
import io.github.suppierk.allocation.unitofwork.ProductRepository;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.jooq.DSLContext;
import org.jooq.Record1;
import org.jooq.Record3;

/**
 * {@link ProductRepository} bound to one jOOQ transaction.
 *
 * <p>Keeps an identity map of the products it handed out: asking twice for the same SKU returns the
 * same instance. {@link #flush()} writes back products created here and products whose version
 * changed since they were loaded.
 */
final class JooqProductRepository implements ProductRepository {
  private final DSLContext dsl;
  private final Consumer<Product> onTracked;
  private final Map<String, Tracked> tracked;

  JooqProductRepository(final DSLContext dsl, final Consumer<Product> onTracked) {
    this.dsl = dsl;
    this.onTracked = onTracked;
    this.tracked = new LinkedHashMap<>();
  }

  @Override
  public void add(final Product product) {
    if (product == null) {
      throw new IllegalArgumentException("Product cannot be null");
    }

    if (tracked.containsKey(product.getSku())) {
      throw new IllegalStateException(
          "Product %s is already part of this transaction".formatted(product.getSku()));
    }

    track(product, null);
  }

  @Override
  public Optional<Product> get(final String sku) {
    final Tracked known = tracked.get(sku);
    if (known != null) {
      return Optional.of(known.product());
    }

    final Record1<Integer> productRow =
        dsl.select(PRODUCTS_VERSION_NUMBER)
            .from(PRODUCTS)
            .where(PRODUCTS_SKU.eq(sku))
            .fetchOne();

    if (productRow == null) {
      return Optional.empty();
    }

    final Product product = new Product(sku, loadBatches(sku), productRow.value1());
    track(product, productRow.value1());
    return Optional.of(product);
  }

  @Override
  public Optional<Product> getByBatchReference(final String batchReference) {
    for (Tracked known : tracked.values()) {
      if (known.product().findBatch(batchReference).isPresent()) {
        return Optional.of(known.product());
      }
    }

    return dsl.select(BATCHES_SKU)
        .from(BATCHES)
        .where(BATCHES_REFERENCE.eq(batchReference))
        .fetchOptional(BATCHES_SKU)
        .flatMap(this::get);
  }

  /**
   * Writes changed products back.
   *
   * @throws StaleProductException if another transaction saved a product after it was loaded
   */
  void flush() {
    for (Tracked known : tracked.values()) {
      final Product product = known.product();
      final Integer loadedVersion = known.loadedVersion();

      if (loadedVersion == null) {
        dsl.insertInto(PRODUCTS)
            .set(PRODUCTS_SKU, product.getSku())
            .set(PRODUCTS_VERSION_NUMBER, product.getVersionNumber())
            .execute();
        insertBatches(product);
      } else if (product.getVersionNumber() != loadedVersion) {
        final int updated =
            dsl.update(PRODUCTS)
                .set(PRODUCTS_VERSION_NUMBER, product.getVersionNumber())
                .where(PRODUCTS_SKU.eq(product.getSku()))
                .and(PRODUCTS_VERSION_NUMBER.eq(loadedVersion))
                .execute();

        if (updated == 0) {
          throw new StaleProductException(product.getSku(), loadedVersion);
        }

        dsl.deleteFrom(ALLOCATIONS).where(ALLOCATIONS_SKU.eq(product.getSku())).execute();
        dsl.deleteFrom(BATCHES).where(BATCHES_SKU.eq(product.getSku())).execute();
        insertBatches(product);
      }
    }
  }

  private List<Batch> loadBatches(final String sku) {
    final Map<String, Batch> batches = new LinkedHashMap<>();

    for (Record3<String, Integer, LocalDate> row :
        dsl.select(BATCHES_REFERENCE, BATCHES_PURCHASED_QUANTITY, BATCHES_ETA)
            .from(BATCHES)
            .where(BATCHES_SKU.eq(sku))
            .orderBy(BATCHES_REFERENCE)
            .fetch()) {
      batches.put(row.value1(), new Batch(row.value1(), sku, row.value2(), row.value3()));
    }

    for (Record3<String, String, Integer> row :
        dsl.select(ALLOCATIONS_ORDER_ID, ALLOCATIONS_BATCH_REFERENCE, ALLOCATIONS_QTY)
            .from(ALLOCATIONS)
            .where(ALLOCATIONS_SKU.eq(sku))
            .orderBy(ALLOCATIONS_BATCH_REFERENCE, ALLOCATIONS_POSITION)
            .fetch()) {
      final Batch batch = batches.get(row.value2());
      final OrderLine line = new OrderLine(row.value1(), sku, row.value3());

      if (batch == null || !batch.allocate(line)) {
        throw new IllegalStateException(
            "Allocation of order %s cannot be restored into batch %s"
                .formatted(row.value1(), row.value2()));
      }
    }

    return List.copyOf(batches.values());
  }

  private void insertBatches(final Product product) {
    for (Batch batch : product.getBatches()) {
      dsl.insertInto(BATCHES)
          .set(BATCHES_REFERENCE, batch.getReference())
          .set(BATCHES_SKU, batch.getSku())
          .set(BATCHES_PURCHASED_QUANTITY, batch.getPurchasedQuantity())
          .set(BATCHES_ETA, batch.getEta())
          .execute();

      final List<OrderLine> lines = batch.getAllocations();
      for (int position = 0; position < lines.size(); position++) {
        final OrderLine line = lines.get(position);
        dsl.insertInto(ALLOCATIONS)
            .set(ALLOCATIONS_ORDER_ID, line.orderId())
            .set(ALLOCATIONS_SKU, line.sku())
            .set(ALLOCATIONS_BATCH_REFERENCE, batch.getReference())
            .set(ALLOCATIONS_QTY, line.qty())
            .set(ALLOCATIONS_POSITION, position)
            .execute();
      }
    }
  }

  private void track(final Product product, final Integer loadedVersion) {
    tracked.put(product.getSku(), new Tracked(product, loadedVersion));
    onTracked.accept(product);
  }

  /**
   * @param product handed out by this repository
   * @param loadedVersion when the product was loaded, {@code null} for new products
   */
  private record Tracked(Product product, Integer loadedVersion) {}
}
