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

package io.github.suppierk.allocation.readmodel;

/**
 * A row of the allocations projection.
 *
 * <p>Carries copies of identifiers only, never references into the write model, so the projection
 * can be thrown away and rebuilt from events at any time.
 *
 * @param orderId of the order
 * @param sku of the allocated product
 * @param batchReference of the batch holding the stock
 */
public record AllocationRecord(String orderId, String sku, String batchReference) {}
