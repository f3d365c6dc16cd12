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

import java.io.Serial;

/**
 * Thrown on commit when another transaction saved the same product after it was loaded. The whole
 * transaction is rolled back; retrying the command reloads the fresh state.
 */
public class StaleProductException extends RuntimeException {
  @Serial private static final long serialVersionUID = -8544271208866154096L;

  public StaleProductException(final String sku, final int loadedVersion) {
    super(
        "Product %s was modified by another transaction since version %d"
            .formatted(sku, loadedVersion));
  }
}
