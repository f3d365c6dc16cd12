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

/** Keys of the dependency map handlers are bound against. */
public final class DependencyNames {
  /** {@link io.github.suppierk.allocation.unitofwork.UnitOfWork} */
  public static final String UNIT_OF_WORK = "uow";

  /** {@link io.github.suppierk.allocation.async.Notifications} */
  public static final String SEND_MAIL = "send_mail";

  /** {@link io.github.suppierk.allocation.async.EventPublisher} */
  public static final String PUBLISH = "publish";

  private DependencyNames() {
    // No instance
  }
}
