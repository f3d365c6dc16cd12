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

package io.github.suppierk.allocation.async;

/**
 * Abstract contract for an entity which is able to notify people, e.g. by e-mail.
 *
 * <p>Implementations may deliver immediately or store the notification for later delivery. Either
 * way, a failure surfaces as an exception thrown from {@link #send(String, String)}.
 */
@FunctionalInterface
public interface Notifications {
  /**
   * @param destination of the notification, e.g. an e-mail address
   * @param message to deliver
   */
  void send(String destination, String message);
}
