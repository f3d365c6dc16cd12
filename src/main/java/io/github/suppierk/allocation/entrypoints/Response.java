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

package io.github.suppierk.allocation.entrypoints;

/**
 * What an endpoint call answers with, independent of the transport carrying it.
 *
 * @param status HTTP-like status code
 * @param body to serialize, a message or a value
 */
public record Response(int status, Object body) {
  public static final int CREATED = 201;
  public static final int OK = 200;
  public static final int ACCEPTED = 202;
  public static final int BAD_REQUEST = 400;
  public static final int NOT_FOUND = 404;

  public boolean isSuccessful() {
    return status >= 200 && status < 300;
  }
}
