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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import org.jooq.ConnectionProvider;
import org.jooq.exception.DataAccessException;

/**
 * Opens a fresh JDBC connection whenever jOOQ asks for one and closes it when jOOQ is done.
 *
 * <p>Nothing is opened until the first query, so building a {@link org.jooq.DSLContext} on top of
 * this provider never touches the database. jOOQ keeps one connection for the whole duration of a
 * transaction.
 */
public final class DriverManagerConnectionProvider implements ConnectionProvider {
  private final String url;
  private final String user;
  private final String password;

  public DriverManagerConnectionProvider(
      final String url, final String user, final String password) {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("JDBC URL cannot be blank");
    }

    this.url = url;
    this.user = user;
    this.password = password;
  }

  @Override
  public Connection acquire() throws DataAccessException {
    try {
      return DriverManager.getConnection(url, user, password);
    } catch (SQLException e) {
      throw new DataAccessException("Cannot connect to %s".formatted(url), e);
    }
  }

  @Override
  public void release(final Connection connection) throws DataAccessException {
    try {
      connection.close();
    } catch (SQLException e) {
      throw new DataAccessException("Cannot close connection to %s".formatted(url), e);
    }
  }

  @Override
  public String toString() {
    return "DriverManagerConnectionProvider[" + url + "]";
  }
}
