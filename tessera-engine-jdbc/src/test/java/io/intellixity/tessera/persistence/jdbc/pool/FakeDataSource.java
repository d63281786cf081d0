package io.intellixity.tessera.persistence.jdbc.pool;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;

/** Proxy-backed DataSource whose connections only answer {@code isValid} and {@code close}. */
final class FakeDataSource {
  volatile boolean valid = true;
  volatile SQLException failure;
  int borrows;

  DataSource dataSource() {
    return (DataSource) Proxy.newProxyInstance(
        getClass().getClassLoader(),
        new Class<?>[]{DataSource.class},
        (proxy, method, args) -> switch (method.getName()) {
          case "getConnection" -> {
            if (failure != null) throw failure;
            borrows++;
            yield connection();
          }
          case "toString" -> "FakeDataSource";
          default -> throw new UnsupportedOperationException(method.getName());
        });
  }

  private Connection connection() {
    return (Connection) Proxy.newProxyInstance(
        getClass().getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> switch (method.getName()) {
          case "isValid" -> valid;
          case "close" -> null;
          case "isClosed" -> false;
          case "toString" -> "FakeConnection";
          default -> throw new UnsupportedOperationException(method.getName());
        });
  }
}
