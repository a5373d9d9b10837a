package relay.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import relay.jdbc.store.H2MessageStore;
import relay.jdbc.store.JdbcMessageStores;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DataSourceConnectionProviderTest {

  @Test
  void eachCallOpensAFreshConnection() throws Exception {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);

    try (Connection first = provider.getConnection(); Connection second = provider.getConnection()) {
      assertFalse(first.isClosed());
      assertNotSame(first, second);
    }
  }

  @Test
  void exposesDataSourceForStoreDetection() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID());
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);

    assertSame(ds, provider.dataSource());
    assertInstanceOf(H2MessageStore.class, JdbcMessageStores.detect(provider.dataSource()));
  }

  @Test
  void missingConnectionIsAnError() {
    DataSource empty = (DataSource) Proxy.newProxyInstance(
        DataSource.class.getClassLoader(), new Class<?>[]{DataSource.class},
        (proxy, method, args) -> method.getName().equals("toString") ? "empty" : null);

    assertThrows(SQLException.class, () -> new DataSourceConnectionProvider(empty).getConnection());
  }

  @Test
  void nullDataSourceRejected() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }
}
