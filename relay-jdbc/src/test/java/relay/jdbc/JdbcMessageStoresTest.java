package relay.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import relay.jdbc.store.H2MessageStore;
import relay.jdbc.store.JdbcMessageStores;
import relay.jdbc.store.MySqlMessageStore;
import relay.jdbc.store.PostgresMessageStore;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdbcMessageStoresTest {

  @Test
  void allStoresRegistered() {
    assertEquals(3, JdbcMessageStores.all().size());
  }

  @Test
  void detectByUrl() {
    assertInstanceOf(H2MessageStore.class, JdbcMessageStores.detect("jdbc:h2:mem:test"));
    assertInstanceOf(MySqlMessageStore.class, JdbcMessageStores.detect("jdbc:mysql://localhost/relay"));
    assertInstanceOf(MySqlMessageStore.class, JdbcMessageStores.detect("jdbc:mariadb://localhost/relay"));
    assertInstanceOf(PostgresMessageStore.class, JdbcMessageStores.detect("JDBC:POSTGRESQL://localhost/relay"));
  }

  @Test
  void detectByDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID());

    assertInstanceOf(H2MessageStore.class, JdbcMessageStores.detect(ds));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("postgresql", JdbcMessageStores.get("PostgreSQL").name());
  }

  @Test
  void unknownNameThrows() {
    assertThrows(IllegalArgumentException.class, () -> JdbcMessageStores.get("sqlite"));
  }

  @Test
  void unknownUrlThrows() {
    assertThrows(IllegalArgumentException.class, () -> JdbcMessageStores.detect("jdbc:sqlite:relay.db"));
    assertThrows(IllegalArgumentException.class, () -> JdbcMessageStores.detect(""));
  }
}
