package mailqueue.jdbc.store;

import mailqueue.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class JdbcStoreConfigTest {

  @Test
  void defaults() {
    JdbcStoreConfig config = JdbcStoreConfig.defaults();

    assertEquals("email_queue", config.tableName());
    assertEquals(3, config.defaultMaxRetries());
    assertEquals(2, config.maxAttempts());
    assertSame(JsonCodec.getDefault(), config.jsonCodec());
    assertNotNull(config.clock());
  }

  @Test
  void customValues() {
    Clock fixed = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    JdbcStoreConfig config = JdbcStoreConfig.builder()
        .tableName("tenant_mail")
        .clock(fixed)
        .defaultMaxRetries(10)
        .maxAttempts(4)
        .build();

    assertEquals("tenant_mail", config.tableName());
    assertSame(fixed, config.clock());
    assertEquals(10, config.defaultMaxRetries());
    assertEquals(4, config.maxAttempts());
  }

  @Test
  void rejectsInvalidTableName() {
    assertThrows(IllegalArgumentException.class,
        () -> JdbcStoreConfig.builder().tableName("mail jobs").build());
  }

  @Test
  void rejectsRetryBudgetOutOfRange() {
    assertThrows(IllegalArgumentException.class,
        () -> JdbcStoreConfig.builder().defaultMaxRetries(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> JdbcStoreConfig.builder().defaultMaxRetries(11).build());
  }

  @Test
  void rejectsNonPositiveAttempts() {
    assertThrows(IllegalArgumentException.class,
        () -> JdbcStoreConfig.builder().maxAttempts(0).build());
  }
}
