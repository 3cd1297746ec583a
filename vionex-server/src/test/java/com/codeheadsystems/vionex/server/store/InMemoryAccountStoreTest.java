package com.codeheadsystems.vionex.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.vionex.server.auth.Role;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryAccountStoreTest {

  private InMemoryAccountStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryAccountStore();
  }

  private static Account account(String id, String username, String email) {
    return new Account(id, username, email, "$2y$04$hash", Role.VIEWER, true, null);
  }

  @Test
  void findsByUsernameOrEmail_caseInsensitive() {
    store.create(account("1", "Alice", "alice@example.com"));

    assertThat(store.findByUsernameOrEmail("alice")).map(Account::id).contains("1");
    assertThat(store.findByUsernameOrEmail("ALICE@example.com")).map(Account::id).contains("1");
    assertThat(store.findByUsernameOrEmail("bob")).isEmpty();
    assertThat(store.findByUsernameOrEmail(null)).isEmpty();
  }

  @Test
  void create_rejectsDuplicateUsernameOrEmail() {
    assertThat(store.create(account("1", "alice", "alice@example.com"))).isTrue();

    assertThat(store.create(account("2", "alice", "other@example.com"))).isFalse();
    assertThat(store.create(account("3", "bob", "Alice@Example.com"))).isFalse();
    assertThat(store.findById("2")).isEmpty();
  }

  @Test
  void recordLogin_updatesLastLogin() {
    store.create(account("1", "alice", "alice@example.com"));
    Instant when = Instant.parse("2026-03-01T10:00:00Z");

    store.recordLogin("1", when);
    store.recordLogin("missing", when);

    assertThat(store.findById("1")).map(Account::lastLogin).contains(when);
  }
}
