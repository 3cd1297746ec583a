package com.codeheadsystems.vionex.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.vionex.server.error.HashingFailedException;
import org.junit.jupiter.api.Test;

class PasswordHasherTest {

  private final PasswordHasher hasher = new PasswordHasher(PasswordHasher.MIN_COST);

  @Test
  void verify_matchingPassword_returnsTrue() {
    String hash = hasher.hash("correct horse battery");

    assertThat(hasher.verify("correct horse battery", hash)).isTrue();
  }

  @Test
  void verify_differentPassword_returnsFalse() {
    String hash = hasher.hash("correct horse battery");

    assertThat(hasher.verify("correct horse battery staple", hash)).isFalse();
  }

  @Test
  void hash_isSaltedButBothVerify() {
    String first = hasher.hash("s3cret-password");
    String second = hasher.hash("s3cret-password");

    assertThat(first).isNotEqualTo(second);
    assertThat(hasher.verify("s3cret-password", first)).isTrue();
    assertThat(hasher.verify("s3cret-password", second)).isTrue();
  }

  @Test
  void hash_isSelfDescribingBcrypt() {
    assertThat(hasher.hash("s3cret-password")).startsWith("$2y$04$").hasSize(60);
  }

  @Test
  void verify_hashFromHigherCost_stillVerifies() {
    String hash = new PasswordHasher(5).hash("s3cret-password");

    assertThat(hasher.verify("s3cret-password", hash)).isTrue();
  }

  @Test
  void verify_unparsableHash_throwsHashingFailed() {
    assertThatThrownBy(() -> hasher.verify("s3cret-password", "not-a-bcrypt-hash"))
        .isInstanceOf(HashingFailedException.class);
  }

  @Test
  void verify_missingHash_throwsHashingFailed() {
    assertThatThrownBy(() -> hasher.verify("s3cret-password", null))
        .isInstanceOf(HashingFailedException.class);
  }

  @Test
  void overlongPassword_isRefused() {
    String longPassword = "a".repeat(PasswordHasher.MAX_PASSWORD_BYTES + 1);
    String hashOf72 = hasher.hash("a".repeat(PasswordHasher.MAX_PASSWORD_BYTES));

    assertThatThrownBy(() -> hasher.hash(longPassword)).isInstanceOf(HashingFailedException.class);
    assertThat(hasher.verify(longPassword, hashOf72)).isFalse();
  }

  @Test
  void constructor_rejectsCostOutOfRange() {
    assertThatThrownBy(() -> new PasswordHasher(3)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new PasswordHasher(32)).isInstanceOf(IllegalArgumentException.class);
  }
}
