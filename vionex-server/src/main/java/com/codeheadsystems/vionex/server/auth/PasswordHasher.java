package com.codeheadsystems.vionex.server.auth;

import com.codeheadsystems.vionex.server.error.HashingFailedException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Objects;
import org.bouncycastle.crypto.generators.OpenBSDBCrypt;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-way bcrypt hashing of user passwords.
 * <p>
 * Hashes are self-describing {@code $2y$} modular crypt strings carrying a 16-byte random salt
 * and the work factor, so a cost change only affects newly created hashes.
 * <p>
 * bcrypt reads at most 72 bytes of input. Longer passwords are refused instead of silently
 * truncated: {@link #hash} throws and {@link #verify} reports a mismatch.
 */
public class PasswordHasher {

  private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);

  public static final int MIN_COST = 4;
  public static final int MAX_COST = 31;
  public static final int MAX_PASSWORD_BYTES = 72;

  private static final int SALT_LENGTH = 16;

  private final int cost;
  private final SecureRandom random;
  private final String timingHash;

  /**
   * @param cost bcrypt work factor, {@value #MIN_COST} to {@value #MAX_COST}
   */
  public PasswordHasher(int cost) {
    this(cost, new SecureRandom());
  }

  PasswordHasher(int cost, SecureRandom random) {
    if (cost < MIN_COST || cost > MAX_COST) {
      throw new IllegalArgumentException("bcrypt cost must be between " + MIN_COST + " and " + MAX_COST
          + ": " + cost);
    }
    this.cost = cost;
    this.random = random;
    byte[] filler = new byte[SALT_LENGTH];
    random.nextBytes(filler);
    this.timingHash = hash(Hex.toHexString(filler));
    log.debug("PasswordHasher initialized with cost {}", cost);
  }

  /**
   * Hashes a password with a fresh random salt.
   *
   * @throws HashingFailedException if the password is longer than {@value #MAX_PASSWORD_BYTES}
   *                                UTF-8 bytes or the bcrypt implementation fails
   */
  public String hash(String password) {
    Objects.requireNonNull(password, "password");
    if (exceedsLimit(password)) {
      throw new HashingFailedException("Password exceeds " + MAX_PASSWORD_BYTES + " bytes", null);
    }
    byte[] salt = new byte[SALT_LENGTH];
    random.nextBytes(salt);
    try {
      return OpenBSDBCrypt.generate(password.toCharArray(), salt, cost);
    } catch (RuntimeException e) {
      throw new HashingFailedException("bcrypt hashing failed", e);
    }
  }

  /**
   * Checks a password against a stored hash.
   *
   * @return true on match, false on mismatch
   * @throws HashingFailedException if {@code storedHash} is missing or not a bcrypt string
   */
  public boolean verify(String password, String storedHash) {
    if (storedHash == null) {
      throw new HashingFailedException("No stored hash to verify against", null);
    }
    if (password == null || exceedsLimit(password)) {
      return false;
    }
    try {
      return OpenBSDBCrypt.checkPassword(storedHash, password.toCharArray());
    } catch (RuntimeException e) {
      throw new HashingFailedException("Stored hash could not be parsed", e);
    }
  }

  /**
   * Runs one verification against an internal hash and discards the result, so rejecting an
   * unknown account costs the same time as rejecting a wrong password.
   */
  public void equalizeTiming(String password) {
    verify(password == null ? "" : password, timingHash);
  }

  static boolean exceedsLimit(String password) {
    return password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
  }
}
