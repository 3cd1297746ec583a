package com.codeheadsystems.vionex.server.auth;

import java.security.SecureRandom;
import org.bouncycastle.util.encoders.Base32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Placeholder second factor.
 * <p>
 * <strong>This provides no security.</strong> {@link #verifyCode} accepts any code made of
 * exactly six ASCII digits, whatever the secret. It exists so clients can integrate against
 * the two-factor endpoints before a real HOTP/TOTP implementation replaces it, and must not
 * be relied on to protect an account.
 */
public class TwoFactorStub {

  private static final Logger log = LoggerFactory.getLogger(TwoFactorStub.class);

  private static final int SECRET_BYTES = 20;
  private static final int CODE_LENGTH = 6;

  private final SecureRandom random;

  public TwoFactorStub() {
    this(new SecureRandom());
  }

  TwoFactorStub(SecureRandom random) {
    this.random = random;
    log.warn("TwoFactorStub accepts any six-digit code; it is NOT a real second factor");
  }

  /**
   * @return 20 random bytes as a 32-character Base32 string
   */
  public String generateSecret() {
    byte[] secret = new byte[SECRET_BYTES];
    random.nextBytes(secret);
    return Base32.toBase32String(secret);
  }

  /**
   * @return true if {@code code} is exactly six ASCII digits; {@code secret} is ignored
   */
  public boolean verifyCode(String secret, String code) {
    if (code == null || code.length() != CODE_LENGTH) {
      return false;
    }
    for (int i = 0; i < CODE_LENGTH; i++) {
      char c = code.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }
}
