package io.syncrelay.relay.dispatch;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Random;

/**
 * Generates correlation identities: 16 random bytes from a {@link SecureRandom}, rendered as 32
 * lower-case hex characters.
 */
public final class CorrelationIds {

  public static final int BYTES = 16;

  private final Random random;

  public CorrelationIds() {
    this(new SecureRandom());
  }

  CorrelationIds(Random random) {
    this.random = Objects.requireNonNull(random, "random");
  }

  public String next() {
    byte[] bytes = new byte[BYTES];
    random.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }
}
