package com.codeheadsystems.warden.server.token;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * 128 random bits from {@link SecureRandom}, hex encoded.
 */
public class SecureRandomIdGenerator implements IdGenerator {

  private static final int ID_BYTES = 16;

  private final SecureRandom random;

  public SecureRandomIdGenerator() {
    this(new SecureRandom());
  }

  public SecureRandomIdGenerator(final SecureRandom random) {
    this.random = random;
  }

  @Override
  public String newId() {
    final byte[] bytes = new byte[ID_BYTES];
    random.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }
}
