package com.codeheadsystems.warden.server.store;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Builds revocation list keys. Whole tokens are keyed by their SHA-256 hash so the list never holds
 * a usable token; token ids are keyed directly.
 */
public final class RevocationKeys {

  private RevocationKeys() {
  }

  public static String forToken(final String token) {
    try {
      final byte[] digest = MessageDigest.getInstance("SHA-256").digest(token.getBytes(StandardCharsets.UTF_8));
      return "sha256:" + HexFormat.of().formatHex(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  public static String forTokenId(final String tokenId) {
    return "jti:" + tokenId;
  }
}
