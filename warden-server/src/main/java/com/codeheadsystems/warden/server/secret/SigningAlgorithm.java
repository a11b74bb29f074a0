package com.codeheadsystems.warden.server.secret;

import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.warden.server.config.ConfigurationException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Locale;

/**
 * Token signature algorithms the manager can be configured with.
 */
public enum SigningAlgorithm {
  HS256(Family.HMAC, 0),
  HS384(Family.HMAC, 0),
  HS512(Family.HMAC, 0),
  RS256(Family.RSA, 0),
  RS384(Family.RSA, 0),
  RS512(Family.RSA, 0),
  ES256(Family.EC, 256),
  ES384(Family.EC, 384),
  ES512(Family.EC, 521);

  /**
   * Key family.
   */
  public enum Family {
    HMAC, RSA, EC
  }

  private final Family family;
  private final int curveBits;

  SigningAlgorithm(final Family family, final int curveBits) {
    this.family = family;
    this.curveBits = curveBits;
  }

  /**
   * Parses a configured algorithm name such as {@code HS256}.
   *
   * @throws ConfigurationException for unknown names
   */
  public static SigningAlgorithm parse(final String name) {
    if (name == null) {
      throw new ConfigurationException("tokens.algorithm is required");
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unsupported signing algorithm: " + name, e);
    }
  }

  public Family family() {
    return family;
  }

  public boolean isHmac() {
    return family == Family.HMAC;
  }

  /**
   * Field size in bits the EC key must have, 0 for the other families.
   */
  public int curveBits() {
    return curveBits;
  }

  public Algorithm hmac(final byte[] secret) {
    return switch (this) {
      case HS256 -> Algorithm.HMAC256(secret);
      case HS384 -> Algorithm.HMAC384(secret);
      case HS512 -> Algorithm.HMAC512(secret);
      default -> throw new ConfigurationException(name() + " does not use a shared secret");
    };
  }

  /**
   * Builds an asymmetric algorithm. The private key may be null on verify-only deployments.
   */
  public Algorithm asymmetric(final PublicKey publicKey, final PrivateKey privateKey) {
    try {
      return switch (this) {
        case RS256 -> Algorithm.RSA256((RSAPublicKey) publicKey, (RSAPrivateKey) privateKey);
        case RS384 -> Algorithm.RSA384((RSAPublicKey) publicKey, (RSAPrivateKey) privateKey);
        case RS512 -> Algorithm.RSA512((RSAPublicKey) publicKey, (RSAPrivateKey) privateKey);
        case ES256 -> Algorithm.ECDSA256((ECPublicKey) publicKey, (ECPrivateKey) privateKey);
        case ES384 -> Algorithm.ECDSA384((ECPublicKey) publicKey, (ECPrivateKey) privateKey);
        case ES512 -> Algorithm.ECDSA512((ECPublicKey) publicKey, (ECPrivateKey) privateKey);
        default -> throw new ConfigurationException(name() + " uses a shared secret, not a key pair");
      };
    } catch (ClassCastException e) {
      throw new ConfigurationException("Key type does not match " + name(), e);
    }
  }
}
