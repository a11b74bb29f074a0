package com.codeheadsystems.warden.server.secret;

import com.codeheadsystems.warden.server.config.ConfigurationException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.spec.RSAPublicKeySpec;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

/**
 * Loads RSA and EC keys from PEM files. Accepts PKCS#8 and traditional private keys, SPKI public keys
 * and X.509 certificates. Encrypted keys are not supported.
 */
public final class PemKeyReader {

  private static final JcaPEMKeyConverter CONVERTER = new JcaPEMKeyConverter();

  private PemKeyReader() {
  }

  /**
   * Reads a key pair. With no private key path the pair is verify-only and its private key is null.
   *
   * @param privateKeyPath PEM private key, may be null
   * @param publicKeyPath  PEM public key or certificate, may be null when the private key file holds
   *                       both halves or is an RSA CRT key
   * @return the key pair
   */
  public static KeyPair readKeyPair(final Path privateKeyPath, final Path publicKeyPath) {
    if (privateKeyPath == null && publicKeyPath == null) {
      throw new ConfigurationException("Either a private or a public key PEM path is required");
    }
    PrivateKey privateKey = null;
    PublicKey publicKey = null;
    if (privateKeyPath != null) {
      final Object parsed = readObject(privateKeyPath);
      try {
        if (parsed instanceof PEMKeyPair pair) {
          final KeyPair keyPair = CONVERTER.getKeyPair(pair);
          privateKey = keyPair.getPrivate();
          publicKey = keyPair.getPublic();
        } else if (parsed instanceof PrivateKeyInfo info) {
          privateKey = CONVERTER.getPrivateKey(info);
        } else {
          throw new ConfigurationException(privateKeyPath + " does not contain an unencrypted private key");
        }
      } catch (IOException e) {
        throw new ConfigurationException("Unable to decode private key " + privateKeyPath, e);
      }
    }
    if (publicKeyPath != null) {
      publicKey = readPublicKey(publicKeyPath);
    } else if (publicKey == null) {
      publicKey = derivePublicKey(privateKey, privateKeyPath);
    }
    return new KeyPair(publicKey, privateKey);
  }

  public static PublicKey readPublicKey(final Path path) {
    final Object parsed = readObject(path);
    try {
      if (parsed instanceof SubjectPublicKeyInfo info) {
        return CONVERTER.getPublicKey(info);
      }
      if (parsed instanceof X509CertificateHolder certificate) {
        return CONVERTER.getPublicKey(certificate.getSubjectPublicKeyInfo());
      }
      if (parsed instanceof PEMKeyPair pair) {
        return CONVERTER.getPublicKey(pair.getPublicKeyInfo());
      }
    } catch (IOException e) {
      throw new ConfigurationException("Unable to decode public key " + path, e);
    }
    throw new ConfigurationException(path + " does not contain a public key");
  }

  private static PublicKey derivePublicKey(final PrivateKey privateKey, final Path path) {
    if (privateKey instanceof RSAPrivateCrtKey crt) {
      try {
        return KeyFactory.getInstance("RSA")
            .generatePublic(new RSAPublicKeySpec(crt.getModulus(), crt.getPublicExponent()));
      } catch (GeneralSecurityException e) {
        throw new ConfigurationException("Unable to derive public key from " + path, e);
      }
    }
    throw new ConfigurationException("A public key PEM path is required alongside " + path);
  }

  private static Object readObject(final Path path) {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.US_ASCII);
         PEMParser parser = new PEMParser(reader)) {
      final Object parsed = parser.readObject();
      if (parsed == null) {
        throw new ConfigurationException(path + " contains no PEM object");
      }
      return parsed;
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read PEM file " + path, e);
    }
  }
}
