package io.intellixity.tessera.persistence.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM password unwrapping.
 * <p>
 * Ciphertext is base64 (padding optional) of {@code nonce(12) || ciphertext || tag(16)}. The key is the
 * SHA-256 digest of {@code username@database}. Values that are not valid base64 or fail authentication
 * are treated as plain passwords.
 */
public final class AesGcmPasswordDecryptor implements PasswordDecryptor {
  private static final Logger log = LoggerFactory.getLogger(AesGcmPasswordDecryptor.class);
  private static final int NONCE_LENGTH = 12;
  private static final int TAG_BITS = 128;
  private static final String TRANSFORMATION = "AES/GCM/NoPadding";

  @Override
  public String decrypt(PoolConfig pool, String password) {
    if (password == null || password.isEmpty()) return password;
    byte[] data;
    try {
      data = Base64.getDecoder().decode(password);
    } catch (IllegalArgumentException e) {
      return password;
    }
    if (data.length <= NONCE_LENGTH + TAG_BITS / 8) return password;

    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key(pool), new GCMParameterSpec(TAG_BITS, data, 0, NONCE_LENGTH));
      byte[] plain = cipher.doFinal(data, NONCE_LENGTH, data.length - NONCE_LENGTH);
      return new String(plain, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      log.debug("tessera.pool password for pool={} is not encrypted; using it verbatim", pool.name());
      return password;
    }
  }

  /** Inverse of {@link #decrypt}; for producing config values. */
  public static String encrypt(PoolConfig pool, String password) {
    try {
      byte[] nonce = new byte[NONCE_LENGTH];
      new SecureRandom().nextBytes(nonce);
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key(pool), new GCMParameterSpec(TAG_BITS, nonce));
      byte[] sealed = cipher.doFinal(password.getBytes(StandardCharsets.UTF_8));
      byte[] out = new byte[nonce.length + sealed.length];
      System.arraycopy(nonce, 0, out, 0, nonce.length);
      System.arraycopy(sealed, 0, out, nonce.length, sealed.length);
      return Base64.getEncoder().withoutPadding().encodeToString(out);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("AES-GCM is not available", e);
    }
  }

  private static SecretKeySpec key(PoolConfig pool) throws GeneralSecurityException {
    String material = pool.username() + "@" + pool.database();
    byte[] digest = MessageDigest.getInstance("SHA-256").digest(material.getBytes(StandardCharsets.UTF_8));
    return new SecretKeySpec(digest, "AES");
  }
}
