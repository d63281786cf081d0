package io.intellixity.tessera.persistence.config;

/**
 * Unwraps a pool password that may be stored encrypted in config.
 * <p>
 * Implementations return the input unchanged when it is not ciphertext they recognize.
 */
@FunctionalInterface
public interface PasswordDecryptor {
  PasswordDecryptor NONE = (pool, password) -> password;

  String decrypt(PoolConfig pool, String password);
}
