package io.intellixity.tessera.persistence.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class AesGcmPasswordDecryptorTest {
  private final PoolConfig pool = PoolConfig.of("main", "demo", "app", "");

  @Test
  void decryptsValuesItEncrypted() {
    String sealed = AesGcmPasswordDecryptor.encrypt(pool, "s3cret!");
    assertNotEquals("s3cret!", sealed);
    assertEquals("s3cret!", new AesGcmPasswordDecryptor().decrypt(pool, sealed));
  }

  @Test
  void keyDependsOnUserAndDatabase() {
    String sealed = AesGcmPasswordDecryptor.encrypt(pool, "s3cret!");
    PoolConfig other = PoolConfig.of("main", "other", "app", "");
    assertEquals(sealed, new AesGcmPasswordDecryptor().decrypt(other, sealed));
  }

  @Test
  void plainPasswordsPassThrough() {
    AesGcmPasswordDecryptor d = new AesGcmPasswordDecryptor();
    assertEquals("secret", d.decrypt(pool, "secret"));
    assertEquals("not base64 at all!", d.decrypt(pool, "not base64 at all!"));
    assertEquals("", d.decrypt(pool, ""));
  }
}
