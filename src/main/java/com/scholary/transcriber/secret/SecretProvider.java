package com.scholary.transcriber.secret;

/**
 * Encrypts opaque payloads with the key shared with the remote service.
 *
 * <p>The orchestrator only forwards the resulting ciphertext; it never sees the key or the cipher.
 * No implementation ships with this module. When no bean is present, tasks created with a secret
 * payload fail at submission.
 */
public interface SecretProvider {

  /**
   * @param plaintext the payload to protect
   * @return ciphertext in the string form the remote service expects
   * @throws SecretEncryptionException if the payload cannot be encrypted
   */
  String encrypt(String plaintext);
}
