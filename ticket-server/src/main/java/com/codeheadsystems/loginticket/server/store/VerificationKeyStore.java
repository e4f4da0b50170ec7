package com.codeheadsystems.loginticket.server.store;

import java.security.interfaces.RSAPublicKey;
import java.util.Optional;
import java.util.Set;

/**
 * Storage abstraction for the public keys that sign ID tokens, keyed by the {@code kid}
 * header.
 * <p>
 * Implementations must be thread-safe. Keys are registered by the caller; nothing here fetches
 * them remotely.
 */
public interface VerificationKeyStore {

  /**
   * Stores a key, replacing any key with the same id.
   *
   * @param keyId the key id
   * @param key   the public key
   */
  void store(String keyId, RSAPublicKey key);

  /**
   * Loads a key by id.
   *
   * @param keyId the key id
   * @return the key, or empty if unknown
   */
  Optional<RSAPublicKey> load(String keyId);

  /**
   * Removes a key. Tokens signed with it stop verifying. Unknown ids are ignored.
   *
   * @param keyId the key id
   */
  void revoke(String keyId);

  /**
   * Key ids currently stored.
   *
   * @return a snapshot of the ids
   */
  Set<String> keyIds();
}
