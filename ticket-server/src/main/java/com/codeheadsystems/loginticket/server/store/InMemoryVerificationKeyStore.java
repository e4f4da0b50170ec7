package com.codeheadsystems.loginticket.server.store;

import java.security.interfaces.RSAPublicKey;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link VerificationKeyStore} backed by a {@link ConcurrentHashMap}.
 */
@Singleton
public class InMemoryVerificationKeyStore implements VerificationKeyStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryVerificationKeyStore.class);

  private final ConcurrentHashMap<String, RSAPublicKey> keys = new ConcurrentHashMap<>();

  @Override
  public void store(final String keyId, final RSAPublicKey key) {
    if (keyId == null || keyId.isBlank()) {
      throw new IllegalArgumentException("keyId is required");
    }
    if (key == null) {
      throw new IllegalArgumentException("key is required for keyId: " + keyId);
    }
    keys.put(keyId, key);
    log.debug("Stored verification key kid={}", keyId);
  }

  @Override
  public Optional<RSAPublicKey> load(final String keyId) {
    if (keyId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(keys.get(keyId));
  }

  @Override
  public void revoke(final String keyId) {
    if (keyId != null && keys.remove(keyId) != null) {
      log.debug("Revoked verification key kid={}", keyId);
    }
  }

  @Override
  public Set<String> keyIds() {
    return Set.copyOf(keys.keySet());
  }
}
