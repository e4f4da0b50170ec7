package com.codeheadsystems.loginticket.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.loginticket.server.config.TicketVerifierConfig;
import com.codeheadsystems.loginticket.server.exceptions.TicketVerificationException;
import com.codeheadsystems.loginticket.server.store.VerificationKeyStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LoginTicketVerifierKeyStoreTest {

  private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);
  private static final String CLIENT_ID = "client1";

  private static KeyPair keys;

  @Mock private VerificationKeyStore keyStore;

  private LoginTicketVerifier verifier;

  @BeforeAll
  static void generateKeys() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048);
    keys = generator.generateKeyPair();
  }

  @BeforeEach
  void setUp() {
    verifier = new LoginTicketVerifier(new TicketVerifierConfig(List.of(CLIENT_ID)), keyStore,
        new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static String token(String keyId) {
    return JWT.create()
        .withKeyId(keyId)
        .withIssuer("accounts.google.com")
        .withAudience(CLIENT_ID)
        .withSubject("12345")
        .withIssuedAt(NOW)
        .withExpiresAt(NOW.plusSeconds(600))
        .sign(Algorithm.RSA256((RSAPublicKey) keys.getPublic(), (RSAPrivateKey) keys.getPrivate()));
  }

  @Test
  void verifyIdToken_looksUpKeyByKid() {
    when(keyStore.load("rotating-7")).thenReturn(Optional.of((RSAPublicKey) keys.getPublic()));

    assertThat(verifier.verifyIdToken(token("rotating-7")).getUserId()).contains("12345");
    verify(keyStore).load("rotating-7");
  }

  @Test
  void verifyIdToken_keyMissing_throws() {
    when(keyStore.load("gone")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> verifier.verifyIdToken(token("gone")))
        .isInstanceOf(TicketVerificationException.class)
        .hasMessageContaining("gone");
  }

  @Test
  void verifyIdToken_malformed_neverTouchesStore() {
    assertThatThrownBy(() -> verifier.verifyIdToken("a.b"))
        .isInstanceOf(TicketVerificationException.class);
    verifyNoInteractions(keyStore);
  }
}
