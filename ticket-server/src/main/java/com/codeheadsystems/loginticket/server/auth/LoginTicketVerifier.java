package com.codeheadsystems.loginticket.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.RegisteredClaims;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.loginticket.model.LoginTicket;
import com.codeheadsystems.loginticket.model.TokenPayload;
import com.codeheadsystems.loginticket.server.config.TicketVerifierConfig;
import com.codeheadsystems.loginticket.server.exceptions.TicketVerificationException;
import com.codeheadsystems.loginticket.server.store.VerificationKeyStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies RS256-signed ID tokens and turns them into {@link LoginTicket}s.
 * <p>
 * The signing key is looked up in a {@link VerificationKeyStore} by the token's {@code kid}
 * header. Issuer, audience and the {@code iat}/{@code exp}/{@code nbf} window are checked with
 * the leeway from {@link TicketVerifierConfig}. A ticket is only constructed once every check
 * has passed; its envelope is the decoded JSON header of the token.
 */
@Singleton
public class LoginTicketVerifier {

  private static final Logger log = LoggerFactory.getLogger(LoginTicketVerifier.class);
  private static final Base64.Decoder B64URL = Base64.getUrlDecoder();

  private final TicketVerifierConfig config;
  private final VerificationKeyStore keyStore;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Instantiates a new Login ticket verifier.
   *
   * @param config       the verifier config
   * @param keyStore     the key store
   * @param objectMapper the object mapper used to decode the claim set
   * @param clock        the clock tokens are checked against
   */
  @Inject
  public LoginTicketVerifier(final TicketVerifierConfig config,
                             final VerificationKeyStore keyStore,
                             final ObjectMapper objectMapper,
                             final Clock clock) {
    log.info("LoginTicketVerifier({})", config);
    this.config = config;
    this.keyStore = keyStore;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Instantiates a new Login ticket verifier using the system UTC clock.
   *
   * @param config       the verifier config
   * @param keyStore     the key store
   * @param objectMapper the object mapper
   */
  public LoginTicketVerifier(final TicketVerifierConfig config,
                             final VerificationKeyStore keyStore,
                             final ObjectMapper objectMapper) {
    this(config, keyStore, objectMapper, Clock.systemUTC());
  }

  /**
   * Verifies an ID token.
   *
   * @param idToken the compact serialized token
   * @return the ticket for the verified token
   * @throws TicketVerificationException if any check fails
   */
  public LoginTicket verifyIdToken(final String idToken) {
    if (idToken == null || idToken.isBlank()) {
      throw new TicketVerificationException("ID token is required");
    }

    final DecodedJWT decoded;
    try {
      decoded = JWT.decode(idToken);
    } catch (JWTVerificationException e) {
      throw new TicketVerificationException("ID token is malformed", e);
    }

    final String keyId = decoded.getKeyId();
    if (keyId == null) {
      throw new TicketVerificationException("ID token has no kid header");
    }
    final RSAPublicKey key = keyStore.load(keyId)
        .orElseThrow(() -> new TicketVerificationException("No verification key for kid: " + keyId));

    final DecodedJWT verified;
    try {
      verified = verifierFor(key).verify(decoded);
    } catch (JWTVerificationException e) {
      throw new TicketVerificationException("ID token rejected: " + e.getMessage(), e);
    }

    final Instant latestExpiry = clock.instant().plusSeconds(config.maxTokenLifetimeSeconds());
    if (verified.getExpiresAtAsInstant().isAfter(latestExpiry)) {
      throw new TicketVerificationException(
          "ID token expiry too far in the future: " + verified.getExpiresAtAsInstant());
    }

    final String envelope = new String(B64URL.decode(verified.getHeader()), StandardCharsets.UTF_8);
    final TokenPayload payload = decodePayload(verified.getPayload());
    log.debug("Verified ID token kid={} sub={}", keyId, payload.subject());
    return new LoginTicket(envelope, payload);
  }

  /**
   * Verifies an ID token, logging instead of throwing on failure.
   *
   * @param idToken the compact serialized token
   * @return the ticket, or empty if the token did not verify
   */
  public Optional<LoginTicket> verify(final String idToken) {
    try {
      return Optional.of(verifyIdToken(idToken));
    } catch (TicketVerificationException e) {
      log.debug("ID token verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private JWTVerifier verifierFor(final RSAPublicKey key) {
    final JWTVerifier.BaseVerification verification = (JWTVerifier.BaseVerification) JWT
        .require(Algorithm.RSA256(key, null))
        .withIssuer(config.issuers().toArray(new String[0]))
        .withAnyOfAudience(config.audiences().toArray(new String[0]))
        .withClaimPresence(RegisteredClaims.ISSUED_AT)
        .withClaimPresence(RegisteredClaims.EXPIRES_AT)
        .acceptLeeway(config.clockSkewSeconds());
    return verification.build(clock);
  }

  private TokenPayload decodePayload(final String payloadSegment) {
    try {
      return objectMapper.readValue(B64URL.decode(payloadSegment), TokenPayload.class);
    } catch (IOException | IllegalArgumentException e) {
      throw new TicketVerificationException("ID token payload could not be decoded", e);
    }
  }
}
