package com.codeheadsystems.loginticket.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Wire model for the claim set of a signed ID token.
 * <p>
 * Component names follow Java conventions; the {@link JsonProperty} names are the claim names
 * the issuer puts on the wire and must not change. Optional claims are null when the issuer
 * did not send them. {@code email_verified} is a {@link Boolean} so that "absent" stays
 * distinct from "false". Claims not listed here are ignored on decode.
 *
 * @param issuer          the Issuer Identifier of the response. Always
 *                        {@code https://accounts.google.com} or {@code accounts.google.com}
 *                        for Google ID tokens.
 * @param accessTokenHash access token hash, binding the access token to this identity token.
 *                        Included when the token was issued alongside an access token in the
 *                        server flow.
 * @param emailVerified   true if the user's e-mail address has been verified
 * @param subject         identifier for the user, unique among all accounts of the issuer and
 *                        never reused. Use this as the user key within an application; an
 *                        account's email may change but its subject does not.
 * @param authorizedParty the client id of the authorized presenter. Only needed when the party
 *                        requesting the token is not the audience, e.g. a web and an Android
 *                        client sharing one project.
 * @param email           the user's email address. Not unique and not suitable as a primary
 *                        key. Provided only if the scope included {@code email}.
 * @param profile         the URL of the user's profile page
 * @param picture         the URL of the user's profile picture
 * @param name            the user's full name, in a displayable form
 * @param givenName       the user's given name
 * @param familyName      the user's family name
 * @param audience        the OAuth 2.0 client id this token is intended for
 * @param issuedAt        issue time in Unix seconds
 * @param expiresAt       expiry time in Unix seconds
 * @param nonce           the nonce supplied by the app in the authentication request; present
 *                        it only once to protect against replay
 * @param hostedDomain    the hosted domain of the user, only if the user belongs to one
 * @param locale          the user's locale as a BCP 47 language tag
 * @param google          access levels and device information of the request, if present
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenPayload(
    @JsonProperty("iss") String issuer,
    @JsonProperty("at_hash") String accessTokenHash,
    @JsonProperty("email_verified") Boolean emailVerified,
    @JsonProperty("sub") String subject,
    @JsonProperty("azp") String authorizedParty,
    @JsonProperty("email") String email,
    @JsonProperty("profile") String profile,
    @JsonProperty("picture") String picture,
    @JsonProperty("name") String name,
    @JsonProperty("given_name") String givenName,
    @JsonProperty("family_name") String familyName,
    @JsonProperty("aud") String audience,
    @JsonProperty("iat") long issuedAt,
    @JsonProperty("exp") long expiresAt,
    @JsonProperty("nonce") String nonce,
    @JsonProperty("hd") String hostedDomain,
    @JsonProperty("locale") String locale,
    @JsonProperty("google") GoogleClaim google) {

  /**
   * Creates a payload holding only the required claims.
   *
   * @param issuer    the issuer
   * @param subject   the subject
   * @param audience  the audience
   * @param issuedAt  the issue time in Unix seconds
   * @param expiresAt the expiry time in Unix seconds
   * @return the token payload
   */
  public static TokenPayload of(final String issuer,
                                final String subject,
                                final String audience,
                                final long issuedAt,
                                final long expiresAt) {
    return new TokenPayload(issuer, null, null, subject, null, null, null, null, null, null, null,
        audience, issuedAt, expiresAt, null, null, null, null);
  }

  /**
   * Issued at instant.
   *
   * @return the instant
   */
  @JsonIgnore
  public Instant issuedAtInstant() {
    return Instant.ofEpochSecond(issuedAt);
  }

  /**
   * Expires at instant.
   *
   * @return the instant
   */
  @JsonIgnore
  public Instant expiresAtInstant() {
    return Instant.ofEpochSecond(expiresAt);
  }
}
