package com.codeheadsystems.loginticket.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TicketVerifierConfigTest {

  @Test
  void audienceOnly_usesGoogleDefaults() {
    TicketVerifierConfig config = new TicketVerifierConfig(List.of("client1"));

    assertThat(config.issuers()).containsExactly("accounts.google.com", "https://accounts.google.com");
    assertThat(config.audiences()).containsExactly("client1");
    assertThat(config.clockSkewSeconds()).isEqualTo(300);
    assertThat(config.maxTokenLifetimeSeconds()).isEqualTo(86400);
  }

  @Test
  void lists_areCopied() {
    List<String> audiences = new ArrayList<>(List.of("client1"));
    TicketVerifierConfig config = new TicketVerifierConfig(audiences);
    audiences.add("client2");

    assertThat(config.audiences()).containsExactly("client1");
  }

  @Test
  void emptyAudiences_rejected() {
    assertThatThrownBy(() -> new TicketVerifierConfig(List.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("audience");
  }

  @Test
  void emptyIssuers_rejected() {
    assertThatThrownBy(() -> new TicketVerifierConfig(List.of(), List.of("client1"), 0, 60))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("issuer");
  }

  @Test
  void negativeClockSkew_rejected() {
    assertThatThrownBy(() -> new TicketVerifierConfig(List.of("iss"), List.of("client1"), -1, 60))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("clockSkewSeconds");
  }

  @Test
  void nonPositiveLifetime_rejected() {
    assertThatThrownBy(() -> new TicketVerifierConfig(List.of("iss"), List.of("client1"), 0, 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("maxTokenLifetimeSeconds");
  }
}
