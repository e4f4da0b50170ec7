package com.codeheadsystems.loginticket.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Wire model for the nested {@code google} claim: the request's access levels and device
 * information.
 *
 * @param accessLevels the access levels that apply to this request; present only if one or
 *                     more access levels apply. Order is preserved.
 * @param deviceId     the device tied to this request; present only if a device policy is
 *                     specified and the organization has access to device data
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleClaim(
    @JsonProperty("access_levels") List<String> accessLevels,
    @JsonProperty("device_id") String deviceId) {

  /**
   * Copies the access levels so the claim cannot change after construction.
   */
  public GoogleClaim {
    accessLevels = accessLevels == null
        ? null
        : Collections.unmodifiableList(new ArrayList<>(accessLevels));
  }
}
