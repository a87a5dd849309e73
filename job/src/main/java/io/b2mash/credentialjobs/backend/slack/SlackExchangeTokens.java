package io.b2mash.credentialjobs.backend.slack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Content of the exchange tokens secret. */
@JsonIgnoreProperties(ignoreUnknown = true)
record SlackExchangeTokens(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("client_secret") String clientSecret,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("access_token") String accessToken) {}
