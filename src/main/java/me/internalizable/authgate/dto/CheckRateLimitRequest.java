package me.internalizable.authgate.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckRateLimitRequest(
        String email,
        @JsonProperty("ip_address") String ipAddress,
        @JsonProperty("user_agent") String userAgent
) {}
