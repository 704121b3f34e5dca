package me.internalizable.authgate.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordAttemptRequest(
        String email,
        @JsonProperty("ip_address") String ipAddress,
        boolean success,
        @JsonProperty("user_agent") String userAgent
) {}
