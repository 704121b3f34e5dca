package me.internalizable.authgate.controller;

import me.internalizable.authgate.identity.ClientIdentityResolver;
import me.internalizable.authgate.ratelimit.AuthRateLimitService;
import me.internalizable.authgate.ratelimit.LocalRateLimitStore;
import me.internalizable.authgate.ratelimit.RateLimitPolicy;
import me.internalizable.authgate.ratelimit.StoreBackedRateLimitGate;
import me.internalizable.authgate.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AuthRateLimitControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        StoreBackedRateLimitGate gate = new StoreBackedRateLimitGate(
                LocalRateLimitStore.builder().maxSize(100).build(),
                RateLimitPolicy.defaults(),
                record -> { },
                MutableClock.startingAt("2026-02-01T12:00:00Z"));
        ClientIdentityResolver resolver = new ClientIdentityResolver(List.of(), () -> null, Runnable::run);
        AuthRateLimitService service = new AuthRateLimitService(gate, resolver, true);

        mockMvc = MockMvcBuilders.standaloneSetup(new AuthRateLimitController(service)).build();
    }

    private void recordFailure(String email) throws Exception {
        mockMvc.perform(post("/api/auth-rate-limit/record")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + email + "\",\"ip_address\":\"203.0.113.3\",\"success\":false,\"user_agent\":\"Mozilla/5.0\"}"))
                .andExpect(status().isAccepted());
    }

    @Test
    void testCheck_freshKey() throws Exception {
        mockMvc.perform(post("/api/auth-rate-limit/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ivan@example.com\",\"ip_address\":\"203.0.113.3\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(true))
                .andExpect(jsonPath("$.remaining_seconds").value(0))
                .andExpect(jsonPath("$.attempts").value(0))
                .andExpect(jsonPath("$.lockout_time_minutes").value(0));
    }

    @Test
    void testCheck_afterFiveFailures_locked() throws Exception {
        for (int i = 0; i < 5; i++) {
            recordFailure("ivan@example.com");
        }

        mockMvc.perform(post("/api/auth-rate-limit/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ivan@example.com\"}")
                        .header("X-Forwarded-For", "198.51.100.8"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(false))
                .andExpect(jsonPath("$.remaining_seconds").value(60))
                .andExpect(jsonPath("$.attempts").value(5))
                .andExpect(jsonPath("$.lockout_time_minutes").value(1));
    }

    @Test
    void testCheck_missingEmail_badRequest() throws Exception {
        mockMvc.perform(post("/api/auth-rate-limit/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ip_address\":\"203.0.113.3\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("email is required"));
    }

    @Test
    void testRecord_blankEmail_badRequest() throws Exception {
        mockMvc.perform(post("/api/auth-rate-limit/record")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\" \",\"success\":true}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testClientIp_echoesForwardedAddress() throws Exception {
        mockMvc.perform(get("/api/get-client-ip").header("X-Forwarded-For", "203.0.113.50, 10.1.1.1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ip").value("203.0.113.50"));
    }
}
