package me.internalizable.authgate.controller;

import jakarta.servlet.http.HttpServletRequest;
import me.internalizable.authgate.dto.CheckRateLimitRequest;
import me.internalizable.authgate.dto.ClientIpResponse;
import me.internalizable.authgate.dto.ErrorResponse;
import me.internalizable.authgate.dto.RateLimitResponse;
import me.internalizable.authgate.dto.RecordAttemptRequest;
import me.internalizable.authgate.ratelimit.AuthRateLimitService;
import me.internalizable.authgate.ratelimit.RateLimitDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * HTTP surface of the gate: the rate limit check/record pair used by remote
 * sign-in flows, and the first-party address echo used as the first identity tier.
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class AuthRateLimitController {

    private static final Logger logger = LoggerFactory.getLogger(AuthRateLimitController.class);

    private final AuthRateLimitService rateLimitService;

    public AuthRateLimitController(AuthRateLimitService rateLimitService) {
        this.rateLimitService = rateLimitService;
    }

    @PostMapping("/auth-rate-limit/check")
    public RateLimitResponse check(@RequestBody CheckRateLimitRequest body, HttpServletRequest request) {
        requireEmail(body.email());
        String identity = identityOf(body.ipAddress(), request);

        RateLimitDecision decision = rateLimitService.checkRateLimit(body.email(), identity);
        return RateLimitResponse.from(decision);
    }

    @PostMapping("/auth-rate-limit/record")
    public ResponseEntity<Void> record(@RequestBody RecordAttemptRequest body, HttpServletRequest request) {
        requireEmail(body.email());
        String identity = identityOf(body.ipAddress(), request);

        rateLimitService.recordAttempt(body.email(), identity, body.success(), body.userAgent());
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/get-client-ip")
    public ClientIpResponse clientIp(HttpServletRequest request) {
        return new ClientIpResponse(ClientAddresses.of(request));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        logger.debug("Rejected rate limit request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.of(e.getMessage()));
    }

    private static void requireEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email is required");
        }
    }

    private static String identityOf(String reported, HttpServletRequest request) {
        if (reported != null && !reported.isBlank()) {
            return reported;
        }
        return ClientAddresses.of(request);
    }
}
