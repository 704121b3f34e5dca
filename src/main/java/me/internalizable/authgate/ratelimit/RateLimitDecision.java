package me.internalizable.authgate.ratelimit;

/**
 * Answer to a rate limit check. A denial always carries a positive wait.
 */
public record RateLimitDecision(boolean allowed, int remainingSeconds, int attempts, int lockoutMinutes) {

    public RateLimitDecision {
        if (!allowed && remainingSeconds <= 0) {
            throw new IllegalArgumentException("A denied decision needs a positive remainingSeconds");
        }
    }

    public static RateLimitDecision allow(int attempts) {
        return new RateLimitDecision(true, 0, attempts, 0);
    }

    /**
     * Used whenever the gate cannot determine state.
     */
    public static RateLimitDecision failOpen() {
        return allow(0);
    }

    public static RateLimitDecision deny(long remainingSeconds, int attempts) {
        int seconds = (int) Math.max(1L, Math.min(remainingSeconds, Integer.MAX_VALUE));
        return new RateLimitDecision(false, seconds, attempts, minutes(seconds));
    }

    public String lockoutMessage() {
        int minutes = minutes(remainingSeconds);
        return String.format("Too many failed login attempts. Please try again in %d %s.",
                minutes, minutes == 1 ? "minute" : "minutes");
    }

    private static int minutes(int seconds) {
        return (seconds + 59) / 60;
    }
}
