package me.internalizable.authgate.fingerprint;

/**
 * Reduces a tuple of environment signals to a short, stable hex identifier.
 *
 * The signals are joined with {@code |} and folded with a 31-multiplier
 * polynomial hash over UTF-16 code units, wrapped to 32 bits. The absolute
 * value is taken in 64-bit space so {@link Integer#MIN_VALUE} renders as
 * {@code 80000000} instead of a negative number.
 *
 * Not a fingerprinting solution in any serious sense: it is a pseudonymous
 * fallback used only when no network address can be resolved.
 */
public final class FingerprintGenerator {

    static final char DELIMITER = '|';

    private FingerprintGenerator() {
    }

    public static String generate(EnvironmentSignals signals) {
        EnvironmentSignals source = signals != null ? signals : EnvironmentSignals.empty();

        String raw = source.displayMetrics() + DELIMITER
                + source.timeZone() + DELIMITER
                + source.language() + DELIMITER
                + source.platform() + DELIMITER
                + source.userAgent();

        return Long.toHexString(Math.abs((long) hash(raw)));
    }

    static int hash(String raw) {
        int h = 0;
        for (int i = 0; i < raw.length(); i++) {
            h = h * 31 + raw.charAt(i);
        }
        return h;
    }
}
