package me.internalizable.authgate.fingerprint;

/**
 * Client environment signals, in the fixed order they are hashed.
 * Null values are normalized to empty strings.
 */
public record EnvironmentSignals(
        String displayMetrics,
        String timeZone,
        String language,
        String platform,
        String userAgent
) {

    public EnvironmentSignals {
        displayMetrics = orEmpty(displayMetrics);
        timeZone = orEmpty(timeZone);
        language = orEmpty(language);
        platform = orEmpty(platform);
        userAgent = orEmpty(userAgent);
    }

    public static EnvironmentSignals empty() {
        return new EnvironmentSignals(null, null, null, null, null);
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
