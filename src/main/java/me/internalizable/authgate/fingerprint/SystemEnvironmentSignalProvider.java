package me.internalizable.authgate.fingerprint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.DisplayMode;
import java.awt.GraphicsEnvironment;
import java.util.Locale;
import java.util.TimeZone;
import java.util.function.Supplier;

/**
 * Collects signals from the running JVM. Every signal can be pinned through
 * configuration, which is how embedding clients pass their real values:
 *
 * - auth-gate.fingerprint.display-metrics
 * - auth-gate.fingerprint.time-zone
 * - auth-gate.fingerprint.language
 * - auth-gate.fingerprint.platform
 * - auth-gate.fingerprint.user-agent
 */
@Component
public class SystemEnvironmentSignalProvider implements EnvironmentSignalProvider {

    private static final Logger logger = LoggerFactory.getLogger(SystemEnvironmentSignalProvider.class);

    private final String displayMetrics;
    private final String timeZone;
    private final String language;
    private final String platform;
    private final String userAgent;

    public SystemEnvironmentSignalProvider(
            @Value("${auth-gate.fingerprint.display-metrics:}") String displayMetrics,
            @Value("${auth-gate.fingerprint.time-zone:}") String timeZone,
            @Value("${auth-gate.fingerprint.language:}") String language,
            @Value("${auth-gate.fingerprint.platform:}") String platform,
            @Value("${auth-gate.fingerprint.user-agent:}") String userAgent) {
        this.displayMetrics = displayMetrics;
        this.timeZone = timeZone;
        this.language = language;
        this.platform = platform;
        this.userAgent = userAgent;
    }

    @Override
    public EnvironmentSignals collect() {
        return new EnvironmentSignals(
                pick(displayMetrics, SystemEnvironmentSignalProvider::screenMetrics),
                pick(timeZone, () -> TimeZone.getDefault().getID()),
                pick(language, () -> Locale.getDefault().toLanguageTag()),
                pick(platform, () -> System.getProperty("os.name", "") + " " + System.getProperty("os.arch", "")),
                pick(userAgent, () -> "Java/" + System.getProperty("java.version", ""))
        );
    }

    private static String pick(String configured, Supplier<String> fallback) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return fallback.get();
    }

    private static String screenMetrics() {
        if (GraphicsEnvironment.isHeadless()) {
            return "";
        }
        try {
            DisplayMode mode = GraphicsEnvironment.getLocalGraphicsEnvironment()
                    .getDefaultScreenDevice()
                    .getDisplayMode();
            return mode.getHeight() + "x" + mode.getWidth() + "x" + mode.getBitDepth();
        } catch (RuntimeException e) {
            logger.debug("Display metrics unavailable: {}", e.getMessage());
            return "";
        }
    }
}
