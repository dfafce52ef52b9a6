package org.runekit.overlay;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Tunables of the overlay engine, read from the {@code runekit.overlay} configuration block.
 * <p>
 * Example configuration:
 * <pre>
 * runekit.overlay {
 *   internal-command-prefix = "_"
 *   timeout { min = 1, max = 20000, default = 20000 }
 *   text { max-font-size = 50, mac-fallback-font = "Menlo" }
 *   stroke { min-width = 1.0, divisor = 10 }
 *   image-cache.maximum-size = 100
 *   surface { width = 1920, height = 1080 }
 * }
 * </pre>
 *
 * @param internalCommandPrefix command names starting with this prefix are rejected.
 * @param minTimeoutMillis      lower clamp for active-group timeouts.
 * @param maxTimeoutMillis      upper clamp for active-group timeouts.
 * @param defaultTimeoutMillis  timeout given to groups re-activated by a continue.
 * @param maxFontSize           font sizes above this are clamped.
 * @param macFallbackFont       font family substituted for the default font on macOS.
 * @param minStrokeWidth        minimum visual line weight.
 * @param strokeDivisor         wire line widths are given in tenths of this unit.
 * @param imageCacheSize        maximum number of decoded images kept.
 * @param surfaceWidth          width of the headless scene surface.
 * @param surfaceHeight         height of the headless scene surface.
 */
public record OverlaySettings(
        String internalCommandPrefix,
        int minTimeoutMillis,
        int maxTimeoutMillis,
        int defaultTimeoutMillis,
        int maxFontSize,
        String macFallbackFont,
        double minStrokeWidth,
        double strokeDivisor,
        int imageCacheSize,
        int surfaceWidth,
        int surfaceHeight) {

    /** Path of the settings block in the application configuration. */
    public static final String CONFIG_PATH = "runekit.overlay";

    public OverlaySettings {
        if (minTimeoutMillis < 1 || maxTimeoutMillis < minTimeoutMillis) {
            throw new IllegalArgumentException("Invalid timeout range [" + minTimeoutMillis + ", "
                    + maxTimeoutMillis + "]");
        }
        if (defaultTimeoutMillis < minTimeoutMillis || defaultTimeoutMillis > maxTimeoutMillis) {
            throw new IllegalArgumentException("Default timeout " + defaultTimeoutMillis
                    + " outside [" + minTimeoutMillis + ", " + maxTimeoutMillis + "]");
        }
        if (strokeDivisor <= 0) {
            throw new IllegalArgumentException("stroke.divisor must be positive, got " + strokeDivisor);
        }
    }

    /**
     * Reads settings from a configuration that contains the {@value #CONFIG_PATH} block.
     *
     * @param config the resolved application configuration.
     * @return the settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static OverlaySettings fromConfig(Config config) {
        Config overlay = config.getConfig(CONFIG_PATH);
        return new OverlaySettings(
                overlay.getString("internal-command-prefix"),
                overlay.getInt("timeout.min"),
                overlay.getInt("timeout.max"),
                overlay.getInt("timeout.default"),
                overlay.getInt("text.max-font-size"),
                overlay.getString("text.mac-fallback-font"),
                overlay.getDouble("stroke.min-width"),
                overlay.getDouble("stroke.divisor"),
                overlay.getInt("image-cache.maximum-size"),
                overlay.getInt("surface.width"),
                overlay.getInt("surface.height"));
    }

    /**
     * @return settings from the classpath {@code reference.conf}.
     */
    public static OverlaySettings defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * Clamps an active-group timeout into the configured range.
     */
    public int clampTimeout(int timeoutMillis) {
        return Math.min(maxTimeoutMillis, Math.max(timeoutMillis, minTimeoutMillis));
    }
}
