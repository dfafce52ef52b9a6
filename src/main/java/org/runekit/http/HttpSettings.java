package org.runekit.http;

import java.time.Duration;

import com.typesafe.config.Config;

/**
 * Settings of the HTTP transport, read from the {@code runekit.http} block.
 *
 * @param host         interface to bind.
 * @param port         port to bind, {@code 0} for an ephemeral port.
 * @param basePath     prefix of every route, e.g. {@code /overlay}.
 * @param stateTimeout how long a request waits for the engine thread.
 */
public record HttpSettings(String host, int port, String basePath, Duration stateTimeout) {

    public static final String CONFIG_PATH = "runekit.http";

    public HttpSettings {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port " + port);
        }
        basePath = normalize(basePath);
    }

    public static HttpSettings fromConfig(Config config) {
        Config http = config.getConfig(CONFIG_PATH);
        return new HttpSettings(
                http.getString("host"),
                http.getInt("port"),
                http.getString("base-path"),
                http.getDuration("state-timeout"));
    }

    private static String normalize(String basePath) {
        if (basePath == null || basePath.isBlank() || "/".equals(basePath)) {
            return "";
        }
        String path = basePath.startsWith("/") ? basePath : "/" + basePath;
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
