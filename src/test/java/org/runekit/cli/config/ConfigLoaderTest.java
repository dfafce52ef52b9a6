package org.runekit.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.runekit.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Environment Variables</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("runekit.http.port");
        System.clearProperty("runekit.overlay.timeout.max");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should merge the file over the reference defaults")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("file-config.conf"));

        assertEquals(9090, config.getInt("runekit.http.port"));
        assertEquals(640, config.getInt("runekit.overlay.surface.width"));
        assertEquals(1080, config.getInt("runekit.overlay.surface.height"));
        assertEquals("/overlay", config.getString("runekit.http.base-path"));
    }

    @Test
    @DisplayName("File override should propagate through substitutions in the defaults")
    void loadFromFile_overrideShouldPropagateThroughSubstitutions() {
        Config config = ConfigLoader.loadFromFile(testResource("file-config.conf"));

        assertEquals(15000, config.getInt("runekit.overlay.timeout.default"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("runekit.http.port", "8181");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("file-config.conf"));

        assertEquals(8181, config.getInt("runekit.http.port"));
        assertEquals(640, config.getInt("runekit.overlay.surface.width"));
    }

    @Test
    @DisplayName("System property override should reach substituted defaults")
    void loadFromFile_systemPropertyShouldReachSubstitutions() {
        System.setProperty("runekit.overlay.timeout.max", "12000");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("file-config.conf"));

        assertEquals(12000, config.getInt("runekit.overlay.timeout.max"));
        assertEquals(12000, config.getInt("runekit.overlay.timeout.default"));
    }

    @Test
    @DisplayName("loadDefaults should return the reference configuration")
    void loadDefaults_shouldReturnValidConfig() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(7070, config.getInt("runekit.http.port"));
        assertEquals(20000, config.getInt("runekit.overlay.timeout.default"));
    }

    @Test
    @DisplayName("resolve should use an explicitly given file and report it")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();
        File file = testResource("file-config.conf");

        Config config = ConfigLoader.resolve(file, (level, message) -> messages.add(level + " " + message));

        assertEquals(9090, config.getInt("runekit.http.port"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file given via --config"));
    }

    @Test
    @DisplayName("resolve should reject a missing explicit file")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/runekit.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));

        assertTrue(e.getMessage().contains("not found"));
    }

    /**
     * Locates a test resource file on the classpath.
     *
     * @param name the resource file name (relative to this test class's package).
     * @return the {@link File} pointing to the test resource.
     */
    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
