package io.github.manjago.esdl.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigContext layering and lookup.
 */
class ConfigContextTest {

    @Test
    @DisplayName("Defaults expose system.size by bare name")
    void bareNameFallsBackToSystem() {
        ConfigContext context = ConfigContext.defaults();
        assertEquals(Optional.of(10L), context.lookup("size"));
        assertEquals(Optional.of(10L), context.lookup("system.size"));
    }

    @Test
    @DisplayName("Numbers are normalized to Long and Double")
    void numberNormalization() {
        ConfigContext context = ConfigContext.of(ConfigFactory.parseString("a = 3\nb = 2.5\nc = yes\nd = text"));
        assertEquals(Optional.of(3L), context.lookup("a"));
        assertEquals(Optional.of(2.5), context.lookup("b"));
        assertEquals(Optional.of(true), context.lookup("c"));
        assertEquals(Optional.of("text"), context.lookup("d"));
    }

    @Test
    @DisplayName("Objects and missing keys are not values")
    void nonScalars() {
        ConfigContext context = ConfigContext.defaults();
        assertTrue(context.lookup("esdl.limits").isEmpty());
        assertTrue(context.lookup("nothing.here").isEmpty());
        assertFalse(context.contains("nothing"));
    }

    @Test
    @DisplayName("Overrides beat the named file, which beats plug-in and species defaults")
    void layerOrder(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("experiment.conf");
        Files.writeString(file, "system.size = 20\nsystem.rate = 0.1\nplugin = named\n");

        ConfigContext context = ConfigContext.builder()
                .namedFile(file)
                .pluginDefaults(ConfigFactory.parseString("plugin = default\nsystem.k = 3"))
                .override("system.rate", 0.5)
                .build();

        assertEquals(Optional.of(20L), context.lookup("size"));
        assertEquals(Optional.of(0.5), context.lookup("rate"));
        assertEquals(Optional.of("named"), context.lookup("plugin"));
        assertEquals(Optional.of(3L), context.lookup("k"));
    }

    @Test
    @DisplayName("withOverrides returns a new context and leaves the original unchanged")
    void withOverrides() {
        ConfigContext base = ConfigContext.defaults();
        ConfigContext changed = base.withOverrides(Map.of("system.size", 40L));

        assertNotSame(base, changed);
        assertEquals(Optional.of(10L), base.lookup("size"));
        assertEquals(Optional.of(40L), changed.lookup("size"));
        assertSame(base, base.withOverrides(Map.of()));
    }
}
