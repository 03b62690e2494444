package work.lcod.ui.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.ui.api.CompilerConfiguration;
import work.lcod.ui.api.LogLevel;
import work.lcod.ui.compose.UnmatchedSlotPolicy;

class ConfigurationLoaderTest {
    @Test
    void parsesCompilerSection() {
        var base = Path.of("/srv/site");

        var configuration = ConfigurationLoader.parse("""
            [compiler]
            max-depth = 12
            unmatched-slots = "keep"
            layout-dir = "layouts"
            log-level = "debug"
            """, base).build();

        assertEquals(12, configuration.maxDepth());
        assertEquals(UnmatchedSlotPolicy.KEEP, configuration.unmatchedSlotPolicy());
        assertEquals(Optional.of(base.resolve("layouts")), configuration.layoutDirectory());
        assertEquals(LogLevel.DEBUG, configuration.logLevel());
    }

    @Test
    void missingSectionKeepsDefaults() {
        var configuration = ConfigurationLoader.parse("title = \"site\"\n", null).build();

        assertEquals(CompilerConfiguration.defaults(), configuration);
    }

    @Test
    void invalidTomlIsRejected() {
        var error = assertThrows(
            IllegalStateException.class,
            () -> ConfigurationLoader.parse("[compiler\nmax-depth = ", null)
        );

        assertTrue(error.getMessage().startsWith("Invalid configuration"));
    }

    @Test
    void unknownPolicyIsRejected() {
        assertThrows(
            IllegalArgumentException.class,
            () -> ConfigurationLoader.parse("[compiler]\nunmatched-slots = \"drop\"\n", null)
        );
    }

    @Test
    void loadsFileNextToInput(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(ConfigurationLoader.FILE_NAME), "[compiler]\nlayout-dir = \"layouts\"\n");
        var input = dir.resolve("page.json");

        var located = ConfigurationLoader.locate(input);
        var configuration = ConfigurationLoader.load(located.orElseThrow()).build();

        assertEquals(Optional.of(dir.toAbsolutePath().resolve("layouts")), configuration.layoutDirectory());
    }

    @Test
    void nothingToLocateWithoutFile(@TempDir Path dir) {
        assertTrue(ConfigurationLoader.locate(dir.resolve("page.json")).isEmpty());
    }
}
