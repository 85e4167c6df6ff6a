package work.layerflow.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContextLoaderTest {
    @TempDir
    Path directory;

    @Test
    void sectionsPrefixKeys() throws Exception {
        var params = directory.resolve("params.toml");
        Files.writeString(params, String.join("\n",
            "Region = \"north\"",
            "[baz_alternative]",
            "fake = \"quux\"",
            "Retries = 3",
            "[report]",
            "pages = [1, 2]",
            ""));

        var context = ContextLoader.load(List.of(params), List.of());
        assertEquals("north", context.get("default.region"));
        assertEquals("quux", context.get("baz_alternative.fake"));
        assertEquals("3", context.get("baz_alternative.retries"));
        assertEquals(List.of("1", "2"), context.get("report.pages"));
    }

    @Test
    void commandLineOverridesFiles() throws Exception {
        var params = directory.resolve("params.toml");
        Files.writeString(params, "[db]\nhost = \"localhost\"\n");

        var context = ContextLoader.load(
            List.of(params),
            List.of("db.host=example.org", "Limit=a=b", "report.title=Q3 numbers", "ignored")
        );
        assertEquals("example.org", context.get("db.host"));
        assertEquals("a=b", context.get("default.limit"));
        assertEquals("Q3 numbers", context.get("report.title"));
        assertFalse(context.containsKey("default.ignored"));
        assertEquals(3, context.size());
    }

    @Test
    void laterFilesWin() throws Exception {
        var first = directory.resolve("first.toml");
        var second = directory.resolve("second.toml");
        Files.writeString(first, "[s]\na = \"1\"\nb = \"1\"\n");
        Files.writeString(second, "[s]\nb = \"2\"\n");
        assertEquals(Map.of("s.a", "1", "s.b", "2"), ContextLoader.load(List.of(first, second), null));
    }

    @Test
    void invalidFilesFail() throws Exception {
        var broken = directory.resolve("broken.toml");
        Files.writeString(broken, "[unterminated\n");
        assertThrows(EngineConfigException.class, () -> ContextLoader.load(List.of(broken), List.of()));
        assertThrows(EngineConfigException.class, () -> ContextLoader.load(List.of(directory.resolve("absent.toml")), List.of()));
    }
}
