import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.keiyaku.debug.Debug;
import com.keiyaku.debug.DebugLevel;
import com.keiyaku.script.KeiyakuScript;
import com.keiyaku.script.parser.KeiyakuScriptException;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    @AfterEach
    void resetSink() {
        Debug.get().setSink(null);
    }

    @Test
    void engine_logsEntryInvocationAndFailures() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> seen.add(level + " " + tag + " " + message));

        KeiyakuScript ks = new KeiyakuScript();
        ks.run("主文() を定義する。\n以上。\n");
        assertThrows(KeiyakuScriptException.class, () -> ks.run("壊れた文\n"));

        assertTrue(seen.stream().anyMatch(s -> s.startsWith("DEBUG KeiyakuScript") && s.contains("主文")), seen.toString());
        assertTrue(seen.stream().anyMatch(s -> s.startsWith("ERROR KeiyakuScript") && s.contains("SYNTAX_ERROR")), seen.toString());
    }

    @Test
    void streamSink_dropsMessagesBelowMinimumLevel() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);
        Debug.get().setSink(Debug.streamSink(out, DebugLevel.WARN));

        Debug.get().d("Test", "hidden");
        Debug.get().w("Test", "shown");

        String text = buf.toString(StandardCharsets.UTF_8);
        assertFalse(text.contains("hidden"));
        assertTrue(text.contains("[WARN] Test: shown"));
    }

    @Test
    void freshlyLoadedHub_hasNoopSinkInstalled() throws Exception {
        URL classes = Debug.class.getProtectionDomain().getCodeSource().getLocation();
        try (URLClassLoader loader = new URLClassLoader(new URL[] { classes }, ClassLoader.getPlatformClassLoader())) {
            Class<?> fresh = Class.forName(Debug.class.getName(), true, loader);
            Object hub = fresh.getMethod("get").invoke(null);

            assertNotNull(fresh.getMethod("getSink").invoke(hub));
            assertDoesNotThrow(() -> fresh.getMethod("d", String.class, String.class).invoke(hub, "Test", "no sink"));
        }
    }

    @Test
    void loopsAndCalls_runWithoutAnyInstalledSink() {
        Debug.get().setSink(null);
        KeiyakuScript ks = new KeiyakuScript();

        assertEquals(3, ks.run(String.join("\n",
                "f(n) を定義する。",
                "n を返す。",
                "以上。",
                "2 回、以下を行う。",
                "「x」を出力する。",
                "以上。",
                "y は f(1) とする。",
                "y を出力する。",
                ""
        )).outputs().size());
    }

    @Test
    void nullSink_fallsBackToNoop() {
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().e("Test", "ignored", new RuntimeException("x")));
    }
}
