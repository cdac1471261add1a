package com.keiyaku.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import com.keiyaku.debug.Debug;
import com.keiyaku.debug.DebugLevel;
import com.keiyaku.script.parser.KeiyakuScriptException;
import com.keiyaku.script.parser.RunResult;
import com.keiyaku.script.report.RunReport;

/**
 * Runs a program file.
 *
 * <pre>
 * KeiyakuCli &lt;program.kei&gt; [--json] [--debug] [--no-entry] [--entry=NAME] [--max-depth=N]
 * </pre>
 *
 * Exit codes: 0 success, 1 script failure, 2 usage, 3 unreadable file.
 */
public final class KeiyakuCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_SCRIPT_ERROR = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_IO = 3;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        Map<String, String> flags = parseArgs(args);
        String file = firstPositional(args);
        if (file == null) {
            System.err.println("Usage: KeiyakuCli <program.kei> [--json] [--debug] [--no-entry] [--entry=NAME] [--max-depth=N]");
            return EXIT_USAGE;
        }

        final Path scriptPath = Path.of(file);
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read script file: " + scriptPath);
            e.printStackTrace(System.err);
            return EXIT_IO;
        }

        if (flags.containsKey("debug")) {
            Debug.get().setSink(Debug.streamSink(System.err, DebugLevel.TRACE));
        }

        boolean json = flags.containsKey("json");
        KeiyakuScript engine = new KeiyakuScript();
        try {
            configure(engine, flags);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid option: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (!json) {
            engine.setOutputSink(value -> System.out.println(value.display()));
        }

        try {
            RunResult result = engine.run(script);
            if (json) System.out.println(RunReport.pretty(RunReport.success(result)));
            return EXIT_OK;
        } catch (KeiyakuScriptException e) {
            if (json) {
                System.out.println(RunReport.pretty(RunReport.failure(e)));
            } else {
                System.err.println("Script error: " + e.getMessage());
            }
            return EXIT_SCRIPT_ERROR;
        }
    }

    static void configure(KeiyakuScript engine, Map<String, String> flags) {
        if (flags.containsKey("no-entry")) engine.setAutoInvokeEntry(false);
        if (flags.containsKey("entry")) engine.setEntryFunctionName(flags.get("entry"));
        if (flags.containsKey("max-depth")) {
            try {
                engine.setMaxCallDepth(Integer.parseInt(flags.get("max-depth")));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--max-depth expects an integer, got " + flags.get("max-depth"), e);
            }
        }
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            }
        }
        return out;
    }

    private static String firstPositional(String[] args) {
        for (String a : args) {
            if (!a.startsWith("--")) return a;
        }
        return null;
    }

    private KeiyakuCli() {}
}
