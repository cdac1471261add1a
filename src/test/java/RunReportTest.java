import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.keiyaku.script.KeiyakuScript;
import com.keiyaku.script.parser.KeiyakuScriptException;
import com.keiyaku.script.parser.RunResult;
import com.keiyaku.script.parser.Value;
import com.keiyaku.script.report.RunReport;

import static org.junit.jupiter.api.Assertions.*;

public class RunReportTest {

    private static final ObjectMapper om = new ObjectMapper();

    @Test
    void success_listsOutputsAndEnvironment() throws Exception {
        KeiyakuScript ks = new KeiyakuScript();
        RunResult rr = ks.run(String.join("\n",
                "A は 2 とする。",
                "B は 1.5 とする。",
                "名 は 「甲」 とする。",
                "A に B を加えた数を C とする。",
                "C を出力する。",
                "名 を出力する。",
                ""
        ));

        JsonNode report = om.readTree(RunReport.pretty(RunReport.success(rr)));

        assertEquals("ok", report.get("status").asText());
        assertEquals(2, report.get("outputs").size());
        assertTrue(report.get("outputs").get(0).isDouble());
        assertEquals(3.5, report.get("outputs").get(0).asDouble(), 1e-9);
        assertEquals("甲", report.get("outputs").get(1).asText());
        assertTrue(report.get("env").get("A").canConvertToLong());
        assertEquals(2L, report.get("env").get("A").asLong());
        assertFalse(report.get("entryInvoked").asBoolean());
    }

    @Test
    void voidValue_isJsonNull() {
        assertTrue(RunReport.toJson(Value.voidValue()).isNull());
        assertTrue(RunReport.toJson(Value.integer(3)).isIntegralNumber());
    }

    @Test
    void failure_carriesKindLineTextAndCallSites() {
        KeiyakuScript ks = new KeiyakuScript();
        KeiyakuScriptException e = assertThrows(KeiyakuScriptException.class, () -> ks.run(String.join("\n",
                "f() を定義する。",
                "1 を 0 で割った数を q とする。",
                "以上。",
                "x は f() とする。",
                ""
        )));

        ObjectNode report = RunReport.failure(e);

        assertEquals("error", report.get("status").asText());
        assertEquals("DIVISION_BY_ZERO", report.get("kind").asText());
        assertEquals(2, report.get("line").asInt());
        assertEquals("1 を 0 で割った数を q とする。", report.get("text").asText());
        assertEquals(1, report.get("callSites").size());
        assertEquals(4, report.get("callSites").get(0).get("line").asInt());
    }

    @Test
    void failure_withoutLocation_hasNullLine() {
        KeiyakuScript ks = new KeiyakuScript();
        KeiyakuScriptException e = assertThrows(KeiyakuScriptException.class,
                () -> ks.runWithEntryResult("", "無い", null, null));

        ObjectNode report = RunReport.failure(e);
        assertTrue(report.get("line").isNull());
        assertEquals("UNKNOWN_FUNCTION", report.get("kind").asText());
    }
}
