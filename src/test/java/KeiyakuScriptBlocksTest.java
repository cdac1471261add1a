import org.junit.jupiter.api.Test;

import com.keiyaku.script.KeiyakuScript;
import com.keiyaku.script.parser.ErrorKind;
import com.keiyaku.script.parser.KeiyakuScriptException;
import com.keiyaku.script.parser.RunResult;
import com.keiyaku.script.parser.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class KeiyakuScriptBlocksTest {

    private static List<String> printed(RunResult rr) {
        List<String> out = new ArrayList<>();
        for (Value value : rr.outputs()) out.add(value.display());
        return out;
    }

    private static String conditional(String header, String value) {
        return String.join("\n",
                "x は " + value + " とする。",
                header,
                "「then」を出力する。",
                "以上。",
                "そうでなければ、以下を行う。",
                "「else」を出力する。",
                "以上。",
                ""
        );
    }

    @Test
    void loop_appliesBodyCumulatively() {
        KeiyakuScript ks = new KeiyakuScript();
        RunResult rr = ks.run(String.join("\n",
                "合計 は 0 とする。",
                "3 回、以下を行う。",
                "合計 に 2 を加えた数を 合計 とする。",
                "合計 を出力する。",
                "以上。",
                ""
        ));

        assertEquals(List.of("2", "4", "6"), printed(rr));
        assertEquals(Value.integer(6), rr.env().get("合計"));
    }

    @Test
    void loop_zeroTimes_leavesEnvironmentUnchanged() {
        KeiyakuScript ks = new KeiyakuScript();
        RunResult rr = ks.run(String.join("\n",
                "a は 1 とする。",
                "0 回、以下を行う。",
                "未定義 を出力する。",
                "a は 2 とする。",
                "以上。",
                ""
        ));

        assertTrue(rr.outputs().isEmpty());
        assertEquals(Map.of("a", Value.integer(1)), rr.env());
    }

    @Test
    void loop_countFromVariable_andFloatCountTruncates() {
        KeiyakuScript ks = new KeiyakuScript();
        RunResult rr = ks.run(String.join("\n",
                "回数 は 2.9 とする。",
                "回数 回、以下を行う。",
                "「回」を出力する。",
                "以上。",
                ""
        ));

        assertEquals(List.of("回", "回"), printed(rr));
    }

    @Test
    void loop_negativeCount_fails() {
        KeiyakuScript ks = new KeiyakuScript();
        KeiyakuScriptException e = assertThrows(KeiyakuScriptException.class, () -> ks.run(String.join("\n",
                "-1 回、以下を行う。",
                "以上。",
                ""
        )));

        assertEquals(ErrorKind.NEGATIVE_REPEAT_COUNT, e.kind());
        assertEquals(1, e.lineNumber());
    }

    @Test
    void loop_nonNumericCount_isTypeMismatch() {
        KeiyakuScript ks = new KeiyakuScript();
        KeiyakuScriptException e = assertThrows(KeiyakuScriptException.class, () -> ks.run(String.join("\n",
                "「三」 回、以下を行う。",
                "以上。",
                ""
        )));

        assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
    }

    @Test
    void nestedLoops_multiply() {
        KeiyakuScript ks = new KeiyakuScript();
        RunResult rr = ks.run(String.join("\n",
                "c は 0 とする。",
                "3 回、以下を行う。",
                "4 回、以下を行う。",
                "c に 1 を加えた数を c とする。",
                "以上。",
                "以上。",
                ""
        ));

        assertEquals(Value.integer(12), rr.env().get("c"));
    }

    @Test
    void ifZero_selectsThenOnZero() {
        KeiyakuScript ks = new KeiyakuScript();
        assertEquals(List.of("then"), printed(ks.run(conditional("もし x が 0 なら、以下を行う。", "0"))));
        assertEquals(List.of("else"), printed(ks.run(conditional("もし x が 0 なら、以下を行う。", "5"))));
    }

    @Test
    void ifNonZero_selectsElseOnZero() {
        KeiyakuScript ks = new KeiyakuScript();
        assertEquals(List.of("else"), printed(ks.run(conditional("もし x が 0 でなければ、以下を行う。", "0"))));
        assertEquals(List.of("then"), printed(ks.run(conditional("もし x が 0 でなければ、以下を行う。", "-2.5"))));
    }

    @Test
    void ifZero_acceptsNarabaForm_andFloatZero() {
        KeiyakuScript ks = new KeiyakuScript();
        assertEquals(List.of("then"), printed(ks.run(conditional("もし x が 0 ならば、以下を行う。", "0.0"))));
    }

    @Test
    void missingElse_whenConditionFalse_isNoOp() {
        KeiyakuScript ks = new KeiyakuScript();
        RunResult rr = ks.run(String.join("\n",
                "x は 1 とする。",
                "もし x が 0 なら、以下を行う。",
                "「then」を出力する。",
                "以上。",
                "「after」を出力する。",
                ""
        ));

        assertEquals(List.of("after"), printed(rr));
    }

    @Test
    void elseAfterBlankLines_isStillAttached() {
        KeiyakuScript ks = new KeiyakuScript();
        RunResult rr = ks.run(String.join("\n",
                "x は 1 とする。",
                "もし x が 0 なら、以下を行う。",
                "「then」を出力する。",
                "以上。",
                "",
                "   ",
                "そうでなければ",
                "「else」を出力する。",
                "以上。",
                "「after」を出力する。",
                ""
        ));

        assertEquals(List.of("else", "after"), printed(rr));
    }

    @Test
    void conditionalBodies_shareTheEnclosingEnvironment() {
        KeiyakuScript ks = new KeiyakuScript();
        RunResult rr = ks.run(String.join("\n",
                "x は 0 とする。",
                "もし x が 0 なら、以下を行う。",
                "内側 は 「set」 とする。",
                "以上。",
                ""
        ));

        assertEquals("set", rr.env().get("内側").asString());
    }

    @Test
    void nonNumericCondition_isTypeMismatch() {
        KeiyakuScript ks = new KeiyakuScript();
        KeiyakuScriptException e = assertThrows(KeiyakuScriptException.class,
                () -> ks.run(conditional("もし x が 0 なら、以下を行う。", "「零」")));

        assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
        assertEquals(2, e.lineNumber());
    }

    @Test
    void unterminatedLoop_reportsOpeningLine() {
        KeiyakuScript ks = new KeiyakuScript();
        KeiyakuScriptException e = assertThrows(KeiyakuScriptException.class, () -> ks.run(String.join("\n",
                "A は 1 とする。",
                "3 回、以下を行う。",
                "A を出力する。",
                ""
        )));

        assertEquals(ErrorKind.UNTERMINATED_BLOCK, e.kind());
        assertEquals(2, e.lineNumber());
        assertTrue(e.detail().contains("loop"), e.detail());
    }

    @Test
    void unterminatedFunction_nestedCloseDoesNotEndIt() {
        KeiyakuScript ks = new KeiyakuScript();
        KeiyakuScriptException e = assertThrows(KeiyakuScriptException.class, () -> ks.run(String.join("\n",
                "関数 処理() を定義する。",
                "2 回、以下を行う。",
                "以上。",
                ""
        )));

        assertEquals(ErrorKind.UNTERMINATED_BLOCK, e.kind());
        assertEquals(1, e.lineNumber());
        assertTrue(e.detail().contains("処理"), e.detail());
    }

    @Test
    void strayCloseMarker_isSyntaxError() {
        KeiyakuScript ks = new KeiyakuScript();
        KeiyakuScriptException e = assertThrows(KeiyakuScriptException.class,
                () -> ks.run("A は 1 とする。\n以上。\n"));

        assertEquals(ErrorKind.SYNTAX_ERROR, e.kind());
        assertEquals(2, e.lineNumber());
    }

    @Test
    void strayElse_isSyntaxError() {
        KeiyakuScript ks = new KeiyakuScript();
        KeiyakuScriptException e = assertThrows(KeiyakuScriptException.class, () -> ks.run(String.join("\n",
                "そうでなければ、以下を行う。",
                "以上。",
                ""
        )));

        assertEquals(ErrorKind.SYNTAX_ERROR, e.kind());
        assertEquals(1, e.lineNumber());
    }
}
