package com.keiyaku.script.report;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.keiyaku.script.parser.KeiyakuScriptException;
import com.keiyaku.script.parser.RunResult;
import com.keiyaku.script.parser.SourceLine;
import com.keiyaku.script.parser.Value;

/**
 * JSON view of a run, as printed by {@code KeiyakuCli --json}.
 *
 * <pre>
 * {"status":"ok","outputs":[5],"env":{"A":2,...},"entryInvoked":false}
 * {"status":"error","kind":"SYNTAX_ERROR","line":3,"text":"...","message":"...","callSites":[...]}
 * </pre>
 */
public final class RunReport {

    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private RunReport() {}

    public static ObjectNode success(RunResult result) {
        ObjectNode out = om.createObjectNode();
        out.put("status", "ok");

        ArrayNode outputs = out.putArray("outputs");
        for (Value v : result.outputs()) outputs.add(toJson(v));

        ObjectNode env = out.putObject("env");
        for (Map.Entry<String, Value> e : result.env().entrySet()) {
            env.set(e.getKey(), toJson(e.getValue()));
        }

        out.put("entryInvoked", result.entryInvoked());
        return out;
    }

    public static ObjectNode failure(KeiyakuScriptException e) {
        ObjectNode out = om.createObjectNode();
        out.put("status", "error");
        out.put("kind", e.kind().name());

        SourceLine at = e.location();
        if (at != null) {
            out.put("line", at.number);
            out.put("text", at.raw.strip());
        } else {
            out.putNull("line");
            out.putNull("text");
        }
        out.put("message", e.detail());

        ArrayNode callSites = out.putArray("callSites");
        for (int i = 1; i < e.trace().size(); i++) {
            SourceLine call = e.trace().get(i);
            ObjectNode site = callSites.addObject();
            site.put("line", call.number);
            site.put("text", call.raw.strip());
        }
        return out;
    }

    public static JsonNode toJson(Value v) {
        switch (v.getType()) {
            case INTEGER: return nodes.numberNode(v.asInteger());
            case FLOAT:   return nodes.numberNode(v.asFloat());
            case STRING:  return nodes.textNode(v.asString());
            default:      return nodes.nullNode();
        }
    }

    public static String pretty(JsonNode node) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render run report", e);
        }
    }
}
