package com.pale.script;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pale.script.parser.Diagnostics;
import com.pale.script.parser.RunResult;
import com.pale.script.parser.Value;

/**
 * JSON shape of a run, used by {@code --json}:
 *
 * <pre>
 *   {"ok":true,"result":"69","type":"Integer"}
 *   {"ok":false,"diagnostics":[{"file":"f.pale","line":1,"column":4,
 *                               "message":"...","notes":["NOTE: ..."]}]}
 * </pre>
 */
public final class JsonReport {

    private static final ObjectMapper om = new ObjectMapper();

    private JsonReport() {}

    public static ObjectNode toJson(RunResult result) {
        ObjectNode node = om.createObjectNode();
        node.put("ok", result.ok());
        if (result.ok()) {
            Value v = result.value().get();
            node.put("result", v.display());
            node.put("type", v.typeName());
            return node;
        }

        ArrayNode diags = node.putArray("diagnostics");
        for (Diagnostics.Entry e : result.diagnostics().entries()) {
            ObjectNode d = diags.addObject();
            d.put("file", e.location.filename);
            d.put("line", e.location.line);
            d.put("column", e.location.column);
            d.put("message", e.message);
            ArrayNode notes = d.putArray("notes");
            for (String n : e.notes()) notes.add(n);
        }
        return node;
    }

    public static String render(RunResult result) {
        try {
            return om.writeValueAsString(toJson(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render run result as JSON", e);
        }
    }
}
