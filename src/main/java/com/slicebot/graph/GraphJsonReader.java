package com.slicebot.graph;

import com.slicebot.coverage.ContextDefinition;
import com.slicebot.coverage.OtherPolicy;
import com.slicebot.model.ParamSlot;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：GraphJsonReader（class）。
 * 主要职责：从 JSON 读取图（节点、边、参数绑定、条件参数、case）以及上下文定义和连接能力声明。
 * 使用建议：未知字段忽略；结构错误抛出 IllegalArgumentException 并带上出错位置。
 */
public final class GraphJsonReader {

    public GraphDocument read(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public GraphDocument parse(String json) {
        JSONObject root;
        try {
            root = new JSONObject(json == null ? "" : json);
        } catch (JSONException e) {
            throw new IllegalArgumentException("graph json is not an object: " + e.getMessage(), e);
        }
        List<GraphNode> nodes = new ArrayList<>();
        JSONArray nodeArray = root.optJSONArray("nodes");
        for (int i = 0; nodeArray != null && i < nodeArray.length(); i++) {
            nodes.add(readNode(nodeArray.getJSONObject(i), "nodes[" + i + "]"));
        }
        List<GraphEdge> edges = new ArrayList<>();
        JSONArray edgeArray = root.optJSONArray("edges");
        for (int i = 0; edgeArray != null && i < edgeArray.length(); i++) {
            edges.add(readEdge(edgeArray.getJSONObject(i), "edges[" + i + "]"));
        }
        return new GraphDocument(new Graph(List.copyOf(nodes), List.copyOf(edges)),
                readContexts(root.optJSONArray("contexts")),
                readConnections(root.optJSONArray("connections")));
    }

    private GraphNode readNode(JSONObject o, String where) {
        String id = required(o, "id", where);
        CaseBinding caseBinding = null;
        JSONObject c = o.optJSONObject("case");
        if (c != null) {
            caseBinding = new CaseBinding(required(c, "id", where + ".case"), text(c, "connection"));
        }
        return new GraphNode(id, text(o, "label"), text(o, "event_id"), caseBinding);
    }

    private GraphEdge readEdge(JSONObject o, String where) {
        Map<ParamSlot, ParameterBinding> params = new EnumMap<>(ParamSlot.class);
        for (ParamSlot slot : ParamSlot.values()) {
            JSONObject p = o.optJSONObject(slot.label());
            if (p != null) {
                params.put(slot, readParameter(p, where + "." + slot.label()));
            }
        }
        List<ConditionalParameter> conditionals = new ArrayList<>();
        JSONArray cps = o.optJSONArray("conditional_p");
        for (int i = 0; cps != null && i < cps.length(); i++) {
            JSONObject cp = cps.getJSONObject(i);
            String at = where + ".conditional_p[" + i + "]";
            JSONObject p = cp.optJSONObject("p");
            conditionals.add(new ConditionalParameter(text(cp, "condition"),
                    p == null ? null : readParameter(p, at + ".p")));
        }
        return new GraphEdge(required(o, "id", where), required(o, "from", where), required(o, "to", where),
                params, List.copyOf(conditionals));
    }

    private ParameterBinding readParameter(JSONObject p, String where) {
        Double t95 = p.has("t95") && !p.isNull("t95") ? p.getDouble("t95") : null;
        if (t95 != null && (t95.isNaN() || t95 < 0.0)) {
            throw new IllegalArgumentException(where + ".t95 must be a non-negative number");
        }
        return new ParameterBinding(text(p, "id"), text(p, "connection"), t95);
    }

    private List<ContextDefinition> readContexts(JSONArray arr) {
        List<ContextDefinition> out = new ArrayList<>();
        for (int i = 0; arr != null && i < arr.length(); i++) {
            JSONObject c = arr.getJSONObject(i);
            List<String> values = new ArrayList<>();
            JSONArray vs = c.optJSONArray("values");
            for (int j = 0; vs != null && j < vs.length(); j++) {
                Object v = vs.get(j);
                values.add(v instanceof JSONObject obj ? obj.optString("id", "") : String.valueOf(v));
            }
            String policy = "undefined";
            if (c.has("other_policy")) {
                policy = c.isNull("other_policy") ? "null" : c.optString("other_policy", "undefined");
            }
            out.add(ContextDefinition.of(required(c, "id", "contexts[" + i + "]"), values,
                    OtherPolicy.fromLabel(policy)));
        }
        return List.copyOf(out);
    }

    private Map<String, Boolean> readConnections(JSONArray arr) {
        Map<String, Boolean> out = new LinkedHashMap<>();
        for (int i = 0; arr != null && i < arr.length(); i++) {
            JSONObject c = arr.getJSONObject(i);
            if (c.has("requires_event_ids")) {
                out.put(required(c, "name", "connections[" + i + "]"), c.getBoolean("requires_event_ids"));
            }
        }
        return out;
    }

    private static String required(JSONObject o, String key, String where) {
        String value = text(o, key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException(where + "." + key + " is required");
        }
        return value;
    }

    private static String text(JSONObject o, String key) {
        return o.optString(key, "").trim();
    }
}
