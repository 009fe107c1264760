package com.slicebot.plan;

import com.slicebot.config.Config;
import com.slicebot.graph.Graph;
import com.slicebot.storage.InMemoryCachedRecordStore;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.slicebot.plan.PlanFixtures.edge;
import static com.slicebot.plan.PlanFixtures.node;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FetchPlanJsonTest {
    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");

    @Test
    void samePlanInputsRenderIdenticalText() {
        Graph graph = new Graph(
                List.of(node("a", "landing"), node("b", "checkout"), node("c", null)),
                List.of(edge("e2", "a", "c", "param-ac", "amplitude-prod"),
                        edge("e1", "a", "b", "param-ab", "amplitude-prod")));
        Graph reordered = new Graph(graph.nodes, List.of(graph.edges.get(1), graph.edges.get(0)));
        FetchPlanBuilder builder = PlanFixtures.planBuilder(Config.of(Map.of()), new InMemoryCachedRecordStore());

        String first = FetchPlanJson.toJson(builder.build(graph, "window(1-Jan-26:5-Jan-26)", null,
                PlanOptions.at(NOW)).plan);
        String second = FetchPlanJson.toJson(builder.build(reordered, "window(1-Jan-26:5-Jan-26)", null,
                PlanOptions.at(NOW)).plan);

        assertEquals(first, second);
    }

    @Test
    void renderedPlanCarriesItemsAndSummary() {
        Graph graph = new Graph(
                List.of(node("a", "landing"), node("b", "checkout"), node("c", null)),
                List.of(edge("e1", "a", "b", "param-ab", "amplitude-prod"),
                        edge("e2", "a", "c", "param-ac", "amplitude-prod")));
        FetchPlanBuilder builder = PlanFixtures.planBuilder(Config.of(Map.of()), new InMemoryCachedRecordStore());

        JSONObject json = new JSONObject(FetchPlanJson.toJson(
                builder.build(graph, "window(1-Jan-26:5-Jan-26)", null, PlanOptions.at(NOW)).plan));

        assertEquals(1, json.getInt("version"));
        assertEquals("window(1-Jan-26:5-Jan-26)", json.getString("dsl"));
        JSONArray items = json.getJSONArray("items");
        assertEquals(2, items.length());
        JSONObject fetch = items.getJSONObject(0);
        assertEquals("parameter:param-ab:e1:p:", fetch.getString("item_key"));
        assertEquals("fetch", fetch.getString("classification"));
        assertTrue(fetch.isNull("unfetchable_reason"));
        assertEquals(5, fetch.getJSONArray("windows").getJSONObject(0).getInt("day_count"));
        JSONObject component = fetch.getJSONArray("components").getJSONObject(0);
        assertEquals("", component.getString("slice_family"));
        assertEquals(fetch.getString("query_signature"), component.getString("query_signature"));
        assertEquals(0, items.getJSONObject(1).getJSONArray("components").length());
        assertEquals("partial_event_ids", items.getJSONObject(1).getString("unfetchable_reason"));
        JSONObject summary = json.getJSONObject("summary");
        assertEquals(1, summary.getInt("fetch_items"));
        assertEquals(1, summary.getInt("unfetchable_items"));
        assertEquals(5, summary.getInt("total_fetch_days"));
    }
}
