package com.slicebot.plan;

import com.slicebot.model.FetchComponent;
import com.slicebot.model.FetchPlan;
import com.slicebot.model.FetchPlanItem;
import com.slicebot.model.FetchWindow;
import com.slicebot.model.ItemKey;
import com.slicebot.model.PlanSummary;
import org.json.JSONStringer;
import org.json.JSONWriter;

import java.util.List;

/**
 * Canonical JSON rendering of a plan. Keys are written in a fixed order so equal plans produce
 * byte-identical text.
 */
public final class FetchPlanJson {

    private FetchPlanJson() {
    }

    public static String toJson(FetchPlan plan) {
        JSONStringer out = new JSONStringer();
        out.object()
                .key("version").value(plan.version)
                .key("created_at").value(String.valueOf(plan.createdAt))
                .key("reference_now").value(String.valueOf(plan.referenceNow))
                .key("dsl").value(plan.dsl)
                .key("items").array();
        for (FetchPlanItem item : plan.items) {
            writeItem(out, item);
        }
        out.endArray();
        writeSummary(out.key("summary"), plan.summarise());
        out.endObject();
        return out.toString();
    }

    private static void writeItem(JSONWriter out, FetchPlanItem item) {
        ItemKey key = item.itemKey;
        out.object()
                .key("item_key").value(key.display())
                .key("type").value(key.type.label())
                .key("object_id").value(key.objectId)
                .key("target_id").value(key.targetId)
                .key("slot").value(key.slot == null ? "" : key.slot.label())
                .key("conditional_index").value(key.conditionalIndex == null ? null : key.conditionalIndex)
                .key("mode").value(item.mode.label())
                .key("slice_family").value(item.sliceFamily)
                .key("query_signature").value(item.querySignature)
                .key("connection").value(item.connection == null ? "" : item.connection)
                .key("classification").value(item.classification.label())
                .key("unfetchable_reason").value(item.unfetchableReason == null ? null : item.unfetchableReason.label())
                .key("windows");
        writeWindows(out, item.windows);
        out.key("components").array();
        for (FetchComponent c : item.components == null ? List.<FetchComponent>of() : item.components) {
            out.object()
                    .key("slice_family").value(c.sliceFamily)
                    .key("query_signature").value(c.querySignature)
                    .key("windows");
            writeWindows(out, c.windows);
            out.endObject();
        }
        out.endArray().endObject();
    }

    private static void writeWindows(JSONWriter out, List<FetchWindow> windows) {
        out.array();
        for (FetchWindow w : windows) {
            out.object()
                    .key("start").value(w.start.toString())
                    .key("end").value(w.end.toString())
                    .key("reason").value(w.reason.label())
                    .key("day_count").value(w.dayCount)
                    .endObject();
        }
        out.endArray();
    }

    private static void writeSummary(JSONWriter out, PlanSummary s) {
        out.object()
                .key("covered_items").value(s.coveredItems)
                .key("fetch_items").value(s.fetchItems)
                .key("unfetchable_items").value(s.unfetchableItems)
                .key("fetch_windows").value(s.fetchWindows)
                .key("total_fetch_days").value(s.totalFetchDays)
                .key("missing_days").value(s.missingDays)
                .key("stale_days").value(s.staleDays)
                .key("db_missing_days").value(s.dbMissingDays)
                .endObject();
    }
}
