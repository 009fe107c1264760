package com.slicebot.plan;

import com.slicebot.coverage.ComponentCoverage;
import com.slicebot.coverage.CoverageAnalyzer;
import com.slicebot.coverage.CoverageRequest;
import com.slicebot.coverage.CoverageResult;
import com.slicebot.graph.Graph;
import com.slicebot.graph.GraphNode;
import com.slicebot.model.CachedRecord;
import com.slicebot.model.Classification;
import com.slicebot.model.FetchComponent;
import com.slicebot.model.FetchPlan;
import com.slicebot.model.FetchPlanItem;
import com.slicebot.model.FetchWindow;
import com.slicebot.model.SliceConstraint;
import com.slicebot.model.TargetType;
import com.slicebot.model.TimeBounds;
import com.slicebot.model.UnfetchableReason;
import com.slicebot.model.WindowReason;
import com.slicebot.slice.QueryShape;
import com.slicebot.slice.SliceResolver;
import com.slicebot.storage.CachedRecordStore;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：FetchPlanBuilder（class）。
 * 主要职责：遍历图中所有可检索目标（边参数、条件参数、节点 case），按「连接 → 事件 ID → 缓存覆盖」
 * 的顺序逐项分类，生成单个切片的确定性抓取计划与诊断信息。
 * 使用建议：每个切片只构建一次计划；执行期间不得重新推导，以保证同一切片内的决策一致。
 */
public final class FetchPlanBuilder {
    private final SliceResolver resolver;
    private final CoverageAnalyzer coverage;
    private final ConnectionCapabilities connections;
    private final CachedRecordStore store;
    private final FetchTargetEnumerator targets = new FetchTargetEnumerator();

    public FetchPlanBuilder(
            SliceResolver resolver,
            CoverageAnalyzer coverage,
            ConnectionCapabilities connections,
            CachedRecordStore store
    ) {
        this.resolver = resolver;
        this.coverage = coverage;
        this.connections = connections;
        this.store = store;
    }

    /**
     * Plan every bound target of the graph for one slice. An explicit {@code window} overrides any time
     * clause in the DSL; one of the two must be present.
     */
    public FetchPlanResult build(Graph graph, String dsl, TimeBounds window, PlanOptions options) {
        if (graph == null) {
            throw new IllegalArgumentException("graph is required");
        }
        if (options == null || options.referenceNow == null) {
            throw new IllegalArgumentException("plan options need a reference time");
        }
        SliceConstraint parsed = resolver.parse(dsl, options.referenceDate());
        TimeBounds bounds = window != null ? window : parsed.bounds;
        if (bounds == null) {
            throw new IllegalArgumentException("no time bounds for slice: " + dsl);
        }
        SliceConstraint constraint = parsed.withBounds(bounds);

        List<FetchPlanItem> items = new ArrayList<>();
        List<ItemDiagnostic> diagnostics = new ArrayList<>();
        for (FetchTarget target : targets.enumerate(graph)) {
            if (target.itemKey.type == TargetType.CASE) {
                planCase(target, constraint, items, diagnostics);
            } else {
                planParameter(graph, target, constraint, options, items, diagnostics);
            }
        }
        FetchPlan plan = FetchPlan.of(options.createdAt, options.referenceNow, dsl, items);
        return new FetchPlanResult(plan, constraint, new FetchPlanDiagnostics(diagnostics));
    }

    private void planParameter(
            Graph graph,
            FetchTarget target,
            SliceConstraint constraint,
            PlanOptions options,
            List<FetchPlanItem> items,
            List<ItemDiagnostic> diagnostics
    ) {
        String connection = target.parameter.connection == null ? "" : target.parameter.connection.trim();
        GraphNode from = graph.findNode(target.edge.from).orElse(null);
        GraphNode to = graph.findNode(target.edge.to).orElse(null);
        QueryShape shape = new QueryShape(
                connection,
                from != null && from.hasEventId() ? from.eventId.trim() : "",
                to != null && to.hasEventId() ? to.eventId.trim() : "",
                Map.of(),
                target.condition
        );
        String signature = resolver.signatureFor(constraint, shape);
        FetchPlanItem.FetchPlanItemBuilder item = FetchPlanItem.builder()
                .itemKey(target.itemKey)
                .mode(constraint.mode)
                .sliceFamily(constraint.sliceFamily())
                .querySignature(signature)
                .connection(connection)
                .components(List.of());

        List<CachedRecord> records = store.load(target.itemKey.objectId);
        if (!connections.hasConnection(target.edge, target.parameter)) {
            UnfetchableReason reason = records.isEmpty()
                    ? UnfetchableReason.NO_CONNECTION_AND_NO_FILE
                    : UnfetchableReason.NO_CONNECTION;
            addUnfetchable(target, constraint, item, reason, items, diagnostics);
            return;
        }
        if (connections.requiresEventIds(connection)) {
            int withIds = (shape.fromEventId.isEmpty() ? 0 : 1) + (shape.toEventId.isEmpty() ? 0 : 1);
            if (withIds == 0) {
                addUnfetchable(target, constraint, item, UnfetchableReason.NO_EVENT_IDS, items, diagnostics);
                return;
            }
            if (withIds == 1) {
                addUnfetchable(target, constraint, item, UnfetchableReason.PARTIAL_EVENT_IDS, items, diagnostics);
                return;
            }
        }

        CoverageRequest request = CoverageRequest.builder()
                .constraint(constraint)
                .signatures(c -> resolver.signatureFor(c, shape))
                .bustCache(options.bustCache)
                .referenceNow(options.referenceNow)
                .build();
        CoverageResult result = coverage.analyze(request, records);
        List<FetchComponent> components = new ArrayList<>();
        for (ComponentCoverage c : result.components) {
            if (c.needsFetch()) {
                components.add(new FetchComponent(c.constraint, c.sliceFamily, c.querySignature, c.windows));
            }
        }
        items.add(item.classification(result.classification).windows(result.windows).components(components).build());
        diagnostics.add(diagnostic(target, constraint, result.classification, result.windows, result.notes));
    }

    private void planCase(
            FetchTarget target,
            SliceConstraint constraint,
            List<FetchPlanItem> items,
            List<ItemDiagnostic> diagnostics
    ) {
        boolean hasConnection = connections.hasCaseConnection(target.node);
        String connection = hasConnection ? target.node.caseBinding.connection.trim() : "";
        FetchPlanItem.FetchPlanItemBuilder item = FetchPlanItem.builder()
                .itemKey(target.itemKey)
                .mode(constraint.mode)
                .sliceFamily(constraint.sliceFamily())
                .querySignature("")
                .connection(connection)
                .components(List.of());

        if (!store.load(target.itemKey.objectId).isEmpty()) {
            items.add(item.classification(Classification.COVERED).windows(List.of()).build());
            diagnostics.add(diagnostic(target, constraint, Classification.COVERED, List.of(), List.of("case data cached")));
            return;
        }
        if (hasConnection) {
            List<FetchWindow> windows = List.of(FetchWindow.of(constraint.bounds.start, constraint.bounds.end,
                    WindowReason.MISSING));
            items.add(item.classification(Classification.FETCH).windows(windows).build());
            diagnostics.add(diagnostic(target, constraint, Classification.FETCH, windows, List.of()));
            return;
        }
        addUnfetchable(target, constraint, item, UnfetchableReason.NO_CONNECTION_AND_NO_FILE, items, diagnostics);
    }

    private static void addUnfetchable(
            FetchTarget target,
            SliceConstraint constraint,
            FetchPlanItem.FetchPlanItemBuilder item,
            UnfetchableReason reason,
            List<FetchPlanItem> items,
            List<ItemDiagnostic> diagnostics
    ) {
        items.add(item.classification(Classification.UNFETCHABLE).windows(List.of()).unfetchableReason(reason).build());
        diagnostics.add(diagnostic(target, constraint, Classification.UNFETCHABLE, List.of(),
                List.of("unfetchable: " + reason.label())));
    }

    private static ItemDiagnostic diagnostic(
            FetchTarget target,
            SliceConstraint constraint,
            Classification classification,
            List<FetchWindow> windows,
            List<String> notes
    ) {
        List<LocalDate> missing = new ArrayList<>();
        List<LocalDate> stale = new ArrayList<>();
        for (FetchWindow w : windows) {
            if (w.reason == WindowReason.STALE) {
                stale.addAll(w.bounds().dates());
            } else {
                missing.addAll(w.bounds().dates());
            }
        }
        return new ItemDiagnostic(
                target.itemKey,
                target.itemKey.objectId,
                constraint.mode,
                List.copyOf(missing),
                List.copyOf(stale),
                FetchWindow.totalDays(windows),
                classification,
                List.copyOf(notes)
        );
    }
}
