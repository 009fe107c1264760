package com.slicebot.runner;

import com.slicebot.model.FetchComponent;
import com.slicebot.model.FetchPlanItem;
import com.slicebot.model.QueryMode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Atomicity unit of a run. Target id and time bounds are deliberately absent, so duplicate references to
 * one logical metric share a scope.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class RetrievalScope {
    public final String objectId;
    public final String sliceFamily;
    public final String querySignature;
    public final QueryMode mode;

    /**
     * Scope of one component; the component's family and signature replace the item's.
     */
    public static RetrievalScope of(FetchPlanItem item, FetchComponent component) {
        String family = component == null ? item.sliceFamily : component.sliceFamily;
        String rawSignature = component == null ? item.querySignature : component.querySignature;
        String signature = rawSignature == null ? "" : rawSignature.trim();
        if (signature.isEmpty()) {
            // unsigned items (cases) stay distinct per target
            signature = item.itemKey.display();
        }
        return new RetrievalScope(
                item.objectId(),
                family == null ? "" : family,
                signature,
                item.mode == null ? QueryMode.WINDOW : item.mode
        );
    }
}
