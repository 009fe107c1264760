package com.slicebot.plan;

import com.slicebot.model.Classification;
import com.slicebot.model.ItemKey;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Per-classification counts plus one diagnostic per plan item, ordered like the plan.
 */
public final class FetchPlanDiagnostics {
    public final int totalItems;
    public final int itemsNeedingFetch;
    public final int itemsCovered;
    public final int itemsUnfetchable;
    public final List<ItemDiagnostic> items;

    FetchPlanDiagnostics(List<ItemDiagnostic> items) {
        List<ItemDiagnostic> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparing((ItemDiagnostic d) -> d.itemKey));
        int fetch = 0;
        int covered = 0;
        int unfetchable = 0;
        for (ItemDiagnostic d : sorted) {
            if (d.classification == Classification.FETCH) {
                fetch++;
            } else if (d.classification == Classification.COVERED) {
                covered++;
            } else {
                unfetchable++;
            }
        }
        this.totalItems = sorted.size();
        this.itemsNeedingFetch = fetch;
        this.itemsCovered = covered;
        this.itemsUnfetchable = unfetchable;
        this.items = List.copyOf(sorted);
    }

    public ItemDiagnostic find(ItemKey key) {
        for (ItemDiagnostic d : items) {
            if (d.itemKey.equals(key)) {
                return d;
            }
        }
        return null;
    }
}
