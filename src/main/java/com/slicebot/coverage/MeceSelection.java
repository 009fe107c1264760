package com.slicebot.coverage;

import com.slicebot.model.CachedRecord;

import java.util.List;
import java.util.Map;

public final class MeceSelection {
    public enum Kind {
        EXPLICIT_UNCONTEXTED,
        MECE_PARTITION,
        INCOMPLETE_PARTITION,
        NOT_RESOLVABLE
    }

    public final Kind kind;
    public final MecePartition partition;
    public final Map<String, List<CachedRecord>> recordsByValue;
    public final String reason;

    private MeceSelection(Kind kind, MecePartition partition, Map<String, List<CachedRecord>> recordsByValue, String reason) {
        this.kind = kind;
        this.partition = partition;
        this.recordsByValue = recordsByValue == null ? Map.of() : Map.copyOf(recordsByValue);
        this.reason = reason == null ? "" : reason;
    }

    static MeceSelection explicitUncontexted() {
        return new MeceSelection(Kind.EXPLICIT_UNCONTEXTED, null, Map.of(), "explicit uncontexted slice present");
    }

    static MeceSelection partition(MecePartition partition, Map<String, List<CachedRecord>> recordsByValue) {
        return new MeceSelection(Kind.MECE_PARTITION, partition, recordsByValue, partition.describe());
    }

    static MeceSelection incomplete(MecePartition partition, Map<String, List<CachedRecord>> recordsByValue) {
        return new MeceSelection(Kind.INCOMPLETE_PARTITION, partition, recordsByValue, partition.describe());
    }

    static MeceSelection notResolvable(MecePartition best, String reason) {
        return new MeceSelection(Kind.NOT_RESOLVABLE, best, Map.of(), reason);
    }
}
