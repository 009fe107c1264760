package com.slicebot.plan;

import com.slicebot.model.Classification;
import com.slicebot.model.ItemKey;
import com.slicebot.model.QueryMode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class ItemDiagnostic {
    public final ItemKey itemKey;
    public final String objectId;
    public final QueryMode mode;
    public final List<LocalDate> missingDates;
    public final List<LocalDate> staleDates;
    public final int totalFetchDates;
    public final Classification classification;
    public final List<String> notes;
}
