package com.baykanat.calendar.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** İç içe oluşturma için henüz kaydedilmemiş event: gün ve detay metinleri. */
public record EventDraft(String day, List<String> details) {

    public EventDraft {
        details = details == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(details));
    }
}
