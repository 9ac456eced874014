package com.baykanat.calendar.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** months tablosu satırı ve ekleme sırasına göre event'leri. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Month {

    private Long id;
    private String monthBn;
    private String monthEn;
    @Builder.Default
    private List<Event> events = new ArrayList<>();
}
