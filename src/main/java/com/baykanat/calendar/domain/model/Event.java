package com.baykanat.calendar.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** events tablosu satırı. day serbest metin: "5" veya "৫" olabilir, sayı olarak parse edilmez. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    private Long id;
    private Long monthId;
    private String day;
    @Builder.Default
    private List<EventDetail> details = new ArrayList<>();
}
