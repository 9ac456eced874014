package com.baykanat.calendar.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** event_details tablosu satırı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventDetail {

    private Long id;
    private Long eventId;
    private String detail;
}
