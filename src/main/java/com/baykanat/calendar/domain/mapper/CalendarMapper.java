package com.baykanat.calendar.domain.mapper;

import com.baykanat.calendar.api.dto.EventCreateRequest;
import com.baykanat.calendar.api.dto.EventDetailResponse;
import com.baykanat.calendar.api.dto.EventResponse;
import com.baykanat.calendar.api.dto.MonthResponse;
import com.baykanat.calendar.domain.model.Event;
import com.baykanat.calendar.domain.model.EventDetail;
import com.baykanat.calendar.domain.model.EventDraft;
import com.baykanat.calendar.domain.model.Month;
import org.mapstruct.Mapper;

import java.util.List;

/** Domain modelleri ↔ API DTO dönüşümleri (MapStruct). */
@Mapper(componentModel = "spring")
public interface CalendarMapper {

    MonthResponse toResponse(Month month);

    List<MonthResponse> toMonthResponses(List<Month> months);

    EventResponse toResponse(Event event);

    List<EventResponse> toEventResponses(List<Event> events);

    EventDetailResponse toResponse(EventDetail detail);

    List<EventDetailResponse> toDetailResponses(List<EventDetail> details);

    /** İstek → kaydedilmemiş event taslağı. */
    EventDraft toDraft(EventCreateRequest request);

    List<EventDraft> toDrafts(List<EventCreateRequest> requests);
}
