package com.baykanat.calendar.api.controller;

import com.baykanat.calendar.api.dto.EventCreateRequest;
import com.baykanat.calendar.api.dto.EventDetailCreateRequest;
import com.baykanat.calendar.api.dto.EventDetailResponse;
import com.baykanat.calendar.api.dto.EventResponse;
import com.baykanat.calendar.api.dto.MonthCreateRequest;
import com.baykanat.calendar.api.dto.MonthResponse;
import com.baykanat.calendar.api.dto.MonthUpdateRequest;
import com.baykanat.calendar.config.OpenApiConfig;
import com.baykanat.calendar.domain.exception.ResourceNotFoundException;
import com.baykanat.calendar.domain.mapper.CalendarMapper;
import com.baykanat.calendar.domain.service.CalendarService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** /admin yazma uçları. Bearer kontrolü BearerAuthInterceptor'da; yoksa 401, kayıt yoksa 404. */
@Slf4j
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME)
@Tag(name = "Admin", description = "Calendar write endpoints (bearer token required)")
@ApiResponses({
        @ApiResponse(responseCode = "401", description = "Missing, invalid or expired bearer token"),
        @ApiResponse(responseCode = "404", description = "Referenced entity does not exist")
})
public class AdminCalendarController {

    private final CalendarService calendarService;
    private final CalendarMapper calendarMapper;

    /** Ay, event'ler ve detaylar tek transaction'da oluşturulur. */
    @PostMapping({"/months", "/months/"})
    @Operation(summary = "Create a month with nested events")
    public ResponseEntity<MonthResponse> createMonth(@Valid @RequestBody MonthCreateRequest request) {
        return ResponseEntity.ok(calendarMapper.toResponse(calendarService.createMonth(
                request.getMonthBn(), request.getMonthEn(), calendarMapper.toDrafts(request.getEvents()))));
    }

    @PutMapping({"/months/{monthId}", "/months/{monthId}/"})
    @Operation(summary = "Rename a month")
    public ResponseEntity<MonthResponse> updateMonth(@PathVariable("monthId") long monthId,
                                                     @Valid @RequestBody MonthUpdateRequest request) {
        return calendarService.updateMonth(monthId, request.getMonthBn(), request.getMonthEn())
                .map(calendarMapper::toResponse)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Month", monthId));
    }

    /** Silinen ayı döner; event ve detayları da silinir. */
    @DeleteMapping({"/months/{monthId}", "/months/{monthId}/"})
    @Operation(summary = "Delete a month and everything under it")
    public ResponseEntity<MonthResponse> deleteMonth(@PathVariable("monthId") long monthId) {
        return calendarService.deleteMonth(monthId)
                .map(calendarMapper::toResponse)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Month", monthId));
    }

    @PostMapping({"/months/{monthId}/events", "/months/{monthId}/events/"})
    @Operation(summary = "Add an event to a month")
    public ResponseEntity<EventResponse> createEvent(@PathVariable("monthId") long monthId,
                                                     @Valid @RequestBody EventCreateRequest request) {
        return calendarService.createEvent(monthId, request.getDay(), request.getDetails())
                .map(calendarMapper::toResponse)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Month", monthId));
    }

    @DeleteMapping({"/events/{eventId}", "/events/{eventId}/"})
    @Operation(summary = "Delete an event and its details")
    public ResponseEntity<EventResponse> deleteEvent(@PathVariable("eventId") long eventId) {
        return calendarService.deleteEvent(eventId)
                .map(calendarMapper::toResponse)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
    }

    @PostMapping({"/events/{eventId}/details", "/events/{eventId}/details/"})
    @Operation(summary = "Append a detail line to an event")
    public ResponseEntity<EventDetailResponse> addDetail(@PathVariable("eventId") long eventId,
                                                         @Valid @RequestBody EventDetailCreateRequest request) {
        return calendarService.addDetail(eventId, request.getDetail())
                .map(calendarMapper::toResponse)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
    }

    @DeleteMapping({"/details/{detailId}", "/details/{detailId}/"})
    @Operation(summary = "Delete a detail line")
    public ResponseEntity<EventDetailResponse> deleteDetail(@PathVariable("detailId") long detailId) {
        return calendarService.deleteDetail(detailId)
                .map(calendarMapper::toResponse)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Detail", detailId));
    }
}
