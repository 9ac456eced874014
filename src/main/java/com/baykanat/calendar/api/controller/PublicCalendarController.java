package com.baykanat.calendar.api.controller;

import com.baykanat.calendar.api.dto.EventDetailResponse;
import com.baykanat.calendar.api.dto.EventResponse;
import com.baykanat.calendar.api.dto.MonthResponse;
import com.baykanat.calendar.domain.exception.ResourceNotFoundException;
import com.baykanat.calendar.domain.mapper.CalendarMapper;
import com.baykanat.calendar.domain.service.CalendarService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** /api altındaki herkese açık okuma uçları: ay listesi, ay, güne göre event'ler, detay araması. */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Validated
@Tag(name = "Public", description = "Read-only calendar endpoints")
public class PublicCalendarController {

    private final CalendarService calendarService;
    private final CalendarMapper calendarMapper;

    @GetMapping("/months")
    @Operation(summary = "List months", description = "Months in insertion order with their events and details")
    public ResponseEntity<List<MonthResponse>> listMonths(
            @Parameter(description = "Number of months to skip", example = "0")
            @RequestParam(value = "skip", defaultValue = "0") @PositiveOrZero int skip,

            @Parameter(description = "Maximum number of months to return", example = "100")
            @RequestParam(value = "limit", defaultValue = "100") @PositiveOrZero int limit
    ) {
        return ResponseEntity.ok(calendarMapper.toMonthResponses(calendarService.listMonths(skip, limit)));
    }

    @GetMapping("/months/{monthId}")
    @Operation(summary = "Get a month")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Month found"),
            @ApiResponse(responseCode = "404", description = "No month with this id")
    })
    public ResponseEntity<MonthResponse> getMonth(@PathVariable("monthId") long monthId) {
        return calendarService.getMonth(monthId)
                .map(calendarMapper::toResponse)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Month", monthId));
    }

    /** day "5" ile eşleşme yoksa "৫" de denenir. */
    @GetMapping("/months/{monthId}/days/{day}")
    @Operation(summary = "Events of a day",
            description = "Exact match on the stored day first, then the same day written in Bengali digits")
    public ResponseEntity<List<EventResponse>> getEventsByDate(@PathVariable("monthId") long monthId,
                                                               @PathVariable("day") String day) {
        log.debug("Looking up events for month={}, day={}", monthId, day);
        return ResponseEntity.ok(calendarMapper.toEventResponses(calendarService.getEventsByDate(monthId, day)));
    }

    @GetMapping("/search")
    @Operation(summary = "Search event details", description = "Case-insensitive substring search over all details")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Matching details"),
            @ApiResponse(responseCode = "400", description = "Query missing or shorter than 3 characters")
    })
    public ResponseEntity<List<EventDetailResponse>> search(
            @Parameter(description = "Search text, at least 3 characters", required = true, example = "বৈশাখ")
            @RequestParam("q") @NotNull @Size(min = 3, message = "q must be at least 3 characters") String q
    ) {
        return ResponseEntity.ok(calendarMapper.toDetailResponses(calendarService.searchDetails(q)));
    }
}
