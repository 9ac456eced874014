package com.baykanat.calendar.domain.service;

import com.baykanat.calendar.domain.model.Event;
import com.baykanat.calendar.domain.model.EventDetail;
import com.baykanat.calendar.domain.model.Month;
import com.baykanat.calendar.infrastructure.persistence.EventDetailJdbcRepository;
import com.baykanat.calendar.infrastructure.persistence.EventJdbcRepository;
import com.baykanat.calendar.infrastructure.persistence.MonthJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CalendarService.
 *
 * <p>Verifies the lookup and assembly logic with mocked repositories:
 * <ul>
 *   <li>Day lookup with Bengali digit fallback</li>
 *   <li>Search pattern escaping</li>
 *   <li>Parent existence checks on nested writes</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class CalendarServiceTest {

    @Mock
    private MonthJdbcRepository monthRepository;

    @Mock
    private EventJdbcRepository eventRepository;

    @Mock
    private EventDetailJdbcRepository detailRepository;

    private CalendarService service;

    @BeforeEach
    void setUp() {
        service = new CalendarService(monthRepository, eventRepository, detailRepository);
    }

    private static Event event(long id, long monthId, String day) {
        return Event.builder().id(id).monthId(monthId).day(day).build();
    }

    @Test
    @DisplayName("Exact day match is returned without a second lookup")
    void exactMatchWins() {
        when(eventRepository.findByMonthIdAndDay(1L, "5")).thenReturn(List.of(event(10L, 1L, "5")));
        when(detailRepository.findByEventIds(List.of(10L))).thenReturn(List.of(
                EventDetail.builder().id(100L).eventId(10L).detail("western").build()));

        List<Event> events = service.getEventsByDate(1L, "5");

        assertThat(events).extracting(Event::getDay).containsExactly("5");
        assertThat(events.get(0).getDetails()).extracting(EventDetail::getDetail).containsExactly("western");
        verify(eventRepository, never()).findByMonthIdAndDay(1L, "৫");
    }

    @Test
    @DisplayName("Western digits fall back to the Bengali spelling of the day")
    void fallsBackToBengaliDigits() {
        when(eventRepository.findByMonthIdAndDay(1L, "12")).thenReturn(List.of());
        when(eventRepository.findByMonthIdAndDay(1L, "১২")).thenReturn(List.of(event(11L, 1L, "১২")));
        when(detailRepository.findByEventIds(List.of(11L))).thenReturn(List.of());

        List<Event> events = service.getEventsByDate(1L, "12");

        assertThat(events).extracting(Event::getDay).containsExactly("১২");
        assertThat(events.get(0).getDetails()).isEmpty();
    }

    @Test
    @DisplayName("No retry when translation leaves the day unchanged")
    void noRetryWhenUnchanged() {
        when(eventRepository.findByMonthIdAndDay(1L, "১৫")).thenReturn(List.of());

        assertThat(service.getEventsByDate(1L, "১৫")).isEmpty();
        verify(eventRepository, times(1)).findByMonthIdAndDay(anyLong(), anyString());
        verifyNoInteractions(detailRepository);
    }

    @Test
    @DisplayName("Search wraps the query in wildcards and escapes LIKE metacharacters")
    void searchEscapesPattern() {
        when(detailRepository.searchByPattern(anyString())).thenReturn(List.of());

        service.searchDetails("50%_off");

        verify(detailRepository).searchByPattern("%50\\%\\_off%");
    }

    @Test
    @DisplayName("Creating an event under a missing month inserts nothing")
    void createEventForMissingMonth() {
        when(monthRepository.findById(99L)).thenReturn(Optional.empty());

        assertThat(service.createEvent(99L, "1", List.of("x"))).isEmpty();
        verify(eventRepository, never()).insert(anyLong(), anyString());
        verify(detailRepository, never()).batchInsert(anyLong(), anyList());
    }

    @Test
    @DisplayName("Adding a detail to a missing event inserts nothing")
    void addDetailForMissingEvent() {
        when(eventRepository.findById(99L)).thenReturn(Optional.empty());

        assertThat(service.addDetail(99L, "x")).isEmpty();
        verify(detailRepository, never()).insert(anyLong(), anyString());
    }

    @Test
    @DisplayName("Deleting a missing month does not issue a delete")
    void deleteMissingMonth() {
        when(monthRepository.findById(5L)).thenReturn(Optional.empty());

        assertThat(service.deleteMonth(5L)).isEmpty();
        verify(monthRepository, never()).deleteById(anyLong());
    }

    @Test
    @DisplayName("Listed months get their events and details attached in one query each")
    void listAttachesChildren() {
        Month baishakh = Month.builder().id(1L).monthBn("বৈশাখ").monthEn("Baishakh").build();
        Month jaishtha = Month.builder().id(2L).monthBn("জ্যৈষ্ঠ").monthEn("Jaishtha").build();
        when(monthRepository.findPage(0, 100)).thenReturn(List.of(baishakh, jaishtha));
        when(eventRepository.findByMonthIds(List.of(1L, 2L))).thenReturn(List.of(event(10L, 1L, "১")));
        when(detailRepository.findByEventIds(List.of(10L))).thenReturn(List.of(
                EventDetail.builder().id(100L).eventId(10L).detail("পহেলা বৈশাখ").build()));

        List<Month> months = service.listMonths(0, 100);

        assertThat(months.get(0).getEvents()).hasSize(1);
        assertThat(months.get(0).getEvents().get(0).getDetails())
                .extracting(EventDetail::getDetail).containsExactly("পহেলা বৈশাখ");
        assertThat(months.get(1).getEvents()).isEmpty();
    }
}
