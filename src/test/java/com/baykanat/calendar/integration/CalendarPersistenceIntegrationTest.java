package com.baykanat.calendar.integration;

import com.baykanat.calendar.domain.exception.UsernameTakenException;
import com.baykanat.calendar.domain.model.Event;
import com.baykanat.calendar.domain.model.EventDetail;
import com.baykanat.calendar.domain.model.EventDraft;
import com.baykanat.calendar.domain.model.Month;
import com.baykanat.calendar.domain.service.CalendarService;
import com.baykanat.calendar.domain.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the calendar and user services against the
 * in-memory H2 database (PostgreSQL mode) with the production schema.
 *
 * <p>This test validates:
 * <ul>
 *   <li>Cascading deletes from months down to details</li>
 *   <li>Nested month creation is all-or-nothing</li>
 *   <li>Detail search and day lookup on real rows</li>
 *   <li>Username uniqueness</li>
 * </ul>
 */
@SpringBootTest
@ActiveProfiles("test")
class CalendarPersistenceIntegrationTest {

    @Autowired
    private CalendarService calendarService;

    @Autowired
    private UserService userService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanUp() {
        jdbcTemplate.update("DELETE FROM months");
    }

    private int count(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    @Test
    @DisplayName("Nested create stores events and details in insertion order")
    void createMonthWithEvents() {
        Month month = calendarService.createMonth("বৈশাখ", "Baishakh", List.of(
                new EventDraft("১", List.of("পহেলা বৈশাখ", "বাংলা নববর্ষ")),
                new EventDraft("২৫", List.of("রবীন্দ্রনাথ ঠাকুরের জন্মদিন"))));

        assertThat(month.getId()).isNotNull();
        assertThat(month.getEvents()).extracting(Event::getDay).containsExactly("১", "২৫");
        assertThat(month.getEvents().get(0).getDetails())
                .extracting(EventDetail::getDetail)
                .containsExactly("পহেলা বৈশাখ", "বাংলা নববর্ষ");
        assertThat(calendarService.getMonth(month.getId())).contains(month);
    }

    @Test
    @DisplayName("Deleting a month removes all of its events and details")
    void deleteMonthCascades() {
        Month month = calendarService.createMonth("বৈশাখ", "Baishakh", List.of(
                new EventDraft("1", List.of("a", "b")),
                new EventDraft("2", List.of("c", "d"))));
        assertThat(count("events")).isEqualTo(2);
        assertThat(count("event_details")).isEqualTo(4);

        assertThat(calendarService.deleteMonth(month.getId())).isPresent();

        assertThat(count("months")).isZero();
        assertThat(count("events")).isZero();
        assertThat(count("event_details")).isZero();
    }

    @Test
    @DisplayName("Deleting an event removes its details but keeps the month")
    void deleteEventCascades() {
        Month month = calendarService.createMonth("জ্যৈষ্ঠ", "Jaishtha", List.of(
                new EventDraft("১১", List.of("x", "y"))));
        long eventId = month.getEvents().get(0).getId();

        assertThat(calendarService.deleteEvent(eventId)).isPresent();

        assertThat(count("event_details")).isZero();
        assertThat(calendarService.getMonth(month.getId())).hasValueSatisfying(
                m -> assertThat(m.getEvents()).isEmpty());
    }

    @Test
    @DisplayName("A failure in a later event rolls back the whole nested create")
    void nestedCreateIsAtomic() {
        List<EventDraft> drafts = List.of(
                new EventDraft("1", List.of("fine")),
                new EventDraft("2", Arrays.asList("fine too", null)));

        assertThatThrownBy(() -> calendarService.createMonth("বৈশাখ", "Baishakh", drafts))
                .isInstanceOf(DataIntegrityViolationException.class);

        assertThat(count("months")).isZero();
        assertThat(count("events")).isZero();
        assertThat(count("event_details")).isZero();
    }

    @Test
    @DisplayName("Search is a case-insensitive substring match")
    void searchMatchesSubstring() {
        calendarService.createMonth("শ্রাবণ", "Shrabon", List.of(
                new EventDraft("1", List.of("XYZabcDEF", "xy"))));

        assertThat(calendarService.searchDetails("abc"))
                .extracting(EventDetail::getDetail).containsExactly("XYZabcDEF");
        assertThat(calendarService.searchDetails("ABC"))
                .extracting(EventDetail::getDetail).containsExactly("XYZabcDEF");
        assertThat(calendarService.searchDetails("zzz")).isEmpty();
    }

    @Test
    @DisplayName("Search treats % and _ literally")
    void searchEscapesWildcards() {
        calendarService.createMonth("ভাদ্র", "Bhadro", List.of(
                new EventDraft("1", List.of("100% sale", "100 percent"))));

        assertThat(calendarService.searchDetails("0% s"))
                .extracting(EventDetail::getDetail).containsExactly("100% sale");
        assertThat(calendarService.searchDetails("1_0")).isEmpty();
    }

    @Test
    @DisplayName("Day lookup finds Bengali-digit days from Western input")
    void dayLookupFallback() {
        Month month = calendarService.createMonth("ফাল্গুন", "Falgun", List.of(
                new EventDraft("৮", List.of("আন্তর্জাতিক মাতৃভাষা দিবস"))));

        assertThat(calendarService.getEventsByDate(month.getId(), "8"))
                .extracting(Event::getDay).containsExactly("৮");
        assertThat(calendarService.getEventsByDate(month.getId(), "৮")).hasSize(1);
        assertThat(calendarService.getEventsByDate(month.getId(), "9")).isEmpty();
    }

    @Test
    @DisplayName("When both spellings of a day exist only the exact match is returned")
    void dayLookupPrefersExactMatch() {
        Month month = calendarService.createMonth("আশ্বিন", "Ashwin", List.of(
                new EventDraft("5", List.of("western")),
                new EventDraft("৫", List.of("bengali"))));

        List<Event> western = calendarService.getEventsByDate(month.getId(), "5");
        assertThat(western).extracting(Event::getDay).containsExactly("5");
        assertThat(western.get(0).getDetails()).extracting(EventDetail::getDetail).containsExactly("western");

        assertThat(calendarService.getEventsByDate(month.getId(), "৫"))
                .extracting(Event::getDay).containsExactly("৫");
    }

    @Test
    @DisplayName("Paging follows insertion order")
    void paging() {
        calendarService.createMonth("বৈশাখ", "Baishakh", List.of());
        calendarService.createMonth("জ্যৈষ্ঠ", "Jaishtha", List.of());
        calendarService.createMonth("আষাঢ়", "Asharh", List.of());

        assertThat(calendarService.listMonths(1, 1)).extracting(Month::getMonthEn).containsExactly("Jaishtha");
        assertThat(calendarService.listMonths(0, 0)).isEmpty();
        assertThat(calendarService.listMonths(10, 5)).isEmpty();
    }

    @Test
    @DisplayName("Default admin exists after startup and usernames are unique")
    void usernamesAreUnique() {
        assertThat(userService.authenticate("admin", "password123")).isPresent();

        userService.createUser("editor-unique", "pw-1");

        assertThatThrownBy(() -> userService.createUser("editor-unique", "pw-2"))
                .isInstanceOf(UsernameTakenException.class);
        assertThat(userService.authenticate("editor-unique", "pw-1")).isPresent();
        assertThat(userService.authenticate("editor-unique", "pw-2")).isEmpty();
    }
}
