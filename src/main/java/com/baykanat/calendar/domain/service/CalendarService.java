package com.baykanat.calendar.domain.service;

import com.baykanat.calendar.domain.model.Event;
import com.baykanat.calendar.domain.model.EventDetail;
import com.baykanat.calendar.domain.model.EventDraft;
import com.baykanat.calendar.domain.model.Month;
import com.baykanat.calendar.domain.util.BengaliDigits;
import com.baykanat.calendar.infrastructure.persistence.EventDetailJdbcRepository;
import com.baykanat.calendar.infrastructure.persistence.EventJdbcRepository;
import com.baykanat.calendar.infrastructure.persistence.MonthJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/** Ay / event / detay okuma-yazma, gün bazlı arama ve detay metin araması. Her yazma tek transaction. */
@Slf4j
@Service
@RequiredArgsConstructor
public class CalendarService {

    private final MonthJdbcRepository monthRepository;
    private final EventJdbcRepository eventRepository;
    private final EventDetailJdbcRepository detailRepository;

    /** Ekleme sırasına göre sayfalı ay listesi, event ve detaylarıyla birlikte. */
    @Transactional(readOnly = true)
    public List<Month> listMonths(int skip, int limit) {
        List<Month> months = monthRepository.findPage(skip, limit);
        attachEvents(months);
        return months;
    }

    public long countMonths() {
        return monthRepository.count();
    }

    @Transactional(readOnly = true)
    public Optional<Month> getMonth(long id) {
        return monthRepository.findById(id).map(month -> {
            attachEvents(List.of(month));
            return month;
        });
    }

    /** Ayı, event'lerini ve detaylarını tek transaction'da oluşturur; herhangi bir hata hepsini geri alır. */
    @Transactional
    public Month createMonth(String monthBn, String monthEn, List<EventDraft> events) {
        long monthId = monthRepository.insert(monthBn, monthEn);
        for (EventDraft draft : events) {
            insertEvent(monthId, draft);
        }
        log.info("Created month id={} ({}) with {} events", monthId, monthEn, events.size());
        return getMonth(monthId).orElseThrow();
    }

    /** Ay yoksa boş döner; varsa iki isim alanının ikisi de yazılır. */
    @Transactional
    public Optional<Month> updateMonth(long id, String monthBn, String monthEn) {
        if (monthRepository.update(id, monthBn, monthEn) == 0) {
            return Optional.empty();
        }
        log.info("Updated month id={}", id);
        return getMonth(id);
    }

    /** Silinen ayı (event ve detaylarıyla) döner; alt kayıtlar cascade ile silinir. */
    @Transactional
    public Optional<Month> deleteMonth(long id) {
        Optional<Month> month = getMonth(id);
        month.ifPresent(m -> {
            monthRepository.deleteById(id);
            log.info("Deleted month id={} with {} events", id, m.getEvents().size());
        });
        return month;
    }

    /** Ay yoksa boş döner. */
    @Transactional
    public Optional<Event> createEvent(long monthId, String day, List<String> details) {
        if (monthRepository.findById(monthId).isEmpty()) {
            return Optional.empty();
        }
        long eventId = insertEvent(monthId, new EventDraft(day, details));
        log.info("Created event id={} in month id={}", eventId, monthId);
        return getEvent(eventId);
    }

    @Transactional
    public Optional<Event> deleteEvent(long id) {
        Optional<Event> event = getEvent(id);
        event.ifPresent(e -> {
            eventRepository.deleteById(id);
            log.info("Deleted event id={}", id);
        });
        return event;
    }

    /** Event yoksa boş döner. */
    @Transactional
    public Optional<EventDetail> addDetail(long eventId, String detail) {
        if (eventRepository.findById(eventId).isEmpty()) {
            return Optional.empty();
        }
        long detailId = detailRepository.insert(eventId, detail);
        log.info("Added detail id={} to event id={}", detailId, eventId);
        return detailRepository.findById(detailId);
    }

    @Transactional
    public Optional<EventDetail> deleteDetail(long id) {
        Optional<EventDetail> detail = detailRepository.findById(id);
        detail.ifPresent(d -> {
            detailRepository.deleteById(id);
            log.info("Deleted detail id={}", id);
        });
        return detail;
    }

    /**
     * Önce day birebir aranır. Sonuç yoksa Batı rakamları Bengalce rakamlara çevrilip tekrar denenir;
     * çeviri girdiyi değiştirmediyse ikinci sorgu atılmaz.
     */
    @Transactional(readOnly = true)
    public List<Event> getEventsByDate(long monthId, String day) {
        List<Event> events = eventRepository.findByMonthIdAndDay(monthId, day);
        if (events.isEmpty()) {
            String bengaliDay = BengaliDigits.fromWestern(day);
            if (!bengaliDay.equals(day)) {
                log.debug("No event for day '{}' in month {}, retrying as '{}'", day, monthId, bengaliDay);
                events = eventRepository.findByMonthIdAndDay(monthId, bengaliDay);
            }
        }
        attachDetails(events);
        return events;
    }

    /** Tüm detaylarda büyük/küçük harf duyarsız alt metin araması. Minimum uzunluk istek katmanında kontrol edilir. */
    @Transactional(readOnly = true)
    public List<EventDetail> searchDetails(String query) {
        return detailRepository.searchByPattern("%" + escapeLike(query) + "%");
    }

    private long insertEvent(long monthId, EventDraft draft) {
        long eventId = eventRepository.insert(monthId, draft.day());
        detailRepository.batchInsert(eventId, draft.details());
        return eventId;
    }

    private Optional<Event> getEvent(long id) {
        return eventRepository.findById(id).map(event -> {
            attachDetails(List.of(event));
            return event;
        });
    }

    private void attachEvents(List<Month> months) {
        if (months.isEmpty()) {
            return;
        }
        List<Event> events = eventRepository.findByMonthIds(months.stream().map(Month::getId).toList());
        attachDetails(events);

        Map<Long, List<Event>> byMonth = events.stream()
                .collect(Collectors.groupingBy(Event::getMonthId, LinkedHashMap::new, Collectors.toList()));
        months.forEach(month -> month.setEvents(byMonth.getOrDefault(month.getId(), List.of())));
    }

    private void attachDetails(List<Event> events) {
        if (events.isEmpty()) {
            return;
        }
        List<EventDetail> details = detailRepository.findByEventIds(events.stream().map(Event::getId).toList());

        Map<Long, List<EventDetail>> byEvent = details.stream()
                .collect(Collectors.groupingBy(EventDetail::getEventId, LinkedHashMap::new, Collectors.toList()));
        events.forEach(event -> event.setDetails(byEvent.getOrDefault(event.getId(), List.of())));
    }

    private static String escapeLike(String query) {
        return query.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
