package com.baykanat.calendar.config;

import com.baykanat.calendar.api.dto.MonthCreateRequest;
import com.baykanat.calendar.domain.mapper.CalendarMapper;
import com.baykanat.calendar.domain.service.CalendarService;
import com.baykanat.calendar.domain.service.UserService;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/** Açılışta months tablosu boşsa JSON takvimini yükler, varsayılan admin yoksa oluşturur. */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class CalendarSeedRunner implements ApplicationRunner {

    private final AppProperties appProperties;
    private final CalendarService calendarService;
    private final UserService userService;
    private final CalendarMapper calendarMapper;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) {
        if (appProperties.getSeed().isEnabled()) {
            seedCalendarIfEmpty();
        }
        ensureDefaultAdmin();
    }

    /** Dolu veritabanında hiçbir şey yapmaz; dosya yoksa uyarı yazıp geçer. */
    void seedCalendarIfEmpty() {
        if (calendarService.countMonths() > 0) {
            log.debug("Months table is not empty, skipping seed");
            return;
        }

        Resource resource = resourceLoader.getResource(appProperties.getSeed().getLocation());
        if (!resource.exists()) {
            log.warn("Seed file {} not found, skipping seed", appProperties.getSeed().getLocation());
            return;
        }

        SeedDocument document;
        try (InputStream in = resource.getInputStream()) {
            document = objectMapper.readValue(in, SeedDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read seed file " + appProperties.getSeed().getLocation(), e);
        }

        List<MonthCreateRequest> months = document.months() == null ? List.of() : document.months();
        log.info("Seeding database with {} months...", months.size());
        for (MonthCreateRequest month : months) {
            calendarService.createMonth(month.getMonthBn(), month.getMonthEn(),
                    calendarMapper.toDrafts(month.getEvents()));
        }
        log.info("Database seeded successfully.");
    }

    void ensureDefaultAdmin() {
        String username = appProperties.getAdmin().getUsername();
        if (userService.findByUsername(username).isPresent()) {
            return;
        }
        userService.createUser(username, appProperties.getAdmin().getPassword());
        log.info("Created default admin user: {}", username);
    }

    /** Seed dosyasının kök nesnesi. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedDocument(@JsonProperty("Aiyamullah_Shareef_Calendar") List<MonthCreateRequest> months) {
    }
}
