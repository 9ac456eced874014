package com.baykanat.calendar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Ay oluşturma isteği; event'ler ve detayları aynı istekle tek transaction'da yazılır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Month payload with optional nested events")
public class MonthCreateRequest {

    @NotBlank(message = "month_bn is required")
    @JsonProperty("month_bn")
    @Schema(description = "Month name in Bengali", example = "বৈশাখ")
    private String monthBn;

    @NotBlank(message = "month_en is required")
    @JsonProperty("month_en")
    @Schema(description = "Month name in English", example = "Baishakh")
    private String monthEn;

    @Valid
    @JsonProperty("events")
    @Schema(description = "Events created together with the month")
    private List<EventCreateRequest> events;

    /** events verilmezse boş liste. */
    public List<EventCreateRequest> getEvents() {
        return events == null ? List.of() : events;
    }
}
