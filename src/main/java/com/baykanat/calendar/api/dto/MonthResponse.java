package com.baykanat.calendar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Ay yanıtı; event'ler ve detaylarıyla. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Month with its events")
public class MonthResponse {

    @JsonProperty("id")
    @Schema(description = "Month id", example = "1")
    private Long id;

    @JsonProperty("month_bn")
    @Schema(description = "Month name in Bengali", example = "বৈশাখ")
    private String monthBn;

    @JsonProperty("month_en")
    @Schema(description = "Month name in English", example = "Baishakh")
    private String monthEn;

    @JsonProperty("events")
    @Schema(description = "Events in insertion order")
    private List<EventResponse> events;
}
