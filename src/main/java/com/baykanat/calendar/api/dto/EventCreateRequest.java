package com.baykanat.calendar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Event ve detay metinleri; day serbest metin ("5" ya da "৫"). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Event payload with its detail lines")
public class EventCreateRequest {

    @NotBlank(message = "day is required")
    @JsonProperty("day")
    @Schema(description = "Day of month in Western or Bengali digits", example = "১")
    private String day;

    @NotNull(message = "details is required")
    @JsonProperty("details")
    @Schema(description = "Detail lines of the event", example = "[\"পহেলা বৈশাখ\"]")
    private List<@NotBlank(message = "detail must not be blank") String> details;
}
