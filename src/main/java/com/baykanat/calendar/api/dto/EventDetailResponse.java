package com.baykanat.calendar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Single event detail line")
public class EventDetailResponse {

    @JsonProperty("id")
    @Schema(description = "Detail id", example = "100")
    private Long id;

    @JsonProperty("event_id")
    @Schema(description = "Owning event id", example = "10")
    private Long eventId;

    @JsonProperty("detail")
    @Schema(description = "Detail text", example = "পহেলা বৈশাখ")
    private String detail;
}
