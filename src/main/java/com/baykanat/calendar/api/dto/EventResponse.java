package com.baykanat.calendar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Event with its details")
public class EventResponse {

    @JsonProperty("id")
    @Schema(description = "Event id", example = "10")
    private Long id;

    @JsonProperty("month_id")
    @Schema(description = "Owning month id", example = "1")
    private Long monthId;

    @JsonProperty("day")
    @Schema(description = "Day as stored", example = "১")
    private String day;

    @JsonProperty("details")
    @Schema(description = "Detail lines in insertion order")
    private List<EventDetailResponse> details;
}
