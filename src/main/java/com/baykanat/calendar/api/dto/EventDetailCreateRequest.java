package com.baykanat.calendar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Single detail line to append to an event")
public class EventDetailCreateRequest {

    @NotBlank(message = "detail is required")
    @JsonProperty("detail")
    @Schema(description = "Detail text", example = "বাংলা নববর্ষ")
    private String detail;
}
