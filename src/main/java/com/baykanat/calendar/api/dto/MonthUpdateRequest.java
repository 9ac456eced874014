package com.baykanat.calendar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Ay isimlerini günceller; iki alan da zorunlu. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Month name update payload")
public class MonthUpdateRequest {

    @NotBlank(message = "month_bn is required")
    @JsonProperty("month_bn")
    @Schema(description = "Month name in Bengali", example = "জ্যৈষ্ঠ")
    private String monthBn;

    @NotBlank(message = "month_en is required")
    @JsonProperty("month_en")
    @Schema(description = "Month name in English", example = "Jyoishtho")
    private String monthEn;
}
