package com.baykanat.calendar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** /token yanıtı: access_token ve token_type=bearer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Issued access token")
public class TokenResponse {

    @JsonProperty("access_token")
    @Schema(description = "Signed JWT", example = "eyJhbGciOiJIUzI1NiJ9...")
    private String accessToken;

    @JsonProperty("token_type")
    @Schema(description = "Always 'bearer'", example = "bearer")
    private String tokenType;
}
