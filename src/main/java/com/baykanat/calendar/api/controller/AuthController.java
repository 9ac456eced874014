package com.baykanat.calendar.api.controller;

import com.baykanat.calendar.api.dto.TokenResponse;
import com.baykanat.calendar.domain.exception.UnauthenticatedException;
import com.baykanat.calendar.domain.model.User;
import com.baykanat.calendar.domain.service.TokenService;
import com.baykanat.calendar.domain.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** POST /token: form ile kullanıcı adı/parola alır, 30 dakikalık bearer token döner. */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Token issuing for admin API access")
public class AuthController {

    private final UserService userService;
    private final TokenService tokenService;

    @PostMapping(value = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    @Operation(summary = "Issue an access token", description = "OAuth2 password-style form login returning a bearer token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Token issued"),
            @ApiResponse(responseCode = "401", description = "Incorrect username or password")
    })
    public ResponseEntity<TokenResponse> issueToken(@RequestParam("username") String username,
                                                    @RequestParam("password") String password) {
        User user = userService.authenticate(username, password)
                .orElseThrow(() -> new UnauthenticatedException("Incorrect username or password"));

        log.info("Issued access token for username={}", user.getUsername());
        return ResponseEntity.ok(TokenResponse.builder()
                .accessToken(tokenService.issueAccessToken(user.getUsername()))
                .tokenType("bearer")
                .build());
    }
}
