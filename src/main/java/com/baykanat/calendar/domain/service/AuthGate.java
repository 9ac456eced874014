package com.baykanat.calendar.domain.service;

import com.baykanat.calendar.domain.exception.InvalidTokenException;
import com.baykanat.calendar.domain.exception.UnauthenticatedException;
import com.baykanat.calendar.domain.model.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * İsteğin kullanıcısını token'dan çözer. Tek doğrulama çekirdeği, iki giriş:
 * Authorization header (katı, 401) ve oturum cookie'si (esnek, anonim).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthGate {

    public static final String SESSION_COOKIE = "access_token";
    public static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final UserService userService;

    /** Token'ı doğrular ve subject'e ait kullanıcıyı yükler. */
    public User authenticate(String token) throws InvalidTokenException {
        String username = tokenService.validate(token);
        return userService.findByUsername(username)
                .orElseThrow(() -> new InvalidTokenException("Token subject no longer exists"));
    }

    /** "Bearer <token>" header'ı zorunlu; her hata UnauthenticatedException. */
    public User requireBearer(String authorizationHeader) {
        String token = extractBearerToken(authorizationHeader)
                .orElseThrow(() -> new UnauthenticatedException("Not authenticated"));
        try {
            return authenticate(token);
        } catch (InvalidTokenException e) {
            throw new UnauthenticatedException("Could not validate credentials", e);
        }
    }

    /** Cookie değeri "Bearer <token>"; yalnızca geçersiz token anonim sayılır, diğer hatalar yukarı çıkar. */
    public Optional<User> resolveCookie(String cookieValue) {
        if (cookieValue == null || cookieValue.isBlank()) {
            return Optional.empty();
        }
        String token = cookieValue.startsWith(BEARER_PREFIX)
                ? cookieValue.substring(BEARER_PREFIX.length())
                : cookieValue;
        try {
            return Optional.of(authenticate(token));
        } catch (InvalidTokenException e) {
            log.debug("Session cookie rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> extractBearerToken(String header) {
        if (header == null) {
            return Optional.empty();
        }
        int space = header.indexOf(' ');
        if (space <= 0) {
            return Optional.empty();
        }
        String scheme = header.substring(0, space);
        String token = header.substring(space + 1).trim();
        if (!"bearer".equalsIgnoreCase(scheme) || token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
