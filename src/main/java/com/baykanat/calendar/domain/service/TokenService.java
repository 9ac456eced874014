package com.baykanat.calendar.domain.service;

import com.baykanat.calendar.config.AppProperties;
import com.baykanat.calendar.domain.exception.InvalidTokenException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/** HS256 imzalı, süreli JWT üretir ve doğrular. Sunucu tarafında oturum tutulmaz. */
@Slf4j
@Service
public class TokenService {

    private final SecretKey signingKey;
    private final Duration defaultTtl;
    private final Duration accessTokenTtl;
    private final Clock clock;
    private final JwtParser parser;

    public TokenService(AppProperties appProperties, Clock clock) {
        this.signingKey = Keys.hmacShaKeyFor(
                appProperties.getSecurity().getSecret().getBytes(StandardCharsets.UTF_8));
        this.defaultTtl = appProperties.getSecurity().getDefaultTokenTtl();
        this.accessTokenTtl = appProperties.getSecurity().getAccessTokenTtl();
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    /** Varsayılan ömürle (15 dk) token. */
    public String issue(String subject) {
        return issue(subject, defaultTtl);
    }

    /** API token'ı; /token uç noktası bu ömrü (30 dk) kullanır. */
    public String issueAccessToken(String subject) {
        return issue(subject, accessTokenTtl);
    }

    /** subject ve exp = now + ttl içeren imzalı token. */
    public String issue(String subject, Duration ttl) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(subject)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiryOf(now, ttl)))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    /** İmza ve süreyi kontrol eder, subject'i döner. now >= exp ise geçersiz. */
    public String validate(String token) throws InvalidTokenException {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty");
        }

        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new InvalidTokenException("Could not validate token", e);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new InvalidTokenException("Token has no subject");
        }
        Date expiration = claims.getExpiration();
        if (expiration == null || !clock.instant().isBefore(expiration.toInstant())) {
            throw new InvalidTokenException("Token expired");
        }
        return subject;
    }

    /** JWT exp saniye çözünürlüğünde; küsurlu süre bir üst saniyeye yuvarlanır, token now + ttl'den önce düşmez. */
    static Instant expiryOf(Instant issuedAt, Duration ttl) {
        Instant expiry = issuedAt.plus(ttl);
        Instant wholeSeconds = expiry.truncatedTo(ChronoUnit.SECONDS);
        return wholeSeconds.equals(expiry) ? expiry : wholeSeconds.plusSeconds(1);
    }
}
