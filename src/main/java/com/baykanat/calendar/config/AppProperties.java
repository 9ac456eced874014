package com.baykanat.calendar.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/** app.* için tip güvenli configuration (token imzalama, varsayılan admin, seed verisi). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private SecurityProperties security = new SecurityProperties();
    private AdminProperties admin = new AdminProperties();
    private SeedProperties seed = new SeedProperties();

    @Getter
    @Setter
    public static class SecurityProperties {
        /** HS256 imzalama anahtarı; değişirse verilmiş tüm token'lar geçersiz olur. */
        private String secret;
        /** /token uç noktasının verdiği token ömrü. */
        private Duration accessTokenTtl = Duration.ofMinutes(30);
        /** Süre verilmeden üretilen token'ların ömrü (dashboard girişi). */
        private Duration defaultTokenTtl = Duration.ofMinutes(15);
    }

    @Getter
    @Setter
    public static class AdminProperties {
        private String username = "admin";
        private String password = "password123";
    }

    @Getter
    @Setter
    public static class SeedProperties {
        private boolean enabled = true;
        /** Spring resource yolu, ör. classpath:seed/calendar.json. */
        private String location = "classpath:seed/calendar.json";
    }
}
