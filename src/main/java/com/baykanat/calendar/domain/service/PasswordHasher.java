package com.baykanat.calendar.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/** Parola hash'leme ve doğrulama. Hash tuz ve parametreleri kendi içinde taşır. */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;

    /** Her çağrıda rastgele tuz; aynı girdi için farklı sonuç döner. */
    public String hash(String password) {
        return passwordEncoder.encode(password);
    }

    /** Bozuk ya da boş hash için exception değil false döner. */
    public boolean verify(String plain, String hash) {
        if (plain == null || hash == null || hash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plain, hash);
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            log.warn("Stored password hash could not be decoded: {}", e.getMessage());
            return false;
        }
    }
}
