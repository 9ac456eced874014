package com.baykanat.calendar.domain.service;

import com.baykanat.calendar.domain.exception.UsernameTakenException;
import com.baykanat.calendar.domain.model.User;
import com.baykanat.calendar.infrastructure.persistence.UserJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/** Kullanıcı okuma, oluşturma, parola doğrulama ve parola değiştirme. */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserJdbcRepository userRepository;
    private final PasswordHasher passwordHasher;

    public Optional<User> findByUsername(String username) {
        return userRepository.findByUsername(username);
    }

    /** Yeni kullanıcı; username zaten varsa UsernameTakenException. */
    @Transactional
    public User createUser(String username, String password) {
        try {
            User user = userRepository.insert(username, passwordHasher.hash(password));
            log.info("Created user: username={}", username);
            return user;
        } catch (DuplicateKeyException e) {
            throw new UsernameTakenException(username, e);
        }
    }

    /** Kullanıcı adı ve parola eşleşirse kullanıcıyı döner. */
    public Optional<User> authenticate(String username, String password) {
        if (username == null || username.isBlank()) {
            return Optional.empty();
        }
        Optional<User> user = userRepository.findByUsername(username)
                .filter(u -> passwordHasher.verify(password, u.getPasswordHash()));
        if (user.isEmpty()) {
            log.info("Failed login attempt for username={}", username);
        }
        return user;
    }

    /** Var olan kullanıcının parolasını günceller, yoksa bu parolayla oluşturur. */
    @Transactional
    public User changePassword(String username, String newPassword) {
        String hash = passwordHasher.hash(newPassword);
        int updated = userRepository.updatePasswordHash(username, hash);
        if (updated > 0) {
            log.info("Password updated for user: username={}", username);
            return userRepository.findByUsername(username).orElseThrow();
        }
        log.info("User {} not found, creating it", username);
        return createUser(username, newPassword);
    }
}
