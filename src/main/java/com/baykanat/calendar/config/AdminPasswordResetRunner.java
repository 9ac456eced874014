package com.baykanat.calendar.config;

import com.baykanat.calendar.domain.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * --reset-admin-username=&lt;u&gt; --reset-admin-password=&lt;p&gt; ile başlatılırsa kullanıcının parolasını
 * günceller, kullanıcı yoksa oluşturur.
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class AdminPasswordResetRunner implements ApplicationRunner {

    static final String USERNAME_OPTION = "reset-admin-username";
    static final String PASSWORD_OPTION = "reset-admin-password";

    private final UserService userService;

    @Override
    public void run(ApplicationArguments args) {
        boolean hasUsername = args.containsOption(USERNAME_OPTION);
        boolean hasPassword = args.containsOption(PASSWORD_OPTION);
        if (!hasUsername && !hasPassword) {
            return;
        }

        String username = singleValue(args, USERNAME_OPTION);
        String password = singleValue(args, PASSWORD_OPTION);
        if (username == null || password == null) {
            log.warn("Usage: --{}=<username> --{}=<password>", USERNAME_OPTION, PASSWORD_OPTION);
            return;
        }

        userService.changePassword(username, password);
        log.info("Admin credentials reset for username={}", username);
    }

    private static String singleValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
