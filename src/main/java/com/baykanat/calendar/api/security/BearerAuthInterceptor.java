package com.baykanat.calendar.api.security;

import com.baykanat.calendar.domain.model.User;
import com.baykanat.calendar.domain.service.AuthGate;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/** Admin uçlarında Authorization: Bearer zorunlu; doğrulanamazsa istek controller'a ulaşmaz. */
@Slf4j
@Component
@RequiredArgsConstructor
public class BearerAuthInterceptor implements HandlerInterceptor {

    private final AuthGate authGate;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        User user = authGate.requireBearer(request.getHeader(HttpHeaders.AUTHORIZATION));
        log.debug("Admin request {} {} by username={}", request.getMethod(), request.getRequestURI(), user.getUsername());
        return true;
    }
}
