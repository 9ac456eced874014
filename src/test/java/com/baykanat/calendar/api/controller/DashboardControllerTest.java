package com.baykanat.calendar.api.controller;

import com.baykanat.calendar.domain.model.Month;
import com.baykanat.calendar.domain.model.User;
import com.baykanat.calendar.domain.service.AuthGate;
import com.baykanat.calendar.domain.service.CalendarService;
import com.baykanat.calendar.domain.service.TokenService;
import com.baykanat.calendar.domain.service.UserService;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for DashboardController.
 *
 * <p>Covers the cookie session flow:
 * <ul>
 *   <li>Login sets an HttpOnly cookie and redirects with 303</li>
 *   <li>Anonymous visitors are redirected to /login</li>
 *   <li>Templates render the month data</li>
 * </ul>
 */
@WebMvcTest(DashboardController.class)
class DashboardControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AuthGate authGate;

    @MockitoBean
    private UserService userService;

    @MockitoBean
    private TokenService tokenService;

    @MockitoBean
    private CalendarService calendarService;

    private static final User ADMIN = User.builder().id(1L).username("admin").build();

    @Test
    @DisplayName("GET / - redirects to the dashboard")
    void rootRedirects() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/dashboard"));
    }

    @Test
    @DisplayName("GET /login - renders the login form")
    void loginPage() throws Exception {
        mockMvc.perform(get("/login"))
                .andExpect(status().isOk())
                .andExpect(view().name("login"));
    }

    @Test
    @DisplayName("POST /login - valid credentials set the session cookie and redirect with 303")
    void loginSuccess() throws Exception {
        when(userService.authenticate("admin", "password123")).thenReturn(Optional.of(ADMIN));
        when(tokenService.issue("admin")).thenReturn("jwt-value");

        mockMvc.perform(post("/login").param("username", "admin").param("password", "password123"))
                .andExpect(status().isSeeOther())
                .andExpect(redirectedUrl("/dashboard"))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, allOf(
                        containsString("access_token=Bearer%20jwt-value"),
                        containsString("HttpOnly"),
                        containsString("Path=/"))));
    }

    @Test
    @DisplayName("POST /login - invalid credentials re-render the form with an error")
    void loginFailure() throws Exception {
        when(userService.authenticate("admin", "nope")).thenReturn(Optional.empty());

        mockMvc.perform(post("/login").param("username", "admin").param("password", "nope"))
                .andExpect(status().isOk())
                .andExpect(view().name("login"))
                .andExpect(model().attribute("error", "Invalid credentials"))
                .andExpect(content().string(containsString("Invalid credentials")))
                .andExpect(header().doesNotExist(HttpHeaders.SET_COOKIE));
    }

    @Test
    @DisplayName("GET /logout - clears the cookie and redirects to /login")
    void logout() throws Exception {
        mockMvc.perform(get("/logout"))
                .andExpect(status().isSeeOther())
                .andExpect(redirectedUrl("/login"))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, allOf(
                        containsString("access_token="),
                        containsString("Max-Age=0"))));
    }

    @Test
    @DisplayName("GET /dashboard - anonymous visitor is redirected to /login")
    void dashboardAnonymous() throws Exception {
        when(authGate.resolveCookie(any())).thenReturn(Optional.empty());

        mockMvc.perform(get("/dashboard"))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/login"));

        verify(calendarService, never()).listMonths(anyInt(), anyInt());
    }

    @Test
    @DisplayName("GET /dashboard - signed-in user sees the month table")
    void dashboardRendersMonths() throws Exception {
        when(authGate.resolveCookie("Bearer jwt-value")).thenReturn(Optional.of(ADMIN));
        when(calendarService.listMonths(0, 100)).thenReturn(List.of(
                Month.builder().id(1L).monthBn("বৈশাখ").monthEn("Baishakh").build()));

        mockMvc.perform(get("/dashboard").cookie(new Cookie("access_token", "Bearer%20jwt-value")))
                .andExpect(status().isOk())
                .andExpect(view().name("dashboard"))
                .andExpect(content().string(containsString("Baishakh")))
                .andExpect(content().string(containsString("/dashboard/months/1")));
    }

    @Test
    @DisplayName("GET /dashboard/months/{id} - unknown month redirects back to the dashboard")
    void monthDetailUnknown() throws Exception {
        when(authGate.resolveCookie("Bearer jwt-value")).thenReturn(Optional.of(ADMIN));
        when(calendarService.getMonth(9L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/dashboard/months/9").cookie(new Cookie("access_token", "Bearer%20jwt-value")))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/dashboard"));
    }

    @Test
    @DisplayName("GET /dashboard/months/{id} - renders the month detail page")
    void monthDetail() throws Exception {
        when(authGate.resolveCookie("Bearer jwt-value")).thenReturn(Optional.of(ADMIN));
        when(calendarService.getMonth(1L)).thenReturn(Optional.of(
                Month.builder().id(1L).monthBn("বৈশাখ").monthEn("Baishakh").build()));

        mockMvc.perform(get("/dashboard/months/1").cookie(new Cookie("access_token", "Bearer%20jwt-value")))
                .andExpect(status().isOk())
                .andExpect(view().name("month_detail"))
                .andExpect(model().attributeExists("month"));
    }
}
