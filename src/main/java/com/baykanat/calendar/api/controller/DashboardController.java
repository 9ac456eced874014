package com.baykanat.calendar.api.controller;

import com.baykanat.calendar.domain.model.Month;
import com.baykanat.calendar.domain.model.User;
import com.baykanat.calendar.domain.service.AuthGate;
import com.baykanat.calendar.domain.service.CalendarService;
import com.baykanat.calendar.domain.service.TokenService;
import com.baykanat.calendar.domain.service.UserService;
import io.swagger.v3.oas.annotations.Hidden;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.view.RedirectView;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/** Cookie oturumlu HTML dashboard: giriş/çıkış, ay listesi, ay detayı. Oturum yoksa /login'e yönlendirir. */
@Slf4j
@Hidden
@Controller
@RequiredArgsConstructor
public class DashboardController {

    private static final int DASHBOARD_MONTH_LIMIT = 100;

    private final AuthGate authGate;
    private final UserService userService;
    private final TokenService tokenService;
    private final CalendarService calendarService;

    @GetMapping("/")
    public ModelAndView root() {
        return new ModelAndView(new RedirectView("/dashboard"));
    }

    @GetMapping("/login")
    public String loginPage() {
        return "login";
    }

    /** Başarılıysa 303 ile /dashboard ve HttpOnly cookie; değilse login sayfası hata mesajıyla. */
    @PostMapping("/login")
    public ModelAndView loginSubmit(@RequestParam(value = "username", required = false) String username,
                                    @RequestParam(value = "password", required = false) String password,
                                    HttpServletResponse response) {
        Optional<User> user = userService.authenticate(username, password);
        if (user.isEmpty()) {
            ModelAndView page = new ModelAndView("login");
            page.addObject("error", "Invalid credentials");
            return page;
        }

        String token = tokenService.issue(user.get().getUsername());
        // Cookie değeri boşluk içeremez; URL encode edilir, @CookieValue okurken geri çözer.
        ResponseCookie cookie = ResponseCookie.from(AuthGate.SESSION_COOKIE,
                        UriUtils.encode(AuthGate.BEARER_PREFIX + token, StandardCharsets.UTF_8))
                .httpOnly(true)
                .path("/")
                .sameSite("Lax")
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
        log.info("Dashboard login: username={}", user.get().getUsername());
        return seeOther("/dashboard");
    }

    @GetMapping("/logout")
    public ModelAndView logout(HttpServletResponse response) {
        ResponseCookie cookie = ResponseCookie.from(AuthGate.SESSION_COOKIE, "")
                .httpOnly(true)
                .path("/")
                .maxAge(0)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
        return seeOther("/login");
    }

    @GetMapping("/dashboard")
    public String dashboard(@CookieValue(value = AuthGate.SESSION_COOKIE, required = false) String session,
                            Model model) {
        Optional<User> user = authGate.resolveCookie(session);
        if (user.isEmpty()) {
            return "redirect:/login";
        }

        List<Month> months = calendarService.listMonths(0, DASHBOARD_MONTH_LIMIT);
        model.addAttribute("user", user.get());
        model.addAttribute("months", months);
        return "dashboard";
    }

    @GetMapping("/dashboard/months/{monthId}")
    public String monthDetail(@PathVariable("monthId") long monthId,
                              @CookieValue(value = AuthGate.SESSION_COOKIE, required = false) String session,
                              Model model) {
        Optional<User> user = authGate.resolveCookie(session);
        if (user.isEmpty()) {
            return "redirect:/login";
        }

        Optional<Month> month = calendarService.getMonth(monthId);
        if (month.isEmpty()) {
            return "redirect:/dashboard";
        }
        model.addAttribute("user", user.get());
        model.addAttribute("month", month.get());
        return "month_detail";
    }

    private static ModelAndView seeOther(String url) {
        RedirectView view = new RedirectView(url);
        view.setStatusCode(HttpStatus.SEE_OTHER);
        return new ModelAndView(view);
    }
}
