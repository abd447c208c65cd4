package com.example.oidc_rp.interceptor;

import com.example.oidc_rp.config.ProviderConfiguration;
import com.example.oidc_rp.exception.UnauthorizedException;
import com.example.oidc_rp.service.OidcSessionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * {@link RequireLogin} を処理するインターセプター
 *
 * <p>未ログインの場合はログインルートにリダイレクトする。
 * リソースサーバー専用モードではログインルートが存在しないため401とする。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoginRequiredInterceptor implements HandlerInterceptor {

    private final OidcSessionService sessionService;
    private final ProviderConfiguration providerConfiguration;

    @Override
    public boolean preHandle(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull Object handler
    ) throws Exception {
        if (!(handler instanceof HandlerMethod handlerMethod) || !requiresLogin(handlerMethod)) {
            return true;
        }
        if (sessionService.isLoggedIn(request.getSession(false))) {
            return true;
        }

        if (providerConfiguration.isResourceServerOnly()) {
            throw new UnauthorizedException("User was not authenticated");
        }

        String here = currentUrl(request);
        String location = request.getContextPath() + providerConfiguration.getLoginPath()
            + "?next=" + URLEncoder.encode(here, StandardCharsets.UTF_8);
        log.debug("Login required for {}, redirecting to {}", here, location);
        response.sendRedirect(location);
        return false;
    }

    private boolean requiresLogin(HandlerMethod handlerMethod) {
        return handlerMethod.hasMethodAnnotation(RequireLogin.class)
            || AnnotatedElementUtils.hasAnnotation(handlerMethod.getBeanType(), RequireLogin.class);
    }

    private String currentUrl(HttpServletRequest request) {
        StringBuffer url = request.getRequestURL();
        if (request.getQueryString() != null) {
            url.append('?').append(request.getQueryString());
        }
        return url.toString();
    }
}
