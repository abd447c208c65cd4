package com.example.oidc_rp.filter;

import com.example.oidc_rp.config.ProviderConfiguration;
import com.example.oidc_rp.service.OidcSessionService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * セッション有効期限フィルター
 *
 * <p>すべてのリクエストでハンドラーより前にトークンの有効期限を確認し、
 * 期限切れの場合は {@code {prefix}/logout?reason=expired} にリダイレクトする。</p>
 *
 * <p>ログアウトルート自体は対象外（期限切れトークンの削除はログアウトで行うため）。
 * リソースサーバー専用モードではフィルターチェーンに追加されない。</p>
 *
 * <p>トークンが破損している場合は {@link com.example.oidc_rp.exception.SessionCorruptedException} がスローされ、
 * {@link FilterChainExceptionHandler} で500に変換される。</p>
 */
@Slf4j
@RequiredArgsConstructor
public class SessionExpiryFilter extends OncePerRequestFilter {

    private final OidcSessionService sessionService;
    private final ProviderConfiguration providerConfiguration;

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        Optional<String> redirect = sessionService.checkExpiry(request.getSession(false));
        if (redirect.isPresent()) {
            log.info("Session token expired on {}, redirecting to logout", request.getRequestURI());
            response.sendRedirect(request.getContextPath() + redirect.get());
            return;
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return path.equals(providerConfiguration.getLogoutPath());
    }
}
