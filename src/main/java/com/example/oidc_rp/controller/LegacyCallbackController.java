package com.example.oidc_rp.controller;

import com.example.oidc_rp.config.ProviderConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

/**
 * 旧コールバックURL（{@code oidc.callback-route}）の互換ルート
 *
 * <p>IdPに旧URLが登録されたままの場合に備え、クエリ文字列をそのまま付けて
 * {@code {prefix}/authorize} へリダイレクトする。</p>
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@ConditionalOnProperty(name = "oidc.resource-server-only", havingValue = "false", matchIfMissing = true)
public class LegacyCallbackController {

    private final ProviderConfiguration providerConfiguration;

    @GetMapping("${oidc.callback-route:/oidc_callback}")
    public void callback(HttpServletRequest request, HttpServletResponse response) throws IOException {
        String location = request.getContextPath() + providerConfiguration.getAuthorizePath();
        if (request.getQueryString() != null) {
            location = location + "?" + request.getQueryString();
        }

        log.warn("The {} route is deprecated, please register {} as the redirect URI at the provider",
            providerConfiguration.getCallbackRoute(), providerConfiguration.getAuthorizePath());
        response.sendRedirect(location);
    }
}
