package com.example.oidc_rp.config;

import com.example.oidc_rp.filter.FilterChainExceptionHandler;
import com.example.oidc_rp.filter.RateLimitFilter;
import com.example.oidc_rp.filter.SessionExpiryFilter;
import com.example.oidc_rp.service.OidcSessionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.context.SecurityContextHolderFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;

/**
 * Spring Security設定クラス
 *
 * <p>認証・認可の判定はSpring Securityの認可ルールではなく、
 * {@code @RequireLogin} / {@code @AcceptToken} のインターセプターで行います。
 * このクラスはフィルターの配置、CORS、CSRFを構成します。</p>
 *
 * <h3>フィルター順:</h3>
 * <ol>
 *   <li>FilterChainExceptionHandler - フィルター内の例外をJSONに変換</li>
 *   <li>RateLimitFilter - レート制限（rate-limit.enabled=true の場合）</li>
 *   <li>SecurityContextHolderFilter</li>
 *   <li>SessionExpiryFilter - トークン有効期限チェック（リソースサーバー専用モードでは追加しない）</li>
 * </ol>
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Autowired
    private FilterChainExceptionHandler filterChainExceptionHandler;

    @Autowired(required = false)
    private RateLimitFilter rateLimitFilter;

    @Autowired
    private OidcSessionService oidcSessionService;

    @Autowired
    private ProviderConfiguration providerConfiguration;

    /**
     * CORS許可オリジン（カンマ区切り）
     */
    @Value("${app.cors.allowed-origins}")
    private String corsAllowedOrigins;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {

        // すべてのフィルターで発生した例外をキャッチし、統一されたエラーレスポンスを返す
        http.addFilterBefore(filterChainExceptionHandler, SecurityContextHolderFilter.class);

        // 認証処理前にレート制限を実施
        if (rateLimitFilter != null) {
            http.addFilterBefore(rateLimitFilter, SecurityContextHolderFilter.class);
        }

        // ハンドラーより前にトークンの有効期限を確認
        if (!providerConfiguration.isResourceServerOnly()) {
            http.addFilterAfter(
                new SessionExpiryFilter(oidcSessionService, providerConfiguration),
                SecurityContextHolderFilter.class
            );
        }

        http
            .cors(
                cors -> cors.configurationSource(corsConfigurationSource())
            )
            // Bearerトークン保護APIはCookieを使わないためCSRF対象外
            .csrf(
                csrf -> csrf.ignoringRequestMatchers("/api/**")
            )
            .authorizeHttpRequests(
                authz -> authz.anyRequest().permitAll()
            )
            // ログアウトは AuthController で処理する
            .logout(
                logout -> logout.disable()
            );

        return http.build();
    }

    /**
     * CORS設定
     *
     * <p>許可オリジンは環境変数 <code>CORS_ALLOWED_ORIGINS</code> から読み込みます。
     * Authorizationヘッダー（Bearerトークン）の送信を許可します。</p>
     */
    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();

        String[] allowedOrigins = corsAllowedOrigins.split(",");
        configuration.setAllowedOriginPatterns(Arrays.asList(allowedOrigins));
        configuration.setAllowedMethods(
            Arrays.asList("GET", "POST", "PUT", "DELETE", "OPTIONS")
        );
        configuration.setAllowedHeaders(
            Arrays.asList("Authorization", "Content-Type", "X-CSRF-TOKEN")
        );
        configuration.setExposedHeaders(
            Arrays.asList("WWW-Authenticate")
        );
        configuration.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }
}
