package com.example.oidc_rp.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.security.oauth2.client.web.AuthorizationRequestRepository;
import org.springframework.security.oauth2.client.web.HttpSessionOAuth2AuthorizationRequestRepository;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;

import java.time.Clock;

/**
 * OIDCリライングパーティ設定クラス
 *
 * <p>起動時に設定を検証し、不変の {@link ProviderConfiguration} を構築する。
 * 致命的な設定エラーがある場合はここで起動が中断される。</p>
 */
@Configuration
@EnableConfigurationProperties(OidcProperties.class)
public class OidcConfig {

    @Bean
    public ProviderConfiguration providerConfiguration(
        ProviderConfigurationLoader loader,
        OidcProperties properties,
        Environment environment
    ) {
        return loader.load(properties, environment);
    }

    /**
     * トークン有効期限判定に使用する時計
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 保留中の認可リクエスト（state, PKCE code_verifier）の保存先
     *
     * <p>HTTPセッションに保存し、コールバック時に一度だけ取り出す。
     * stateが一致しない場合は取り出せない（null）。</p>
     */
    @Bean
    public AuthorizationRequestRepository<OAuth2AuthorizationRequest> authorizationRequestRepository() {
        return new HttpSessionOAuth2AuthorizationRequestRepository();
    }
}
