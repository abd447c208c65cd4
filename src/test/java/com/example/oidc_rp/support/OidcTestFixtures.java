package com.example.oidc_rp.support;

import com.example.oidc_rp.config.ProviderConfiguration;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;
import org.springframework.security.oauth2.core.endpoint.OAuth2ParameterNames;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * テスト用のデータ生成ヘルパー
 */
public final class OidcTestFixtures {

    public static final String ISSUER = "https://test/openidc";
    public static final String AUTHORIZATION_ENDPOINT = ISSUER + "/Authorization";
    public static final String REDIRECT_URI = "http://localhost/authorize";

    private OidcTestFixtures() {
    }

    /**
     * テスト用のIdP接続設定ビルダー（デフォルト値設定済み）
     */
    public static ProviderConfiguration.ProviderConfigurationBuilder providerConfiguration() {
        return ProviderConfiguration.builder()
            .issuer(ISSUER)
            .clientId("MyClient")
            .clientSecret("MySecret")
            .scopes("openid profile email")
            .clockSkew(Duration.ofSeconds(60))
            .userInfoEnabled(true)
            .resourceServerOnly(false)
            .introspectionAuthMethod("client_secret_post")
            .callbackRoute("/oidc_callback")
            .serverMetadataUrl(ISSUER + "/.well-known/openid-configuration")
            .httpTimeout(Duration.ofSeconds(5))
            .routePrefix("");
    }

    /**
     * セッションに保存されるトークンレコード
     */
    public static Map<String, Object> token(long expiresAt) {
        Map<String, Object> token = new LinkedHashMap<>();
        token.put("access_token", "dummy_access_token");
        token.put("refresh_token", "dummy_refresh_token");
        token.put("token_type", "Bearer");
        token.put("id_token", "dummy_id_token");
        token.put("expires_in", 3600L);
        token.put("expires_at", expiresAt);
        return token;
    }

    /**
     * 1時間後に期限切れとなるトークンレコード
     */
    public static Map<String, Object> validToken() {
        return token(Instant.now().plusSeconds(3600).getEpochSecond());
    }

    /**
     * 指定したstateの認可リクエスト
     */
    public static OAuth2AuthorizationRequest authorizationRequest(String state) {
        return OAuth2AuthorizationRequest.authorizationCode()
            .authorizationUri(AUTHORIZATION_ENDPOINT)
            .clientId("MyClient")
            .redirectUri(REDIRECT_URI)
            .scopes(Set.of("openid", "profile", "email"))
            .state(state)
            .attributes(attributes -> attributes.put(OAuth2ParameterNames.REGISTRATION_ID, "oidc"))
            .build();
    }
}
