package com.example.oidc_rp.config;

import com.example.oidc_rp.dto.ClientSecrets;
import com.example.oidc_rp.exception.OidcConfigurationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * IdP接続設定のローダー
 *
 * <p>{@link OidcProperties} とクライアントシークレットから {@link ProviderConfiguration} を構築する。
 * 構築前に検証を行い、致命的エラーと警告（非致命）を分けて扱う。</p>
 *
 * <h3>検証内容:</h3>
 * <ul>
 *   <li><b>削除済みキー</b>: 設定されていれば起動失敗</li>
 *   <li><b>非推奨キー</b>: WARNログを出力して無視</li>
 *   <li><b>スコープ</b>: "openid" を含まなければ起動失敗（リスト指定は警告して受け入れる）</li>
 *   <li><b>クライアント認証方式</b>: サポート外の値は起動失敗</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderConfigurationLoader {

    static final List<String> REMOVED_KEYS = List.of(
        "oidc.google-apps-domain",
        "oidc.require-verified-email",
        "oidc.resource-check-aud",
        "oidc.valid-issuers"
    );

    static final List<String> DEPRECATED_KEYS = List.of(
        "oidc.id-token-cookie-name",
        "oidc.id-token-cookie-path",
        "oidc.id-token-cookie-ttl",
        "oidc.cookie-secure",
        "oidc.openid-realm",
        "oidc.overwrite-redirect-uri",
        "oidc.userinfo-url"
    );

    static final String CALLBACK_ROUTE_KEY = "oidc.callback-route";

    static final Set<String> SUPPORTED_AUTH_METHODS = Set.of(
        "client_secret_post",
        "client_secret_basic",
        "none"
    );

    private static final String METADATA_PATH = "/.well-known/openid-configuration";

    private final ClientSecretsLoader clientSecretsLoader;

    /**
     * 設定を検証し、不変のIdP接続設定を構築する
     *
     * @param properties バインド済みプロパティ
     * @param environment 削除済み・非推奨キーの検出に使用
     * @return IdP接続設定
     * @throws OidcConfigurationException 致命的な設定エラーがある場合
     */
    public ProviderConfiguration load(OidcProperties properties, Environment environment) {
        ValidationReport report = validate(properties, environment);
        report.getAdvisories().forEach(advisory -> log.warn("Configuration advisory: {}", advisory));
        if (report.hasErrors()) {
            report.getErrors().forEach(error -> log.error("Configuration error: {}", error));
            throw new OidcConfigurationException(String.join("; ", report.getErrors()));
        }

        ClientSecrets secrets = clientSecretsLoader.load(properties.getClientSecrets());
        String issuer = trimTrailingSlash(secrets.getIssuer());

        ProviderConfiguration configuration = ProviderConfiguration.builder()
            .issuer(issuer)
            .clientId(defaultIfBlank(properties.getClientId(), secrets.getClientId()))
            .clientSecret(defaultIfBlank(properties.getClientSecret(), secrets.getClientSecret()))
            .scopes(normalizeScopes(properties.getScopes()))
            .clockSkew(properties.getClockSkew())
            .userInfoEnabled(properties.isUserInfoEnabled())
            .resourceServerOnly(properties.isResourceServerOnly())
            .introspectionAuthMethod(properties.getIntrospectionAuthMethod())
            .callbackRoute(properties.getCallbackRoute())
            .serverMetadataUrl(defaultIfBlank(properties.getServerMetadataUrl(), issuer + METADATA_PATH))
            .httpTimeout(properties.getHttpTimeout())
            .routePrefix(trimTrailingSlash(properties.getPrefix() == null ? "" : properties.getPrefix().trim()))
            .allowedRedirectHosts(properties.getAllowedRedirectHosts())
            .build();

        log.info("OIDC relying party configured: issuer={}, clientId={}, scopes='{}', resourceServerOnly={}",
            configuration.getIssuer(), configuration.getClientId(), configuration.getScopes(),
            configuration.isResourceServerOnly());
        return configuration;
    }

    /**
     * 設定の検証のみを行う（例外はスローしない）
     */
    public ValidationReport validate(OidcProperties properties, Environment environment) {
        ValidationReport report = new ValidationReport();

        for (String key : REMOVED_KEYS) {
            if (environment.containsProperty(key)) {
                report.error("The '" + key + "' configuration value is no longer enforced.");
            }
        }
        for (String key : DEPRECATED_KEYS) {
            if (environment.containsProperty(key)) {
                report.advise("The '" + key + "' configuration value is deprecated and ignored.");
            }
        }
        if (environment.containsProperty(CALLBACK_ROUTE_KEY)) {
            report.advise("The '" + CALLBACK_ROUTE_KEY + "' configuration value is deprecated, "
                + "the callback is now served by the authorize route.");
        }

        // 単一文字列もカンマ区切りで分割されるため、要素が複数ならリスト指定とみなす
        List<String> scopes = properties.getScopes();
        if (scopes != null && scopes.size() > 1) {
            report.advise("A list value for 'oidc.scopes' is deprecated, use a space-separated string.");
        }
        if (scopes == null || !Arrays.asList(normalizeScopes(scopes).split(" ")).contains("openid")) {
            report.error("The value \"openid\" must be in oidc.scopes");
        }

        String authMethod = properties.getIntrospectionAuthMethod();
        if (authMethod == null || !SUPPORTED_AUTH_METHODS.contains(authMethod)) {
            report.error("Unsupported oidc.introspection-auth-method: " + authMethod);
        }

        if (properties.getCallbackRoute() == null || !properties.getCallbackRoute().startsWith("/")) {
            report.error("oidc.callback-route must start with '/'");
        }

        if (properties.getClockSkew() == null || properties.getClockSkew().isNegative()) {
            report.error("oidc.clock-skew must not be negative");
        }

        if (properties.getHttpTimeout() == null || properties.getHttpTimeout().isZero()
            || properties.getHttpTimeout().isNegative()) {
            report.error("oidc.http-timeout must be positive");
        }

        return report;
    }

    /**
     * リスト・空白区切りのスコープを単一スペース区切りに正規化する
     */
    static String normalizeScopes(List<String> scopes) {
        return String.join(" ", String.join(" ", scopes).trim().split("\\s+")).trim();
    }

    private static String defaultIfBlank(String value, String defaultValue) {
        return (value == null || value.isBlank()) ? defaultValue : value;
    }

    private static String trimTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    /**
     * 検証結果（致命的エラーと警告）
     */
    @Getter
    public static class ValidationReport {

        private final List<String> errors = new ArrayList<>();
        private final List<String> advisories = new ArrayList<>();

        void error(String message) {
            errors.add(message);
        }

        void advise(String message) {
            advisories.add(message);
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }
}
