package com.example.oidc_rp.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * IdP接続設定（起動時に一度だけ構築される不変オブジェクト）
 *
 * <p>各リクエスト処理コンポーネントにはこのBeanを注入して使用する。
 * 可変の {@link OidcProperties} を直接参照しないこと。</p>
 */
@Value
@Builder
public class ProviderConfiguration {

    String issuer;

    String clientId;

    String clientSecret;

    /**
     * スペース区切りのスコープ文字列
     */
    String scopes;

    Duration clockSkew;

    boolean userInfoEnabled;

    boolean resourceServerOnly;

    String introspectionAuthMethod;

    String callbackRoute;

    String serverMetadataUrl;

    /**
     * IdPへのHTTP呼び出しのタイムアウト（接続・読み込み・書き込み共通）
     */
    Duration httpTimeout;

    /**
     * 末尾スラッシュなしのルートプレフィックス（空文字可）
     */
    String routePrefix;

    @Singular
    List<String> allowedRedirectHosts;

    public Set<String> getScopeSet() {
        return new LinkedHashSet<>(Arrays.asList(scopes.trim().split("\\s+")));
    }

    public String getLoginPath() {
        return routePrefix + "/login";
    }

    public String getAuthorizePath() {
        return routePrefix + "/authorize";
    }

    public String getLogoutPath() {
        return routePrefix + "/logout";
    }
}
