package com.example.oidc_rp.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * OIDCリライングパーティの設定プロパティ
 *
 * <p>{@code oidc.*} をバインドする。起動時に {@link ProviderConfigurationLoader} で検証され、
 * 不変の {@link ProviderConfiguration} に変換される。以降このクラスは参照しないこと。</p>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "oidc")
public class OidcProperties {

    /**
     * クライアントシークレットの取得元
     *
     * <p>インラインJSON、ファイルパス、または {@code classpath:} リソースを指定する。</p>
     * <pre>{"web": {"client_id": "...", "client_secret": "...", "issuer": "https://idp.example.com"}}</pre>
     */
    @NotBlank(message = "oidc.client-secrets is required")
    private String clientSecrets;

    /**
     * 未指定の場合はクライアントシークレットの値を使用
     */
    private String clientId;

    /**
     * 未指定の場合はクライアントシークレットの値を使用
     */
    private String clientSecret;

    /**
     * 要求するスコープ（スペース区切り）。"openid" を必ず含むこと。
     *
     * <p>YAMLのリストも受け付けるため {@link List} でバインドする。</p>
     */
    private List<String> scopes = new ArrayList<>(List.of("openid profile email"));

    /**
     * 認可コード交換後にUserInfoエンドポイントからプロフィールを取得するか
     */
    private boolean userInfoEnabled = true;

    /**
     * トークンエンドポイント・イントロスペクションエンドポイントでのクライアント認証方式
     */
    private String introspectionAuthMethod = "client_secret_post";

    /**
     * トークン有効期限の許容誤差（秒）
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration clockSkew = Duration.ofSeconds(60);

    /**
     * trueの場合、ブラウザ向けルートと有効期限チェックを無効化する（API専用モード）
     */
    private boolean resourceServerOnly = false;

    /**
     * 旧コールバックパス（{@code /authorize} へ転送される）
     */
    private String callbackRoute = "/oidc_callback";

    /**
     * Discoveryドキュメントの URL。未指定の場合は issuer から導出する。
     */
    private String serverMetadataUrl;

    /**
     * login / authorize / logout ルートのプレフィックス
     */
    private String prefix = "";

    /**
     * ログイン後・ログアウト後のリダイレクトを許可する外部ホスト
     */
    private List<String> allowedRedirectHosts = new ArrayList<>();

    /**
     * IdPとの通信タイムアウト（秒）
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration httpTimeout = Duration.ofSeconds(10);
}
