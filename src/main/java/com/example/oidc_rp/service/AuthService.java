package com.example.oidc_rp.service;

import com.example.oidc_rp.client.OidcClient;
import com.example.oidc_rp.config.ProviderConfiguration;
import com.example.oidc_rp.exception.AuthorizationFailedException;
import com.example.oidc_rp.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.client.web.AuthorizationRequestRepository;
import org.springframework.security.oauth2.core.OAuth2AuthorizationException;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;
import org.springframework.security.oauth2.core.endpoint.OAuth2ParameterNames;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 認証サービス
 *
 * <p>ブラウザ向けの認可コードフロー（ログイン開始、コールバック、ログアウト）の
 * ビジネスロジックを提供する。IdPとの通信は {@link OidcClient} に、
 * セッション上の認証レコードは {@link OidcSessionService} に委譲する。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    /** ログイン後の遷移先を保持するセッション属性（一度だけ使用） */
    public static final String NEXT_ATTRIBUTE = "oidc_auth_next";

    static final String EXPIRED_MESSAGE = "Your session expired, please reconnect.";
    static final String LOGGED_OUT_MESSAGE = "You were successfully logged out.";

    private final OidcClient oidcClient;
    private final OidcSessionService sessionService;
    private final ProviderConfiguration providerConfiguration;
    private final AuthorizationRequestRepository<OAuth2AuthorizationRequest> authorizationRequestRepository;

    // ===========================================
    // 公開メソッド（エントリーポイント）
    // ===========================================

    /**
     * ログインを開始する
     *
     * <p>ログイン後の遷移先をセッションに保存し、新しい認可リクエストを生成して保存する。</p>
     *
     * @param next ログイン後の遷移先（安全でない場合はアプリケーションルート）
     * @return IdPの認可エンドポイントURL（state, PKCE パラメーター付き）
     */
    public String startLogin(HttpServletRequest request, HttpServletResponse response, String next) {
        HttpSession session = request.getSession(true);
        session.setAttribute(NEXT_ATTRIBUTE, safeDestination(request, next));

        String redirectUri = ServletUriComponentsBuilder.fromContextPath(request)
            .path(providerConfiguration.getAuthorizePath())
            .build()
            .toUriString();

        OAuth2AuthorizationRequest authorizationRequest = oidcClient.createAuthorizationRequest(redirectUri);
        authorizationRequestRepository.saveAuthorizationRequest(authorizationRequest, request, response);

        log.debug("Login started, redirecting to the authorization endpoint (redirect_uri={})", redirectUri);
        return authorizationRequest.getAuthorizationRequestUri();
    }

    /**
     * IdPからのコールバックを処理する
     *
     * <p>処理順:</p>
     * <ol>
     *   <li>IdPのエラー応答を確認</li>
     *   <li>保留中の認可リクエストを取り出し、stateを照合（トークン交換より前）</li>
     *   <li>認可コードをトークンに交換</li>
     *   <li>UserInfoを取得（有効な場合のみ）</li>
     *   <li>セッションIDを再生成し、トークンとプロフィールを保存</li>
     * </ol>
     *
     * @return 遷移先URL（保存された next、なければアプリケーションルート）
     * @throws AuthorizationFailedException IdPのエラー、state不一致、トークンエンドポイントのエラー
     */
    public String completeLogin(HttpServletRequest request, HttpServletResponse response) {
        String error = request.getParameter(OAuth2ParameterNames.ERROR);
        if (error != null) {
            String description = request.getParameter(OAuth2ParameterNames.ERROR_DESCRIPTION);
            log.warn("The provider returned an authorization error: {} ({})", error, description);
            throw new AuthorizationFailedException(error, description);
        }

        OAuth2AuthorizationRequest authorizationRequest =
            authorizationRequestRepository.removeAuthorizationRequest(request, response);
        if (authorizationRequest == null) {
            log.warn("No pending authorization request matches the callback state");
            throw AuthorizationFailedException.mismatchingState();
        }

        String code = request.getParameter(OAuth2ParameterNames.CODE);
        if (code == null || code.isBlank()) {
            throw new AuthorizationFailedException("invalid_request", "Missing \"code\" in the authorization response.");
        }

        Map<String, Object> token;
        try {
            token = oidcClient.exchangeCode(authorizationRequest, code);
        } catch (OAuth2AuthorizationException e) {
            OAuth2Error oauth2Error = e.getError();
            log.warn("Token exchange failed: {} ({})", oauth2Error.getErrorCode(), oauth2Error.getDescription());
            throw new AuthorizationFailedException(oauth2Error.getErrorCode(), oauth2Error.getDescription(), e);
        }

        Map<String, Object> profile = null;
        if (providerConfiguration.isUserInfoEnabled()) {
            profile = oidcClient.fetchUserInfo((String) token.get(OAuth2ParameterNames.ACCESS_TOKEN));
        }

        // セッション固定攻撃対策
        request.changeSessionId();
        HttpSession session = request.getSession();
        sessionService.store(session, token, profile);

        String next = (String) session.getAttribute(NEXT_ATTRIBUTE);
        session.removeAttribute(NEXT_ATTRIBUTE);

        log.info("User logged in (session={})", session.getId());
        return next != null ? next : applicationRoot(request);
    }

    /**
     * ログアウト
     *
     * <p>トークンとプロフィールを削除する（未ログインでも成功）。
     * セッション自体は無効化しない（フラッシュメッセージを次のリクエストに渡すため）。</p>
     *
     * @param reason "expired" の場合は期限切れメッセージ
     * @return ユーザーに表示するメッセージ
     */
    public String logout(HttpServletRequest request, String reason) {
        sessionService.clear(request.getSession(false));

        if ("expired".equals(reason)) {
            log.info("Session expired, user logged out");
            return EXPIRED_MESSAGE;
        }
        log.info("User logged out");
        return LOGGED_OUT_MESSAGE;
    }

    /**
     * ログインユーザーのプロフィールを取得する
     *
     * @throws IllegalStateException UserInfo取得が無効な場合
     * @throws UnauthorizedException 未ログインの場合
     */
    public Map<String, Object> getUserInfo(HttpServletRequest request) {
        if (!providerConfiguration.isUserInfoEnabled()) {
            throw new IllegalStateException("User info is disabled in configuration (oidc.user-info-enabled)");
        }
        HttpSession session = request.getSession(false);
        if (!sessionService.isLoggedIn(session)) {
            throw new UnauthorizedException("User was not authenticated");
        }
        return sessionService.getProfile(session);
    }

    /**
     * ログアウトルートへのリダイレクト先を生成する
     *
     * @param returnTo ログアウト後の遷移先（null の場合はアプリケーションルート）
     * @return {@code {prefix}/logout?next=...}
     */
    public String logoutRedirect(HttpServletRequest request, String returnTo) {
        String next = (returnTo == null || returnTo.isBlank()) ? applicationRoot(request) : returnTo;
        return UriComponentsBuilder.fromPath(providerConfiguration.getLogoutPath())
            .queryParam("next", next)
            .build()
            .toUriString();
    }

    /**
     * 遷移先として安全であれば destination、そうでなければアプリケーションルートを返す
     */
    public String safeDestination(HttpServletRequest request, String destination) {
        if (destination != null && !destination.isBlank() && isUrlSafe(request, destination)) {
            return destination;
        }
        if (destination != null && !destination.isBlank()) {
            log.warn("Rejected unsafe redirect destination: {}", destination);
        }
        return applicationRoot(request);
    }

    // ===========================================
    // プライベートメソッド
    // ===========================================

    private String applicationRoot(HttpServletRequest request) {
        return ServletUriComponentsBuilder.fromContextPath(request).path("/").build().toUriString();
    }

    /**
     * URLが安全なリダイレクト先であるかを検証する
     *
     * <ul>
     *   <li>ホストを持たない相対パス（例: /dashboard）は安全（ただし //host 形式は除く）</li>
     *   <li>リクエストと同じホスト、または {@code oidc.allowed-redirect-hosts} のホストは安全</li>
     * </ul>
     */
    boolean isUrlSafe(HttpServletRequest request, String url) {
        try {
            // プロトコル相対URL（//evil.example.com）やバックスラッシュ混入は拒否
            if (url.startsWith("//") || url.contains("\\")) {
                return false;
            }

            URI redirectUri = new URI(url);
            if (redirectUri.getHost() == null) {
                return redirectUri.getScheme() == null;
            }

            String scheme = redirectUri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                return false;
            }

            Set<String> allowedHosts = new HashSet<>(providerConfiguration.getAllowedRedirectHosts());
            allowedHosts.add(request.getServerName());
            return allowedHosts.contains(redirectUri.getHost());

        } catch (URISyntaxException e) {
            // 不正な形式のURLは危険とみなす
            return false;
        }
    }
}
