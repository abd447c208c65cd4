package com.example.oidc_rp.service;

import com.example.oidc_rp.config.ProviderConfiguration;
import com.example.oidc_rp.exception.SessionCorruptedException;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * セッション認証状態サービス
 *
 * <p>HTTPセッションに保存されたトークン（{@value #TOKEN_ATTRIBUTE}）と
 * プロフィール（{@value #PROFILE_ATTRIBUTE}）を管理します。</p>
 *
 * <h3>状態遷移:</h3>
 * <pre>
 * ANONYMOUS → (ログイン開始) → PENDING_CALLBACK → (コールバック成功) → AUTHENTICATED
 * AUTHENTICATED → (ログアウト / 期限切れ) → ANONYMOUS
 * </pre>
 *
 * <p>期限切れの検出（{@link #checkExpiry}）はリダイレクト先を返すだけで、
 * セッションの削除はログアウト処理で行います。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OidcSessionService {

    public static final String TOKEN_ATTRIBUTE = "oidc_auth_token";
    public static final String PROFILE_ATTRIBUTE = "oidc_auth_profile";

    static final String EXPIRES_AT = "expires_at";

    private final ProviderConfiguration providerConfiguration;
    private final Clock clock;

    /**
     * ログイン状態の判定（トークンが存在すればログイン済み）
     */
    public boolean isLoggedIn(HttpSession session) {
        return session != null && session.getAttribute(TOKEN_ATTRIBUTE) != null;
    }

    /**
     * トークンの有効期限チェック
     *
     * <p>{@code now + clockSkew >= expires_at} の場合、期限切れとしてログアウトへのリダイレクト先を返します。</p>
     *
     * @param session HTTPセッション（null可）
     * @return 期限切れの場合は {@code {prefix}/logout?reason=expired}、それ以外は空
     * @throws SessionCorruptedException トークンが読み取れない場合（トークンとプロフィールは削除済み）
     */
    public Optional<String> checkExpiry(HttpSession session) {
        if (session == null) {
            return Optional.empty();
        }
        Object token = session.getAttribute(TOKEN_ATTRIBUTE);
        if (token == null) {
            return Optional.empty();
        }

        try {
            long expiresAt = readExpiresAt(token);
            long now = clock.instant().getEpochSecond();
            if (now + providerConfiguration.getClockSkew().getSeconds() >= expiresAt) {
                log.debug("Session token expired: expires_at={}, now={}", expiresAt, now);
                return Optional.of(providerConfiguration.getLogoutPath() + "?reason=expired");
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Could not check token expiration, purging the session authentication record", e);
            clear(session);
            throw new SessionCorruptedException(e);
        }
    }

    /**
     * アクセストークンを取得（未ログインの場合は null）
     */
    public String getAccessToken(HttpSession session) {
        return getTokenValue(session, "access_token");
    }

    /**
     * リフレッシュトークンを取得（未ログインまたはIdPが発行していない場合は null）
     */
    public String getRefreshToken(HttpSession session) {
        return getTokenValue(session, "refresh_token");
    }

    /**
     * UserInfoのクレームを取得（存在しない場合は空のMap）
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getProfile(HttpSession session) {
        if (session == null) {
            return Collections.emptyMap();
        }
        Object profile = session.getAttribute(PROFILE_ATTRIBUTE);
        if (profile instanceof Map) {
            return (Map<String, Object>) profile;
        }
        return Collections.emptyMap();
    }

    /**
     * ログイン成功時にトークンとプロフィールを保存
     *
     * @param profile UserInfoのクレーム（UserInfo取得が無効な場合は null）
     */
    public void store(HttpSession session, Map<String, Object> token, Map<String, Object> profile) {
        session.setAttribute(TOKEN_ATTRIBUTE, token);
        if (profile != null) {
            session.setAttribute(PROFILE_ATTRIBUTE, profile);
        } else {
            session.removeAttribute(PROFILE_ATTRIBUTE);
        }
    }

    /**
     * トークンとプロフィールを削除（未ログインでも安全に呼び出せる）
     */
    public void clear(HttpSession session) {
        if (session == null) {
            return;
        }
        session.removeAttribute(TOKEN_ATTRIBUTE);
        session.removeAttribute(PROFILE_ATTRIBUTE);
    }

    private String getTokenValue(HttpSession session, String name) {
        if (session == null) {
            return null;
        }
        Object token = session.getAttribute(TOKEN_ATTRIBUTE);
        if (!(token instanceof Map<?, ?> map)) {
            return null;
        }
        Object value = map.get(name);
        return value == null ? null : value.toString();
    }

    /**
     * トークンから expires_at を読み取る
     *
     * <p>型の不一致は {@link ClassCastException}、項目の欠落は {@link IllegalStateException} とする。</p>
     */
    private static long readExpiresAt(Object token) {
        if (!(token instanceof Map<?, ?> map)) {
            throw new ClassCastException("The session token is not a map: " + token.getClass().getName());
        }
        Object expiresAt = map.get(EXPIRES_AT);
        if (expiresAt == null) {
            throw new IllegalStateException("The session token has no " + EXPIRES_AT);
        }
        if (expiresAt instanceof Long || expiresAt instanceof Integer
            || expiresAt instanceof Short || expiresAt instanceof Byte) {
            return ((Number) expiresAt).longValue();
        }
        if (expiresAt instanceof BigInteger bigInteger) {
            return bigInteger.longValueExact();
        }
        throw new ClassCastException(
            "The session token " + EXPIRES_AT + " is not an integer: " + expiresAt.getClass().getSimpleName()
        );
    }
}
