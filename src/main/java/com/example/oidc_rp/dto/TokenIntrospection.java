package com.example.oidc_rp.dto;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * トークンイントロスペクション結果（RFC 7662）
 *
 * <p>リクエストスコープでのみ保持し、セッションには保存しない。
 * Bearerトークン検証に成功したリクエストでは {@link #REQUEST_ATTRIBUTE} 属性として参照できる。</p>
 */
public class TokenIntrospection {

    /** 検証済みイントロスペクション結果を格納するリクエスト属性名 */
    public static final String REQUEST_ATTRIBUTE = TokenIntrospection.class.getName();

    private final Map<String, Object> claims;

    public TokenIntrospection(Map<String, Object> claims) {
        this.claims = claims == null ? Collections.emptyMap() : Collections.unmodifiableMap(claims);
    }

    /**
     * active クレームが真偽値 true の場合のみ有効
     */
    public boolean isActive() {
        return Boolean.TRUE.equals(claims.get("active"));
    }

    public String getScope() {
        Object scope = claims.get("scope");
        return scope == null ? null : scope.toString();
    }

    /**
     * scope クレームを空白区切りで分割したトークン集合
     */
    public Set<String> getScopes() {
        String scope = getScope();
        if (scope == null || scope.isBlank()) {
            return Collections.emptySet();
        }
        Set<String> scopes = new LinkedHashSet<>();
        for (String token : scope.trim().split("\\s+")) {
            scopes.add(token);
        }
        return scopes;
    }

    public Map<String, Object> getClaims() {
        return claims;
    }

    @Override
    public String toString() {
        return "TokenIntrospection{active=" + isActive() + ", scope=" + getScope() + "}";
    }
}
