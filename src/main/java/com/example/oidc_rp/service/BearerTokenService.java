package com.example.oidc_rp.service;

import com.example.oidc_rp.client.OidcClient;
import com.example.oidc_rp.dto.TokenIntrospection;
import com.example.oidc_rp.exception.BearerTokenException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Set;

/**
 * Bearerトークン検証サービス
 *
 * <p>Authorizationヘッダーからトークンを取り出し、IdPのイントロスペクションエンドポイントで検証する。
 * セッションは参照しない。</p>
 *
 * <h3>検証順:</h3>
 * <ol>
 *   <li>Authorizationヘッダーの有無 → missing_authorization (401)</li>
 *   <li>認証スキームが Bearer か → unsupported_token_type (401)</li>
 *   <li>イントロスペクション結果の active → invalid_token (401)</li>
 *   <li>要求スコープがすべて含まれるか（空白区切りの完全一致） → insufficient_scope (403)</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BearerTokenService {

    private static final String BEARER = "bearer";

    private final OidcClient oidcClient;

    /**
     * Bearerトークンを検証する
     *
     * @param authorizationHeader Authorizationヘッダー値（null可）
     * @param requiredScopes 要求スコープ（空の場合はスコープを確認しない）
     * @return 検証済みのイントロスペクション結果
     * @throws BearerTokenException 検証に失敗した場合
     * @throws com.example.oidc_rp.exception.IntrospectionUnsupportedException IdPがイントロスペクションをサポートしない場合
     */
    public TokenIntrospection validate(String authorizationHeader, Collection<String> requiredScopes) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            throw BearerTokenException.missingAuthorization();
        }

        String[] parts = authorizationHeader.trim().split("\\s+", 2);
        if (parts.length != 2 || !BEARER.equalsIgnoreCase(parts[0])) {
            throw BearerTokenException.unsupportedTokenType(parts[0]);
        }

        TokenIntrospection introspection = oidcClient.introspect(parts[1]);
        if (!introspection.isActive()) {
            throw BearerTokenException.invalidToken();
        }

        if (requiredScopes != null && !requiredScopes.isEmpty()) {
            Set<String> grantedScopes = introspection.getScopes();
            if (!grantedScopes.containsAll(requiredScopes)) {
                log.debug("Insufficient scope: required={}, granted={}", requiredScopes, grantedScopes);
                throw BearerTokenException.insufficientScope();
            }
        }
        return introspection;
    }
}
