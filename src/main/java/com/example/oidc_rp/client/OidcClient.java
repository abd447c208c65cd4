package com.example.oidc_rp.client;

import com.example.oidc_rp.dto.TokenIntrospection;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;

import java.util.Map;

/**
 * IdPとの通信を行うOAuthクライアント
 *
 * <p>認可リクエストの生成、認可コードの交換、UserInfo取得、トークンイントロスペクションを提供する。
 * いずれもリクエストスレッド上で同期的に完了する。</p>
 *
 * <h3>エラー:</h3>
 * <ul>
 *   <li>通信エラー: {@link org.springframework.web.reactive.function.client.WebClientException}</li>
 *   <li>トークンエンドポイントのプロトコルエラー: {@link org.springframework.security.oauth2.core.OAuth2AuthorizationException}</li>
 *   <li>IdPの機能不足: {@link com.example.oidc_rp.exception.OidcConfigurationException}</li>
 * </ul>
 */
public interface OidcClient {

    /**
     * 新しいstateとPKCEパラメーターを持つ認可リクエストを生成する
     *
     * @param redirectUri IdPからのコールバック先（絶対URL）
     * @return 認可リクエスト（{@code getAuthorizationRequestUri()} がリダイレクト先）
     */
    OAuth2AuthorizationRequest createAuthorizationRequest(String redirectUri);

    /**
     * 認可コードをトークンに交換する
     *
     * @param authorizationRequest セッションに保存していた認可リクエスト
     * @param code IdPから受け取った認可コード
     * @return トークンレコード（access_token, expires_at 等）
     */
    Map<String, Object> exchangeCode(OAuth2AuthorizationRequest authorizationRequest, String code);

    /**
     * UserInfoエンドポイントからクレームを取得する
     */
    Map<String, Object> fetchUserInfo(String accessToken);

    /**
     * RFC 7662 トークンイントロスペクション
     *
     * @throws com.example.oidc_rp.exception.IntrospectionUnsupportedException IdPがイントロスペクションをサポートしない場合
     */
    TokenIntrospection introspect(String token);
}
