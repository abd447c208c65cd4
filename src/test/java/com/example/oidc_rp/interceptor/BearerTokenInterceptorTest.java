package com.example.oidc_rp.interceptor;

import com.example.oidc_rp.client.OidcClient;
import com.example.oidc_rp.dto.TokenIntrospection;
import com.example.oidc_rp.exception.IntrospectionUnsupportedException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * {@code @AcceptToken} によるBearerトークン保護の統合テスト
 *
 * <h3>テストケース:</h3>
 * <ul>
 *   <li>有効なトークンでのアクセス</li>
 *   <li>RFC 6750 形式のエラーレスポンス（JSON + WWW-Authenticate）</li>
 *   <li>スコープ不足は403</li>
 *   <li>イントロスペクション非対応のIdPは設定エラー（500）</li>
 *   <li>イントロスペクション結果のハンドラー引数への注入</li>
 * </ul>
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class BearerTokenInterceptorTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OidcClient oidcClient;

    private static TokenIntrospection active(String scope) {
        return new TokenIntrospection(Map.of("active", true, "scope", scope, "sub", "dummy_subject"));
    }

    /**
     * テスト: 有効なトークンならアクセス可能
     */
    @Test
    void testValidToken_ShouldBeAccepted() throws Exception {
        when(oidcClient.introspect("dummy_token")).thenReturn(active("openid"));

        mockMvc.perform(get("/api/need-token").header(HttpHeaders.AUTHORIZATION, "Bearer dummy_token"))
            .andExpect(status().isOk())
            .andExpect(content().string("OK"));
    }

    /**
     * テスト: Authorizationヘッダーなしは401
     */
    @Test
    void testMissingAuthorization_ShouldReturn401() throws Exception {
        mockMvc.perform(get("/api/need-token"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("missing_authorization"))
            .andExpect(jsonPath("$.error_description").value("Missing \"Authorization\" in headers."))
            .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, containsString("error=\"missing_authorization\"")));

        verify(oidcClient, never()).introspect(anyString());
    }

    /**
     * テスト: Bearer以外のスキームは401
     */
    @Test
    void testBasicScheme_ShouldReturnUnsupportedTokenType() throws Exception {
        mockMvc.perform(get("/api/need-token").header(HttpHeaders.AUTHORIZATION, "Basic dXNlcjpwYXNz"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("unsupported_token_type"))
            .andExpect(jsonPath("$.error_description").value("Unsupported token_type: \"Basic\""));
    }

    /**
     * テスト: active=false のトークンは401
     */
    @Test
    void testInactiveToken_ShouldReturn401() throws Exception {
        when(oidcClient.introspect("dummy_token")).thenReturn(new TokenIntrospection(Map.of("active", false)));

        mockMvc.perform(get("/api/need-token").header(HttpHeaders.AUTHORIZATION, "Bearer dummy_token"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("invalid_token"))
            .andExpect(header().exists(HttpHeaders.WWW_AUTHENTICATE));
    }

    /**
     * テスト: 要求スコープが含まれていれば許可
     */
    @Test
    void testRequiredScope_Granted_ShouldBeAccepted() throws Exception {
        when(oidcClient.introspect("dummy_token")).thenReturn(active("openid profile email"));

        mockMvc.perform(get("/api/need-profile").header(HttpHeaders.AUTHORIZATION, "Bearer dummy_token"))
            .andExpect(status().isOk());
    }

    /**
     * テスト: 要求スコープが不足していれば403
     */
    @Test
    void testRequiredScope_Missing_ShouldReturn403() throws Exception {
        when(oidcClient.introspect("dummy_token")).thenReturn(active("openid email"));

        mockMvc.perform(get("/api/need-profile").header(HttpHeaders.AUTHORIZATION, "Bearer dummy_token"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("insufficient_scope"))
            .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, containsString("insufficient_scope")));
    }

    /**
     * テスト: スコープは空白区切りの完全一致で判定
     */
    @Test
    void testRequiredScope_Substring_ShouldReturn403() throws Exception {
        when(oidcClient.introspect("dummy_token")).thenReturn(active("openid profile_extended"));

        mockMvc.perform(get("/api/need-profile").header(HttpHeaders.AUTHORIZATION, "Bearer dummy_token"))
            .andExpect(status().isForbidden());
    }

    /**
     * テスト: IdPがイントロスペクションをサポートしない場合は設定エラー
     */
    @Test
    void testIntrospectionUnsupported_ShouldReturn500() throws Exception {
        when(oidcClient.introspect("dummy_token")).thenThrow(new IntrospectionUnsupportedException());

        mockMvc.perform(get("/api/need-token").header(HttpHeaders.AUTHORIZATION, "Bearer dummy_token"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("CONFIGURATION_ERROR"))
            .andExpect(jsonPath("$.message").value(containsString("does not support introspection")));
    }

    /**
     * テスト: イントロスペクション結果がハンドラー引数に渡される
     */
    @Test
    void testIntrospectionClaims_ShouldBeInjected() throws Exception {
        when(oidcClient.introspect("dummy_token")).thenReturn(active("openid"));

        mockMvc.perform(get("/api/claims").header(HttpHeaders.AUTHORIZATION, "Bearer dummy_token"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sub").value("dummy_subject"))
            .andExpect(jsonPath("$.active").value(true));
    }
}
