package com.example.oidc_rp.controller;

import com.example.oidc_rp.client.OidcClient;
import com.example.oidc_rp.service.AuthService;
import com.example.oidc_rp.service.OidcSessionService;
import com.example.oidc_rp.support.OidcTestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.security.oauth2.core.OAuth2AuthorizationException;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.flash;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * ブラウザ向け認証フローの統合テスト
 *
 * <p>IdPとの通信は {@link OidcClient} をモック化して検証します。</p>
 *
 * <h3>テストケース:</h3>
 * <ul>
 *   <li>未ログイン時のログインルートへのリダイレクト</li>
 *   <li>ログイン → コールバック → 元のURLへのリダイレクト</li>
 *   <li>コールバックのエラー（IdPエラー、state不一致、トークンエンドポイントのエラー）</li>
 *   <li>ログアウトとフラッシュメッセージ</li>
 *   <li>トークンの有効期限切れ、破損したトークン</li>
 *   <li>旧コールバックURLの転送</li>
 * </ul>
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OidcClient oidcClient;

    private MockHttpSession session;

    @BeforeEach
    void setUp() {
        session = new MockHttpSession();
    }

    private void logIn() {
        session.setAttribute(OidcSessionService.TOKEN_ATTRIBUTE, OidcTestFixtures.validToken());
        session.setAttribute(OidcSessionService.PROFILE_ATTRIBUTE, Map.of("nickname", "dummy"));
    }

    /**
     * テスト: 未ログインで保護ページにアクセスするとログインルートへリダイレクト
     */
    @Test
    void testProtectedPage_Anonymous_ShouldRedirectToLogin() throws Exception {
        mockMvc.perform(get("/").session(session))
            .andExpect(status().is3xxRedirection())
            .andExpect(redirectedUrl("/login?next=http%3A%2F%2Flocalhost%2F"));
    }

    /**
     * テスト: ログイン済みなら保護ページにアクセス可能
     */
    @Test
    void testProtectedPage_LoggedIn_ShouldBeAccessible() throws Exception {
        logIn();

        mockMvc.perform(get("/").session(session))
            .andExpect(status().isOk())
            .andExpect(content().string("hello"));
    }

    /**
     * テスト: 公開ページは未ログインでもアクセス可能
     */
    @Test
    void testPublicPage_ShouldBeAccessible() throws Exception {
        mockMvc.perform(get("/public"))
            .andExpect(status().isOk())
            .andExpect(content().string("public"));
    }

    /**
     * テスト: ログイン → コールバック → 元のURLへ戻り、トークンが参照できる
     */
    @Test
    void testLoginFlow_ShouldRedirectBackAndExposeTokens() throws Exception {
        when(oidcClient.createAuthorizationRequest(OidcTestFixtures.REDIRECT_URI))
            .thenReturn(OidcTestFixtures.authorizationRequest("dummy_state"));
        when(oidcClient.exchangeCode(any(), eq("dummy_code"))).thenReturn(OidcTestFixtures.validToken());
        when(oidcClient.fetchUserInfo("dummy_access_token")).thenReturn(Map.of("nickname", "dummy"));

        mockMvc.perform(get("/login").param("next", "http://localhost/").session(session))
            .andExpect(status().is3xxRedirection())
            .andExpect(redirectedUrl(OidcTestFixtures.authorizationRequest("dummy_state").getAuthorizationRequestUri()));

        mockMvc.perform(get("/authorize")
                .param("state", "dummy_state")
                .param("code", "dummy_code")
                .session(session))
            .andExpect(status().is3xxRedirection())
            .andExpect(redirectedUrl("http://localhost/"));

        mockMvc.perform(get("/at").session(session))
            .andExpect(status().isOk())
            .andExpect(content().string("dummy_access_token"));
        mockMvc.perform(get("/rt").session(session))
            .andExpect(status().isOk())
            .andExpect(content().string("dummy_refresh_token"));
        mockMvc.perform(get("/user").session(session))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.nickname").value("dummy"));
    }

    /**
     * テスト: IdPがエラーを返した場合は401のHTMLエラーページ
     */
    @Test
    void testAuthorize_ProviderError_ShouldReturn401() throws Exception {
        mockMvc.perform(get("/authorize")
                .param("error", "dummy_error")
                .param("error_description", "Dummy Error")
                .session(session))
            .andExpect(status().isUnauthorized())
            .andExpect(content().string(containsString("<p>dummy_error: Dummy Error</p>")));

        verify(oidcClient, never()).exchangeCode(any(), anyString());
    }

    /**
     * テスト: stateが一致しない場合は401
     */
    @Test
    void testAuthorize_MismatchingState_ShouldReturn401() throws Exception {
        when(oidcClient.createAuthorizationRequest(anyString()))
            .thenReturn(OidcTestFixtures.authorizationRequest("dummy_state"));
        mockMvc.perform(get("/login").session(session));

        mockMvc.perform(get("/authorize")
                .param("state", "forged_state")
                .param("code", "dummy_code")
                .session(session))
            .andExpect(status().isUnauthorized())
            .andExpect(content().string(containsString("mismatching_state")));

        verify(oidcClient, never()).exchangeCode(any(), anyString());
    }

    /**
     * テスト: トークンエンドポイントがエラーを返した場合は401
     */
    @Test
    void testAuthorize_TokenEndpointError_ShouldReturn401() throws Exception {
        when(oidcClient.createAuthorizationRequest(anyString()))
            .thenReturn(OidcTestFixtures.authorizationRequest("dummy_state"));
        when(oidcClient.exchangeCode(any(), anyString()))
            .thenThrow(new OAuth2AuthorizationException(new OAuth2Error("invalid_grant", "Code expired", null)));
        mockMvc.perform(get("/login").session(session));

        mockMvc.perform(get("/authorize")
                .param("state", "dummy_state")
                .param("code", "dummy_code")
                .session(session))
            .andExpect(status().isUnauthorized())
            .andExpect(content().string(containsString("<p>invalid_grant: Code expired</p>")));

        assertThat(session.getAttribute(OidcSessionService.TOKEN_ATTRIBUTE)).isNull();
    }

    /**
     * テスト: ログアウトでトークンが削除され、メッセージ付きでリダイレクト
     */
    @Test
    void testLogout_ShouldClearSessionAndFlashMessage() throws Exception {
        logIn();

        mockMvc.perform(get("/logout").session(session))
            .andExpect(status().is3xxRedirection())
            .andExpect(redirectedUrl("http://localhost/"))
            .andExpect(flash().attribute("message", "You were successfully logged out."));

        assertThat(session.getAttribute(OidcSessionService.TOKEN_ATTRIBUTE)).isNull();
        assertThat(session.getAttribute(OidcSessionService.PROFILE_ATTRIBUTE)).isNull();
    }

    /**
     * テスト: ログアウト後の遷移先が安全なら従う
     */
    @Test
    void testLogout_WithSafeNext_ShouldRedirectToNext() throws Exception {
        mockMvc.perform(get("/logout").param("next", "/somewhere_else").session(session))
            .andExpect(redirectedUrl("/somewhere_else"));
    }

    /**
     * テスト: コンテキストパス配下の遷移先にコンテキストパスが重ねて付かない
     */
    @Test
    void testLogout_UnderContextPath_ShouldNotPrefixTwice() throws Exception {
        mockMvc.perform(get("/app/logout").contextPath("/app").param("next", "/app/somewhere_else").session(session))
            .andExpect(status().is3xxRedirection())
            .andExpect(redirectedUrl("/app/somewhere_else"));
    }

    /**
     * テスト: 外部ホストへの遷移先は拒否してアプリケーションルートへ
     */
    @Test
    void testLogout_WithUnsafeNext_ShouldRedirectToRoot() throws Exception {
        mockMvc.perform(get("/logout").param("next", "https://evil.example.com/").session(session))
            .andExpect(redirectedUrl("http://localhost/"));
    }

    /**
     * テスト: 期限切れトークンはログアウトへリダイレクトされ、ループしない
     */
    @Test
    void testExpiredToken_ShouldRedirectToLogoutOnce() throws Exception {
        session.setAttribute(
            OidcSessionService.TOKEN_ATTRIBUTE,
            OidcTestFixtures.token(Instant.now().minusSeconds(10).getEpochSecond())
        );

        mockMvc.perform(get("/public").session(session))
            .andExpect(status().is3xxRedirection())
            .andExpect(redirectedUrl("/logout?reason=expired"));

        mockMvc.perform(get("/logout").param("reason", "expired").session(session))
            .andExpect(status().is3xxRedirection())
            .andExpect(redirectedUrl("http://localhost/"))
            .andExpect(flash().attribute("message", "Your session expired, please reconnect."));

        assertThat(session.getAttribute(OidcSessionService.TOKEN_ATTRIBUTE)).isNull();

        mockMvc.perform(get("/public").session(session))
            .andExpect(status().isOk());
    }

    /**
     * テスト: 破損したトークンは500（型エラーのクラス名を含む）でセッションから削除される
     */
    @Test
    void testCorruptedToken_ShouldReturn500AndPurgeSession() throws Exception {
        session.setAttribute(OidcSessionService.TOKEN_ATTRIBUTE, "not-a-token");
        session.setAttribute(OidcSessionService.PROFILE_ATTRIBUTE, Map.of("nickname", "dummy"));

        mockMvc.perform(get("/public").session(session))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("SESSION_CORRUPTED"))
            .andExpect(jsonPath("$.message").value(containsString("ClassCastException: The session token is not a map")));

        assertThat(session.getAttribute(OidcSessionService.TOKEN_ATTRIBUTE)).isNull();
        assertThat(session.getAttribute(OidcSessionService.PROFILE_ATTRIBUTE)).isNull();
    }

    /**
     * テスト: 旧コールバックURLはクエリ文字列付きで /authorize へ転送
     */
    @Test
    void testLegacyCallback_ShouldForwardToAuthorize() throws Exception {
        mockMvc.perform(get("/oidc_callback?state=dummy-state&code=dummy-code"))
            .andExpect(status().is3xxRedirection())
            .andExpect(redirectedUrl("/authorize?state=dummy-state&code=dummy-code"));
    }

    /**
     * テスト: 未ログインでのプロフィール取得は401
     */
    @Test
    void testUser_Anonymous_ShouldReturn401() throws Exception {
        mockMvc.perform(get("/user").session(session))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
    }

    /**
     * テスト: ログイン開始時に next が保存される
     */
    @Test
    void testLogin_ShouldStoreNextInSession() throws Exception {
        when(oidcClient.createAuthorizationRequest(anyString()))
            .thenReturn(OidcTestFixtures.authorizationRequest("dummy_state"));

        mockMvc.perform(get("/login").param("next", "/dashboard").session(session))
            .andExpect(status().is3xxRedirection());

        assertThat(session.getAttribute(AuthService.NEXT_ATTRIBUTE)).isEqualTo("/dashboard");
    }
}
