package com.example.oidc_rp.controller;

import com.example.oidc_rp.service.AuthService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;
import org.springframework.web.servlet.view.RedirectView;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.util.Map;

/**
 * ブラウザ向けの認証ルート
 *
 * <p>ルートは {@code oidc.prefix} 配下に登録される。リソースサーバー専用モードでは登録しない。</p>
 */
@RestController
@RequestMapping("${oidc.prefix:}")
@RequiredArgsConstructor
@ConditionalOnProperty(name = "oidc.resource-server-only", havingValue = "false", matchIfMissing = true)
public class AuthController {

    private final AuthService authService;

    /**
     * ログインエンドポイント
     *
     * <p>ログイン後の遷移先をセッションに保存し、IdPの認可エンドポイントへリダイレクトする。</p>
     */
    @GetMapping("/login")
    public RedirectView login(
        HttpServletRequest request,
        HttpServletResponse response,
        @RequestParam(value = "next", required = false) String next
    ) {
        return redirect(authService.startLogin(request, response, next));
    }

    /**
     * IdPからのコールバック
     *
     * <p>失敗時は {@link com.example.oidc_rp.exception.AuthorizationFailedException} により401となる。</p>
     */
    @GetMapping("/authorize")
    public RedirectView authorize(HttpServletRequest request, HttpServletResponse response) {
        return redirect(authService.completeLogin(request, response));
    }

    /**
     * ログアウトエンドポイント
     *
     * <p>トークンとプロフィールを削除し、フラッシュメッセージ {@code message} を付けてリダイレクトする。</p>
     */
    @GetMapping("/logout")
    public RedirectView logout(
        HttpServletRequest request,
        @RequestParam(value = "next", required = false) String next,
        @RequestParam(value = "reason", required = false) String reason,
        RedirectAttributes redirectAttributes
    ) {
        String message = authService.logout(request, reason);
        redirectAttributes.addFlashAttribute("message", message);
        return redirect(authService.safeDestination(request, next));
    }

    @GetMapping("/user")
    public ResponseEntity<Map<String, Object>> user(HttpServletRequest request) {
        return ResponseEntity.ok(authService.getUserInfo(request));
    }

    /**
     * 遷移先はコンテキストパスを含んだ値のまま使う
     */
    private RedirectView redirect(String url) {
        RedirectView view = new RedirectView(url, false);
        view.setExposeModelAttributes(false);
        view.setExpandUriTemplateVariables(false);
        return view;
    }
}
