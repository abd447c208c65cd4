package com.example.oidc_rp.exception;

/**
 * 認証エラー例外
 *
 * <p>ログインが必要なリソースに未ログインでアクセスした場合にスローされる例外です。</p>
 *
 * <h3>使用箇所:</h3>
 * <ul>
 *   <li>{@link com.example.oidc_rp.service.AuthService} - プロフィール取得</li>
 *   <li>{@link com.example.oidc_rp.interceptor.LoginRequiredInterceptor} - リソースサーバー専用モード</li>
 * </ul>
 *
 * @see com.example.oidc_rp.exception.GlobalExceptionHandler
 */
public class UnauthorizedException extends RuntimeException {

    /**
     * コンストラクタ
     *
     * @param message エラーメッセージ
     */
    public UnauthorizedException(String message) {
        super(message);
    }
}
