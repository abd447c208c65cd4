package com.example.oidc_rp.exception;

/**
 * セッション認証レコード破損例外
 *
 * <p>セッションに保存されたトークンが読み取れない場合（Map以外の値、expires_at欠落、
 * expires_atが整数でない等）にスローされます。メッセージは
 * {@code "<元例外のクラス名>: <元例外のメッセージ>"} 形式で、500レスポンスの本文にそのまま含まれます。</p>
 *
 * @see com.example.oidc_rp.service.OidcSessionService#checkExpiry
 */
public class SessionCorruptedException extends RuntimeException {

    public SessionCorruptedException(Throwable cause) {
        super(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }
}
