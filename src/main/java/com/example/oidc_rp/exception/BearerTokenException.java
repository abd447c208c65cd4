package com.example.oidc_rp.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Bearerトークン検証エラー例外
 *
 * <p>RFC 6750 のエラーコードとHTTPステータスを保持します。
 * {@link GlobalExceptionHandler} で {@code {"error", "error_description"}} 形式のJSONと
 * {@code WWW-Authenticate} ヘッダーに変換されます。</p>
 *
 * <h3>エラーコード:</h3>
 * <ul>
 *   <li><b>missing_authorization</b> (401): Authorizationヘッダーなし</li>
 *   <li><b>unsupported_token_type</b> (401): Bearer以外の認証スキーム</li>
 *   <li><b>invalid_token</b> (401): イントロスペクション結果が active=false</li>
 *   <li><b>insufficient_scope</b> (403): 要求スコープ不足</li>
 * </ul>
 */
@Getter
public class BearerTokenException extends RuntimeException {

    private final String error;
    private final String description;
    private final HttpStatus status;

    public BearerTokenException(String error, String description, HttpStatus status) {
        super(error + ": " + description);
        this.error = error;
        this.description = description;
        this.status = status;
    }

    public static BearerTokenException missingAuthorization() {
        return new BearerTokenException(
            "missing_authorization",
            "Missing \"Authorization\" in headers.",
            HttpStatus.UNAUTHORIZED
        );
    }

    public static BearerTokenException unsupportedTokenType(String tokenType) {
        return new BearerTokenException(
            "unsupported_token_type",
            "Unsupported token_type: \"" + tokenType + "\"",
            HttpStatus.UNAUTHORIZED
        );
    }

    public static BearerTokenException invalidToken() {
        return new BearerTokenException(
            "invalid_token",
            "The access token provided is expired, revoked, malformed, or invalid for other reasons.",
            HttpStatus.UNAUTHORIZED
        );
    }

    public static BearerTokenException insufficientScope() {
        return new BearerTokenException(
            "insufficient_scope",
            "The request requires higher privileges than provided by the access token.",
            HttpStatus.FORBIDDEN
        );
    }

    /**
     * {@code WWW-Authenticate} ヘッダー値を生成（RFC 6750 Section 3）
     */
    public String toWwwAuthenticate() {
        return "Bearer error=\"" + error + "\", error_description=\"" + description.replace("\"", "\\\"") + "\"";
    }
}
