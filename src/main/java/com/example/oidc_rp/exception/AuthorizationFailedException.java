package com.example.oidc_rp.exception;

import lombok.Getter;

/**
 * IdPとの認可コードフローが失敗した場合の例外
 *
 * <p>IdPがコールバックでエラーを返した場合、state検証に失敗した場合、
 * トークンエンドポイントがエラーを返した場合にスローされます。
 * 401のHTMLエラーページ（{@code <p>error: description</p>}）に変換されます。</p>
 */
@Getter
public class AuthorizationFailedException extends RuntimeException {

    /** state不一致時のエラーコード */
    public static final String MISMATCHING_STATE = "mismatching_state";

    private final String error;
    private final String description;

    public AuthorizationFailedException(String error, String description) {
        super(description == null ? error : error + ": " + description);
        this.error = error;
        this.description = description;
    }

    public AuthorizationFailedException(String error, String description, Throwable cause) {
        super(description == null ? error : error + ": " + description, cause);
        this.error = error;
        this.description = description;
    }

    /**
     * 保留中の認可リクエストが存在しない、またはstateが一致しない場合の例外を生成
     */
    public static AuthorizationFailedException mismatchingState() {
        return new AuthorizationFailedException(
            MISMATCHING_STATE,
            "CSRF Warning! State not equal in request and response."
        );
    }
}
