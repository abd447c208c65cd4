package com.example.oidc_rp.exception;

/**
 * レート制限超過例外
 *
 * <p>ログインルートまたはBearerトークン保護APIのレート制限を超えた場合にスローされます。
 * フィルターチェーン内で発生するため、{@link com.example.oidc_rp.filter.FilterChainExceptionHandler}
 * で429に変換されます。</p>
 *
 * @see com.example.oidc_rp.filter.RateLimitFilter
 */
public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(String message) {
        super(message);
    }
}
