package com.example.oidc_rp.interceptor;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Bearerトークンで保護するハンドラーを示すアノテーション
 *
 * <p>メソッドに付与した値がクラスに付与した値より優先される。</p>
 *
 * @see BearerTokenInterceptor
 */
@Documented
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface AcceptToken {

    /**
     * 要求スコープ（すべて必要）
     */
    String[] scopes() default {};
}
