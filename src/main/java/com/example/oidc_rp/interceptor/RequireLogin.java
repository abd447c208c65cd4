package com.example.oidc_rp.interceptor;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * ログインが必要なハンドラーを示すアノテーション
 *
 * <p>未ログインの場合は {@code {prefix}/login?next=<現在のURL>} にリダイレクトされる。
 * クラスに付与した場合はすべてのハンドラーメソッドが対象になる。</p>
 *
 * @see LoginRequiredInterceptor
 */
@Documented
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface RequireLogin {
}
