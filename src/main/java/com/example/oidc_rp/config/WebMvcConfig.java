package com.example.oidc_rp.config;

import com.example.oidc_rp.interceptor.BearerTokenInterceptor;
import com.example.oidc_rp.interceptor.LoginRequiredInterceptor;
import com.example.oidc_rp.interceptor.TokenIntrospectionArgumentResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Spring MVC設定クラス
 *
 * <p>{@code @RequireLogin} と {@code @AcceptToken} のインターセプターを登録する。
 * セッション有効期限チェックはハンドラーより前に実行する必要があるため、
 * インターセプターではなく {@link com.example.oidc_rp.filter.SessionExpiryFilter} で行う。</p>
 */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final LoginRequiredInterceptor loginRequiredInterceptor;
    private final BearerTokenInterceptor bearerTokenInterceptor;

    @Override
    public void addInterceptors(@NonNull InterceptorRegistry registry) {
        registry.addInterceptor(loginRequiredInterceptor);
        registry.addInterceptor(bearerTokenInterceptor);
    }

    @Override
    public void addArgumentResolvers(@NonNull List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new TokenIntrospectionArgumentResolver());
    }
}
