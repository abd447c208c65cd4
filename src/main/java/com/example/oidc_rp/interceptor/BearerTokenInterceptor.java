package com.example.oidc_rp.interceptor;

import com.example.oidc_rp.dto.TokenIntrospection;
import com.example.oidc_rp.service.BearerTokenService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Arrays;

/**
 * {@link AcceptToken} を処理するインターセプター
 *
 * <p>検証に成功した場合、イントロスペクション結果を
 * {@link TokenIntrospection#REQUEST_ATTRIBUTE} 属性に格納する。
 * 失敗時の例外は {@link com.example.oidc_rp.exception.GlobalExceptionHandler} でレスポンスに変換される。</p>
 */
@Component
@RequiredArgsConstructor
public class BearerTokenInterceptor implements HandlerInterceptor {

    private final BearerTokenService bearerTokenService;

    @Override
    public boolean preHandle(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull Object handler
    ) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        AcceptToken acceptToken = findAnnotation(handlerMethod);
        if (acceptToken == null) {
            return true;
        }

        TokenIntrospection introspection = bearerTokenService.validate(
            request.getHeader(HttpHeaders.AUTHORIZATION),
            Arrays.asList(acceptToken.scopes())
        );
        request.setAttribute(TokenIntrospection.REQUEST_ATTRIBUTE, introspection);
        return true;
    }

    private AcceptToken findAnnotation(HandlerMethod handlerMethod) {
        AcceptToken acceptToken = handlerMethod.getMethodAnnotation(AcceptToken.class);
        if (acceptToken != null) {
            return acceptToken;
        }
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), AcceptToken.class);
    }
}
