package com.example.oidc_rp.interceptor;

import com.example.oidc_rp.dto.TokenIntrospection;
import org.springframework.core.MethodParameter;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * {@link AcceptToken} ハンドラーに {@link TokenIntrospection} を引数として渡すリゾルバー
 *
 * <p>Bearerトークン検証を経ていないリクエストでは null を渡す。</p>
 */
public class TokenIntrospectionArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(@NonNull MethodParameter parameter) {
        return TokenIntrospection.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(
        @NonNull MethodParameter parameter,
        ModelAndViewContainer mavContainer,
        @NonNull NativeWebRequest webRequest,
        WebDataBinderFactory binderFactory
    ) {
        return webRequest.getAttribute(TokenIntrospection.REQUEST_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
    }
}
