package com.taildeck.backend.global.security.authorization;

import com.taildeck.backend.global.error.AuthenticationRequiredException;

import org.springframework.core.MethodParameter;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

@Component
public class AuthenticatedContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AuthenticatedContext.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(@NonNull MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  @NonNull NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) {
        Object context = webRequest.getAttribute(AuthenticatedContext.REQUEST_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (context instanceof AuthenticatedContext authenticatedContext) {
            return authenticatedContext;
        }
        // 인터셉터를 거치지 않은 경로에서 컨텍스트를 요구하면 인증되지 않은 것으로 본다
        throw new AuthenticationRequiredException();
    }
}
