package com.taildeck.backend.global.security.authorization;

import java.util.Collections;
import java.util.Map;

import com.taildeck.backend.global.error.AccessForbiddenException;
import com.taildeck.backend.global.error.AuthenticationRequiredException;
import com.taildeck.backend.global.security.SecurityUtils;
import com.taildeck.backend.global.web.ClientIpResolver;
import com.taildeck.backend.modules.auth.application.SessionClaims;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * /api/** 핸들러 실행 전에 역할 요구사항을 평가한다.
 * 메서드 애노테이션이 클래스 애노테이션보다 우선하며, 애노테이션이 없으면 인증만 요구한다.
 */
@Component
public class RoleAuthorizationInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RoleAuthorizationInterceptor.class);

    private final AccessDecisionService accessDecisionService;

    public RoleAuthorizationInterceptor(AccessDecisionService accessDecisionService) {
        this.accessDecisionService = accessDecisionService;
    }

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }

        SessionClaims claims = SecurityUtils.currentClaims().orElse(null);
        RoleRequirement requirement = resolveRequirement(handlerMethod);
        AccessDecision decision = accessDecisionService.decide(claims, requirement);

        switch (decision.outcome()) {
            case UNAUTHENTICATED -> throw new AuthenticationRequiredException();
            case FORBIDDEN -> {
                log.info("Access denied: user={} roles={} path={} requirement={}",
                        claims.userId(), claims.roles(), request.getRequestURI(), requirement);
                throw decision.required() != null
                        ? AccessForbiddenException.requiringAnyOf(decision.required())
                        : AccessForbiddenException.requiringLevel(decision.requiredLevel());
            }
            case ALLOW -> request.setAttribute(AuthenticatedContext.REQUEST_ATTRIBUTE,
                    new AuthenticatedContext(
                            claims.userId(),
                            claims.email(),
                            claims.name(),
                            claims.roles(),
                            pathVariables(request),
                            ClientIpResolver.resolve(request)
                    ));
        }
        return true;
    }

    static RoleRequirement resolveRequirement(HandlerMethod handlerMethod) {
        RequiresRoles methodRoles = handlerMethod.getMethodAnnotation(RequiresRoles.class);
        RequiresMinimumRole methodMinimum = handlerMethod.getMethodAnnotation(RequiresMinimumRole.class);
        if (methodRoles != null) {
            return RoleRequirement.anyOf(methodRoles.value());
        }
        if (methodMinimum != null) {
            return RoleRequirement.minimum(methodMinimum.value());
        }
        Class<?> beanType = handlerMethod.getBeanType();
        RequiresRoles typeRoles = AnnotatedElementUtils.findMergedAnnotation(beanType, RequiresRoles.class);
        if (typeRoles != null) {
            return RoleRequirement.anyOf(typeRoles.value());
        }
        RequiresMinimumRole typeMinimum = AnnotatedElementUtils.findMergedAnnotation(beanType, RequiresMinimumRole.class);
        if (typeMinimum != null) {
            return RoleRequirement.minimum(typeMinimum.value());
        }
        return RoleRequirement.authenticated();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> pathVariables(HttpServletRequest request) {
        Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (attribute instanceof Map<?, ?> map) {
            return (Map<String, String>) map;
        }
        return Collections.emptyMap();
    }
}
