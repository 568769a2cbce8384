package com.taildeck.backend.global.config;

import java.util.List;

import com.taildeck.backend.global.security.authorization.AuthenticatedContextArgumentResolver;
import com.taildeck.backend.global.security.authorization.RoleAuthorizationInterceptor;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final RoleAuthorizationInterceptor roleAuthorizationInterceptor;
    private final AuthenticatedContextArgumentResolver authenticatedContextArgumentResolver;

    public WebMvcConfig(
            RoleAuthorizationInterceptor roleAuthorizationInterceptor,
            AuthenticatedContextArgumentResolver authenticatedContextArgumentResolver
    ) {
        this.roleAuthorizationInterceptor = roleAuthorizationInterceptor;
        this.authenticatedContextArgumentResolver = authenticatedContextArgumentResolver;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(roleAuthorizationInterceptor).addPathPatterns("/api/**");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(authenticatedContextArgumentResolver);
    }
}
