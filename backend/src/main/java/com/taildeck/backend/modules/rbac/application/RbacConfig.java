package com.taildeck.backend.modules.rbac.application;

import com.taildeck.backend.modules.rbac.domain.RoleHierarchy;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RbacConfig {

    @Bean
    public RoleHierarchy roleHierarchy() {
        return RoleHierarchy.standard();
    }
}
