package com.taildeck.backend.global.security.authorization;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.taildeck.backend.modules.rbac.domain.RoleName;

/**
 * 나열된 역할 중 하나를 정확히 보유해야 한다. 계층은 고려하지 않는다.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface RequiresRoles {

    RoleName[] value();
}
