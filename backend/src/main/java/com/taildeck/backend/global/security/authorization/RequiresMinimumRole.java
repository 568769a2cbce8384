package com.taildeck.backend.global.security.authorization;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.taildeck.backend.modules.rbac.domain.RoleName;

/**
 * 지정한 역할 이상의 레벨을 가진 역할을 하나라도 보유해야 한다.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface RequiresMinimumRole {

    RoleName value();
}
