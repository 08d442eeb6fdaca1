package com.keystone.gateway.infrastructure.web;

import com.keystone.security.access.AdminLevel;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires a principal holding the given admin level. A method-level annotation overrides
 * the one on its controller.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequiresAdminLevel {

    AdminLevel value();
}
