package com.keystone.crypto.privacy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a DTO field, getter or record component for {@link TieredFieldPrivacyEncoder}.
 * Unannotated fields are treated as {@link Visibility#PUBLIC}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.METHOD, ElementType.RECORD_COMPONENT})
public @interface FieldPrivacy {

    Visibility value() default Visibility.PRIVATE;
}
