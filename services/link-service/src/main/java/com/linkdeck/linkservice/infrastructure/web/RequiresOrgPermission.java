package com.linkdeck.linkservice.infrastructure.web;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The handler needs a session and the given permission in the request's organization. Implies
 * {@link RequiresSession}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface RequiresOrgPermission {

    /** Permission string, e.g. {@code members.write}. */
    String value();
}
