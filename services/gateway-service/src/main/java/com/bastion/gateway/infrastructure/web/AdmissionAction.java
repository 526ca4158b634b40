package com.bastion.gateway.infrastructure.web;

import com.bastion.security.rbac.Action;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the action a handler method performs. Requests to annotated handlers run through
 * the admission pipeline before the handler is invoked.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface AdmissionAction {

    Action value();

    /**
     * Name of the path variable holding the owner (or targeted subject) of the resource.
     * Empty when the action has no target.
     */
    String ownerPathVariable() default "";
}
