package com.bastion.security.rbac;

import com.bastion.security.Role;

/**
 * Every action a handler can be admitted for, with its authorization rule.
 * <p>
 * The table is the single source of truth for role checks; handlers name an action and never
 * compare roles themselves.
 */
public enum Action {

    TENANT_CONTEXT_VIEW("tenant.context.view", ActionPolicy.minimum(Role.VIEWER)),

    PROJECT_LIST("project.list", ActionPolicy.minimum(Role.VIEWER)),
    PROJECT_VIEW("project.view", ActionPolicy.minimum(Role.VIEWER)),
    PROJECT_CREATE("project.create", ActionPolicy.minimum(Role.MEMBER)),
    PROJECT_UPDATE("project.update", ActionPolicy.minimum(Role.MEMBER)),
    PROJECT_DELETE("project.delete", ActionPolicy.minimum(Role.ADMIN).orOwnerWith(Role.MEMBER)),
    PROJECT_HARD_DELETE("project.hard_delete", ActionPolicy.minimum(Role.ADMIN)),
    PROJECT_RESTORE("project.restore", ActionPolicy.minimum(Role.ADMIN)),

    RESOURCE_LIST("resource.list", ActionPolicy.minimum(Role.VIEWER)),
    RESOURCE_VIEW("resource.view", ActionPolicy.minimum(Role.VIEWER)),
    RESOURCE_CREATE("resource.create", ActionPolicy.minimum(Role.MEMBER)),
    RESOURCE_UPDATE("resource.update", ActionPolicy.minimum(Role.MEMBER)),
    RESOURCE_DELETE("resource.delete", ActionPolicy.minimum(Role.MEMBER)),

    USER_LIST("user.list", ActionPolicy.minimum(Role.VIEWER)),
    USER_VIEW("user.view", ActionPolicy.minimum(Role.VIEWER)),
    USER_CREATE("user.create", ActionPolicy.minimum(Role.ADMIN)),
    USER_UPDATE("user.update", ActionPolicy.minimum(Role.ADMIN).orOwnerWith(Role.VIEWER)),
    USER_CHANGE_ROLE("user.change_role", ActionPolicy.minimum(Role.ADMIN).guardingLastAdmin()),
    USER_DELETE("user.delete", ActionPolicy.minimum(Role.ADMIN).guardingLastAdmin().forbiddingSelf());

    private final String value;
    private final ActionPolicy policy;

    Action(String value, ActionPolicy policy) {
        this.value = value;
        this.policy = policy;
    }

    public String value() {
        return value;
    }

    public ActionPolicy policy() {
        return policy;
    }
}
