package com.bastion.security.rbac;

public enum DenyReason {
    INSUFFICIENT_ROLE,
    OWNERSHIP_MISMATCH,
    SELF_REMOVAL,
    LAST_ADMIN
}
