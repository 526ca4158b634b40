package com.bastion.gateway.api;

import com.bastion.admission.AdmissionContext;
import com.bastion.gateway.infrastructure.directory.InMemoryIdentityDirectory;
import com.bastion.gateway.infrastructure.web.AdmissionAction;
import com.bastion.gateway.infrastructure.web.AdmissionRejectedException;
import com.bastion.security.AdmissionError;
import com.bastion.security.ErrorCode;
import com.bastion.security.rbac.Action;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final InMemoryIdentityDirectory identities;

    public UserController(InMemoryIdentityDirectory identities) {
        this.identities = identities;
    }

    /**
     * Removes an identity from the caller's tenant. The directory re-checks the last-admin rule
     * at removal time, so a race between two admins deleting each other still leaves one.
     */
    @DeleteMapping("/{userId}")
    @AdmissionAction(value = Action.USER_DELETE, ownerPathVariable = "userId")
    public ResponseEntity<Void> delete(AdmissionContext admission, @PathVariable String userId) {
        return switch (identities.remove(admission.tenantId(), userId)) {
            case REMOVED -> ResponseEntity.noContent().build();
            case NOT_FOUND -> ResponseEntity.notFound().build();
            case LAST_ADMIN -> throw new AdmissionRejectedException(AdmissionError.of(
                    ErrorCode.LAST_ADMIN_VIOLATION, "Cannot remove the last admin of the tenant"));
        };
    }
}
