package com.garment.materials.config;

import com.garment.materials.service.AuditService;
import org.springframework.context.event.EventListener;
import org.springframework.security.authentication.event.AbstractAuthenticationFailureEvent;
import org.springframework.stereotype.Component;

/**
 * Records rejected credentials. Successful logins are not audited since every stateless request authenticates.
 */
@Component
public class AuthenticationEventListener {

    private final AuditService auditService;

    public AuthenticationEventListener(AuditService auditService) {
        this.auditService = auditService;
    }

    @EventListener
    public void onFailure(AbstractAuthenticationFailureEvent event) {
        Object principal = event.getAuthentication().getPrincipal();
        String username = principal instanceof String ? (String) principal : "Unknown";
        auditService.log("LOGIN_FAILURE", "Failed login for: " + username + " - " + event.getException().getMessage());
    }
}
