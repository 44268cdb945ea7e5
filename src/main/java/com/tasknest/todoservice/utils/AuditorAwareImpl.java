package com.tasknest.todoservice.utils;

import lombok.NonNull;
import org.springframework.data.domain.AuditorAware;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;

/** Fills createdBy/modifiedBy as "USER:alice", "ADMIN:root" or "SYSTEM". */
@Component("auditorAware")
public class AuditorAwareImpl implements AuditorAware<String> {

    private static final String SYSTEM = "SYSTEM";
    private static final String ROLE_ADMIN = "ROLE_ADMIN";

    @Override
    @NonNull
    public Optional<String> getCurrentAuditor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();

        // registration and other anonymous writes
        if (auth == null || !auth.isAuthenticated() || !(auth.getPrincipal() instanceof UserDetails ud)) {
            return Optional.of(SYSTEM);
        }

        String username = ud.getUsername();
        if (username == null || username.isBlank()) {
            return Optional.of(SYSTEM);
        }
        String prefix = hasAdminRole(auth.getAuthorities()) ? "ADMIN" : "USER";
        return Optional.of(prefix + ":" + username);
    }

    private boolean hasAdminRole(Collection<? extends GrantedAuthority> authorities) {
        if (authorities == null) return false;
        return authorities.stream().anyMatch(ga -> ROLE_ADMIN.equals(ga.getAuthority()));
    }
}
