package com.tasknest.todoservice.service;

import java.time.Duration;

/**
 * Denylist of revoked token identifiers (jti). Entries expire on their own once
 * the tokens they cover could no longer be valid anyway.
 */
public interface TokenRevocationService {

    /**
     * Insert or refresh a denylist entry.
     *
     * @param ttl how long to remember the revocation; must cover the token's
     *            remaining lifetime
     */
    void revoke(String jti, Duration ttl);

    boolean isRevoked(String jti);
}
