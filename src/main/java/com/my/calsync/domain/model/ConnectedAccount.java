package com.my.calsync.domain.model;

import java.time.Instant;
import java.util.Set;

public record ConnectedAccount(String provider,
                               String providerAccountId,
                               Set<String> scopes,
                               Instant expiresAt,
                               boolean renewable) {

    public static ConnectedAccount of(OAuthCredential credential) {
        return new ConnectedAccount(credential.provider(), credential.providerAccountId(), credential.scopes(),
                credential.expiresAt(), credential.renewable());
    }
}
