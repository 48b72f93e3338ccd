package io.sunplane.client;

import java.util.List;

public record IssuedToken(
        Account account,
        String token,
        String tokenId,
        String label,
        List<String> scopes,
        String expiresAt,
        String issuedAt
) {
    public record Account(String id, String slug) {
    }
}
