package io.sunplane.client;

import java.util.List;

public record TokenRecord(
        String tokenId,
        String label,
        List<String> scopes,
        String expiresAt,
        String revokedAt,
        String createdAt,
        String lastUsedAt
) {
}
