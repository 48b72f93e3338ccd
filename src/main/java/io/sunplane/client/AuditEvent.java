package io.sunplane.client;

import java.util.Map;

public record AuditEvent(
        long id,
        String tokenId,
        String action,
        String kind,
        String name,
        Long revision,
        Map<String, Object> details,
        String createdAt
) {
}
