package io.sunplane.client;

import java.util.Map;

public record ObjectMeta(
        String kind,
        String name,
        long latestRevision,
        String checksum,
        String contentType,
        long sizeBytes,
        Map<String, Object> metadata,
        String createdAt,
        String updatedAt
) {
}
