package io.sunplane.client;

import java.util.Map;

public record ObjectRevision(
        long revision,
        String checksum,
        String contentType,
        long sizeBytes,
        Map<String, Object> metadata,
        String createdAt
) {
}
