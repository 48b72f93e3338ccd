package io.sunplane.client;

/**
 * Revisions reported by a successful put.
 */
public record PutResult(long latestRevision, long revision) {
}
