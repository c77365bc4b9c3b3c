package com.flamingo.ai.webarchive.service.ingest.embedding;

/**
 * Per-archive result of routing chunks through the shared store.
 *
 * @param chunks chunks produced from the archive text
 * @param reused chunks whose content row already existed
 * @param created chunks stored by this call
 * @param failed chunks skipped because a store write failed
 */
public record EmbeddingOutcome(int chunks, int reused, int created, int failed) {}
