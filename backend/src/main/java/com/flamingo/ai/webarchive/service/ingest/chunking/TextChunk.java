package com.flamingo.ai.webarchive.service.ingest.chunking;

/** A trimmed, non-empty segment of a document with its position among the emitted chunks. */
public record TextChunk(String content, int index) {}
