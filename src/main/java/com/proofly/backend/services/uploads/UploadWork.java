package com.proofly.backend.services.uploads;

import java.util.UUID;

import com.proofly.backend.enums.SourcePlatform;

/** Snapshot of what the pipeline needs from an upload, read once after the status gate is won. */
public record UploadWork(UUID uploadId, UUID userId, String filename, byte[] content, SourcePlatform source) {}
