package com.proofly.backend.services.ai;

import com.proofly.backend.exceptions.AiServiceException;

/**
 * Opaque text-generation service. Implementations throw {@link AiServiceException} on any
 * transport, timeout or configuration failure.
 */
public interface AiCompletionClient {

    boolean isConfigured();

    String defaultModel();

    AiCompletion complete(AiCompletionRequest request);
}
