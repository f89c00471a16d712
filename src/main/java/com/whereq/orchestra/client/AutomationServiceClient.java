package com.whereq.orchestra.client;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * External generation / validation / execution service.
 * Every failure surfaces as {@link com.whereq.orchestra.exception.AutomationServiceException}.
 */
public interface AutomationServiceClient {

    Mono<GenerateResponse> generate(GenerateRequest request);

    Mono<ValidationResponse> validate(String content);

    Mono<JsonNode> lint(String content);

    Mono<ExecuteResponse> execute(ExecuteRequest request);
}
