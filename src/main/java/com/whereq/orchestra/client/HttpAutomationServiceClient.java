package com.whereq.orchestra.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.orchestra.config.OrchestraProperties;
import com.whereq.orchestra.exception.AutomationServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * WebClient implementation of {@link AutomationServiceClient}
 */
@Slf4j
@Service
public class HttpAutomationServiceClient implements AutomationServiceClient {

    private final WebClient webClient;
    private final Duration timeout;

    public HttpAutomationServiceClient(WebClient automationWebClient, OrchestraProperties properties) {
        this.webClient = automationWebClient;
        this.timeout = properties.getAutomationService().getTimeout();
    }

    @Override
    public Mono<GenerateResponse> generate(GenerateRequest request) {
        return post("/generate", request, GenerateResponse.class, "Generation service");
    }

    @Override
    public Mono<ValidationResponse> validate(String content) {
        return post("/validate", Map.of("content", content), ValidationResponse.class, "Validation service");
    }

    @Override
    public Mono<JsonNode> lint(String content) {
        return post("/lint", Map.of("content", content), JsonNode.class, "Lint service");
    }

    @Override
    public Mono<ExecuteResponse> execute(ExecuteRequest request) {
        return post("/execute", request, ExecuteResponse.class, "Execution service");
    }

    private <T> Mono<T> post(String path, Object body, Class<T> responseType, String service) {
        return webClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toServiceError(response, service))
            .bodyToMono(responseType)
            .switchIfEmpty(Mono.error(() -> new AutomationServiceException(
                service + " returned an empty response", 200)))
            .timeout(timeout)
            .onErrorMap(e -> !(e instanceof AutomationServiceException),
                e -> new AutomationServiceException(service + " call failed: " + describe(e), e))
            .doOnSuccess(r -> log.debug("{} call to {} succeeded", service, path))
            .doOnError(e -> log.warn("{} call to {} failed: {}", service, path, e.getMessage()));
    }

    private Mono<AutomationServiceException> toServiceError(ClientResponse response, String service) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(text -> new AutomationServiceException(
                service + " error: " + (text.isBlank() ? "HTTP " + status : text), status));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
