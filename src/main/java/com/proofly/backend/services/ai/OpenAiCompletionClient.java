package com.proofly.backend.services.ai;

import java.time.Duration;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.responses.Response;
import com.openai.models.responses.ResponseCreateParams;
import com.openai.models.responses.ResponseOutputItem;
import com.proofly.backend.exceptions.AiServiceException;

import lombok.extern.slf4j.Slf4j;

/**
 * One {@link #complete} call sends the whole batch as one request. A failed request is re-sent
 * only while {@code openai.max-attempts} allows it (default 1); the SDK's own retries are off so
 * that setting is the only source of repeats.
 */
@Service
@Slf4j
public class OpenAiCompletionClient implements AiCompletionClient {

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.base-url:}")
    private String baseUrl;

    @Value("${openai.model:gpt-4o-mini}")
    private String model;

    @Value("${openai.max-tokens:4000}")
    private int maxTokens;

    @Value("${openai.temperature:0.1}")
    private double temperature;

    @Value("${openai.timeout-seconds:60}")
    private int timeoutSeconds;

    @Value("${openai.max-attempts:1}")
    private int maxAttempts;

    private volatile OpenAIClient client;

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String defaultModel() {
        return model;
    }

    @Override
    public AiCompletion complete(AiCompletionRequest request) {
        if (!isConfigured()) {
            throw new AiServiceException("AI service is not configured");
        }
        OpenAIClient c = getOrCreateClient(apiKey.trim());

        String useModel = request.model() != null ? request.model() : model;
        int useMaxTokens = request.maxTokens() != null ? request.maxTokens() : maxTokens;
        double useTemperature = request.temperature() != null ? request.temperature() : temperature;

        int attempts = Math.max(1, maxAttempts);
        Exception last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            long start = System.currentTimeMillis();
            try {
                ResponseCreateParams params = ResponseCreateParams.builder()
                        .model(useModel)
                        .instructions(request.systemPrompt())
                        .input(request.userPrompt())
                        .maxOutputTokens(useMaxTokens)
                        .temperature(useTemperature)
                        .build();

                Response response = c.responses().create(params);
                long elapsed = System.currentTimeMillis() - start;
                String output = extractOutputText(response);

                long in = response.usage().map(u -> u.inputTokens()).orElse(0L);
                long out = response.usage().map(u -> u.outputTokens()).orElse(0L);
                long total = response.usage().map(u -> u.totalTokens()).orElse(in + out);

                log.info("[OpenAI] completion ok model={} inputTokens={} outputTokens={} elapsedMs={}",
                        useModel, in, out, elapsed);
                return new AiCompletion(output, in, out, total, useModel, elapsed);
            } catch (Exception e) {
                last = e;
                long elapsed = System.currentTimeMillis() - start;
                log.error("[OpenAI] completion failed (attempt={} elapsedMs={}): {}", attempt, elapsed, e.toString());
                if (attempt < attempts) {
                    sleepBackoff(attempt);
                }
            }
        }
        throw new AiServiceException("AI service request failed", last);
    }

    private OpenAIClient getOrCreateClient(String key) {
        OpenAIClient current = client;
        if (current != null) return current;

        synchronized (this) {
            if (client != null) return client;
            OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder()
                    .apiKey(key)
                    .maxRetries(0)
                    .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)));
            if (baseUrl != null && !baseUrl.isBlank()) {
                builder.baseUrl(baseUrl.trim());
            }
            client = builder.build();
            return client;
        }
    }

    private static String extractOutputText(Response response) {
        if (response == null) return "";
        StringBuilder sb = new StringBuilder();
        List<ResponseOutputItem> output = response.output();
        if (output == null || output.isEmpty()) return "";

        for (ResponseOutputItem item : output) {
            if (item == null) continue;
            item.message().ifPresent(message -> {
                if (message.content() == null) return;
                for (var content : message.content()) {
                    if (content == null) continue;
                    content.outputText().ifPresent(t -> {
                        String v = t.text();
                        if (v != null && !v.isBlank()) {
                            if (!sb.isEmpty()) sb.append('\n');
                            sb.append(v);
                        }
                    });
                }
            });
        }
        return sb.toString();
    }

    private static void sleepBackoff(int attempt) {
        long ms = attempt == 1 ? 400 : 1200;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
