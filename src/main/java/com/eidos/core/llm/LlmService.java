package com.eidos.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;

/**
 * Thin wrapper over Spring AI's {@link ChatClient} used by the gated LLM areas.
 * <p>
 * {@link #textCall} returns raw model text; {@link #structuredCall} uses
 * {@link BeanOutputConverter} to append JSON format instructions and
 * deserialize the response, falling back to lenient Jackson parsing.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    static final String PROVIDER = "openai";

    private final ChatClient chatClient;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("LlmService initialized, OpenAI base-url: {}", baseUrl);
    }

    /** Name reported in {@link LlmAreaResult#provider()}. */
    public String provider() {
        return PROVIDER;
    }

    /**
     * Sends a system + user prompt and returns the raw response text.
     *
     * @throws LlmEmptyResponseException when the model returns nothing
     */
    public String textCall(String systemPrompt, String userPrompt) {
        log.debug("LLM text call started");
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.debug("LLM text call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for text call");
        }
        return response;
    }

    /**
     * Sends a system + user prompt to the LLM and returns the response
     * deserialized into the given {@code outputType}.
     *
     * @param systemPrompt instructions for the LLM's role / behaviour
     * @param userPrompt   the request text
     * @param outputType   the Java class (record or POJO) to deserialize into
     * @param <T>          target type
     * @return an instance of {@code T} populated from the LLM's JSON response
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.debug("LLM call started → {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.debug("LLM call complete → {} ({}s)", outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName()
                    + ". Check that the model is running and supports structured JSON output.");
        }
        try {
            return converter.convert(response);
        } catch (Exception e) {
            log.warn("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    /**
     * Fallback JSON parsing using Jackson ObjectMapper with lenient settings.
     */
    private <T> T parseWithJackson(String json, Class<T> outputType) {
        try {
            var mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
            mapper.registerModule(new ParameterNamesModule());
            T result = mapper.readValue(stripFence(json), outputType);
            log.debug("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e2) {
            log.error("Jackson fallback parsing FAILED for {}: {}", outputType.getSimpleName(), e2.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e2.getMessage(), e2);
        }
    }

    /**
     * Removes a surrounding markdown code fence (with or without a language tag).
     */
    public static String stripFence(String text) {
        String raw = text == null ? "" : text.strip();
        if (!raw.startsWith("```")) {
            return raw;
        }
        String[] lines = raw.split("\\R", -1);
        int from = 1;
        int to = lines.length;
        if (to > from && lines[to - 1].strip().startsWith("```")) {
            to--;
        }
        return String.join("\n", Arrays.copyOfRange(lines, from, Math.max(from, to))).strip();
    }
}
