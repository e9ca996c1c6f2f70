package com.certextract.infrastructure.ai.openai;

import com.certextract.infrastructure.ai.LlmCallResult;
import com.certextract.infrastructure.resilience.ExtractionTransportException;
import com.openai.client.OpenAIClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionContentPart;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Raw OpenAI chat call in JSON mode. Transport problems surface as
 * {@link ExtractionTransportException}; an empty answer comes back as empty content.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiExtractionClient {

    private static final double TEMPERATURE = 0.0;

    private final ObjectProvider<OpenAIClient> clientProvider;

    public boolean isAvailable() {
        return clientProvider.getIfAvailable() != null;
    }

    public LlmCallResult complete(String model, String systemPrompt, String userMessage, int maxTokens) {
        var builder = baseParams(model, systemPrompt, maxTokens).addUserMessage(userMessage);
        return call(model, builder.build());
    }

    public LlmCallResult completeWithParts(String model, String systemPrompt,
                                           List<ChatCompletionContentPart> parts, int maxTokens) {
        var builder = baseParams(model, systemPrompt, maxTokens).addUserMessageOfArrayOfContentParts(parts);
        return call(model, builder.build());
    }

    private ChatCompletionCreateParams.Builder baseParams(String model, String systemPrompt, int maxTokens) {
        return ChatCompletionCreateParams.builder()
                .model(model)
                .temperature(TEMPERATURE)
                .maxCompletionTokens(maxTokens)
                .responseFormat(ResponseFormatJsonObject.builder().build())
                .addSystemMessage(systemPrompt);
    }

    private LlmCallResult call(String model, ChatCompletionCreateParams params) {
        OpenAIClient client = clientProvider.getIfAvailable();
        if (client == null) {
            throw new ExtractionTransportException("OpenAI client is not configured");
        }
        try {
            ChatCompletion completion = client.chat().completions().create(params);

            long promptTokens = 0;
            long completionTokens = 0;
            if (completion.usage().isPresent()) {
                var usage = completion.usage().get();
                promptTokens = usage.promptTokens();
                completionTokens = usage.completionTokens();
                log.info("[OpenAI] Token usage [{}] - prompt: {}, completion: {}, total: {}",
                        model, promptTokens, completionTokens, usage.totalTokens());
            }

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElse("");

            return new LlmCallResult(content.trim(), promptTokens, completionTokens);
        } catch (RuntimeException e) {
            log.error("[OpenAI] API call failed [{}]: {}", model, e.getMessage());
            throw new ExtractionTransportException("OpenAI call failed [" + model + "]: " + e.getMessage(), e);
        }
    }
}
