package com.zzf.selfpatch.llm;

import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.core.util.StringUtils;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * {@link LanguageModelOracle} backed by any OpenAI-compatible chat endpoint.
 */
@Slf4j
public class OpenAiLanguageModelOracle implements LanguageModelOracle {

    private final SelfPatchProperties.Oracle config;
    private volatile ChatModel model;

    public OpenAiLanguageModelOracle(SelfPatchProperties.Oracle config) {
        this.config = config;
    }

    OpenAiLanguageModelOracle(SelfPatchProperties.Oracle config, ChatModel model) {
        this.config = config;
        this.model = model;
    }

    @Override
    public String complete(String prompt, double temperature, int maxTokens) {
        long t0 = System.nanoTime();
        ChatRequest request = ChatRequest.builder()
                .messages(UserMessage.from(prompt))
                .temperature(temperature)
                .maxOutputTokens(maxTokens)
                .build();
        ChatResponse response;
        try {
            response = model().chat(request);
        } catch (OracleException e) {
            throw e;
        } catch (Exception e) {
            log.warn("oracle.call.fail model={} err={}", config.getModelName(), e.toString());
            throw new OracleException("Language model call failed: " + e.getMessage(), e);
        }
        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        long tookMs = (System.nanoTime() - t0) / 1_000_000L;
        if (StringUtils.isBlank(text)) {
            log.warn("oracle.reply.empty model={} tookMs={}", config.getModelName(), tookMs);
            throw new OracleException("Language model returned an empty reply");
        }
        log.info("oracle.reply model={} promptChars={} replyChars={} tookMs={}",
                config.getModelName(), prompt.length(), text.length(), tookMs);
        return text;
    }

    private ChatModel model() {
        ChatModel m = model;
        if (m == null) {
            synchronized (this) {
                m = model;
                if (m == null) {
                    m = OpenAiChatModel.builder()
                            .apiKey(resolveApiKey())
                            .baseUrl(config.getBaseUrl())
                            .modelName(config.getModelName())
                            .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                            .build();
                    model = m;
                }
            }
        }
        return m;
    }

    String resolveApiKey() {
        String fromConfig = config.getApiKey();
        if (fromConfig != null && fromConfig.trim().length() > 0) {
            return fromConfig.trim();
        }
        String fromEnv = System.getenv("OPENAI_API_KEY");
        if (fromEnv != null && fromEnv.trim().length() > 0) {
            return fromEnv.trim();
        }
        throw new OracleException("No API key configured (selfpatch.oracle.api-key or OPENAI_API_KEY)");
    }
}
