package com.bat.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;

/**
 * {@link ReasoningOracle} backed by Spring AI's {@link ChatClient}.
 * The provider and model come from the {@code spring.ai.*} configuration.
 */
@Service
public class ChatClientOracle implements ReasoningOracle {

    private static final Logger log = LoggerFactory.getLogger(ChatClientOracle.class);

    private final ChatClient chatClient;
    private final OracleProperties properties;

    public ChatClientOracle(ChatClient.Builder builder, OracleProperties properties) {
        this.chatClient = builder.build();
        this.properties = properties;
    }

    @Override
    public String query(String prompt) {
        long start = System.currentTimeMillis();
        var request = chatClient.prompt();
        if (properties.hasSystemPrompt()) {
            request = request.system(properties.getSystemPrompt());
        }
        String response = request.user(prompt).call().content();
        long elapsed = System.currentTimeMillis() - start;
        log.debug("Oracle responded in {}s", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new OracleEmptyResponseException("Oracle returned empty content. Check that the model is reachable.");
        }
        return response;
    }
}
