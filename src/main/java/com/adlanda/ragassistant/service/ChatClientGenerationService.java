package com.adlanda.ragassistant.service;

import com.adlanda.ragassistant.exception.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;

/**
 * {@link GenerationService} backed by Spring AI's {@link ChatClient}.
 *
 * The instruction goes in the system message; context and question in the user message.
 */
@Service
public class ChatClientGenerationService implements GenerationService {

    private static final Logger log = LoggerFactory.getLogger(ChatClientGenerationService.class);

    private final ChatClient chatClient;

    public ChatClientGenerationService(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String generate(String instruction, String context, String question) {
        String userMessage = """
                Context:
                %s

                Question: %s
                """.formatted(context, question);

        String content;
        try {
            content = chatClient.prompt()
                    .system(instruction)
                    .user(userMessage)
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw new GenerationException("Language model call failed: " + e.getMessage(), e);
        }

        if (content == null) {
            throw new GenerationException("Language model returned no content");
        }
        log.debug("Generated answer of {} characters", content.length());
        return content;
    }
}
