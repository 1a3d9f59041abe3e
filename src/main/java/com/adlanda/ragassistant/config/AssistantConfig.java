package com.adlanda.ragassistant.config;

import com.adlanda.ragassistant.exception.ConfigurationException;
import com.adlanda.ragassistant.repository.ChunkStore;
import com.adlanda.ragassistant.repository.InMemoryChunkStore;
import com.adlanda.ragassistant.service.EmbeddingService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the store handle, the chat client and the shared infrastructure beans.
 */
@Configuration
public class AssistantConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId zoneId(RagProperties properties) {
        try {
            return ZoneId.of(properties.getTimeZone());
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid assistant.time-zone: " + properties.getTimeZone(), e);
        }
    }

    @Bean(destroyMethod = "close")
    public ChunkStore chunkStore(EmbeddingService embeddingService, ObjectMapper objectMapper, RagProperties properties) {
        String snapshot = properties.getStore().getSnapshotPath();
        Path snapshotPath = snapshot == null || snapshot.isBlank() ? null : Path.of(snapshot);
        return new InMemoryChunkStore(embeddingService, objectMapper, snapshotPath);
    }

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder) {
        return builder.build();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService generationExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("generation-"));
    }
}
