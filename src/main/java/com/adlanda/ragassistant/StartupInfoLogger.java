package com.adlanda.ragassistant;

import com.adlanda.ragassistant.repository.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after DirectoryIngestionRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final ChunkStore chunkStore;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(ChunkStore chunkStore) {
        this.chunkStore = chunkStore;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            RAG Assistant v{}
            Store: {} chunks

            API Endpoints:
              GET  http://localhost:{}/api/v1
              POST http://localhost:{}/api/v1/messages
              POST http://localhost:{}/api/v1/documents
              POST http://localhost:{}/api/v1/query
              GET  http://localhost:{}/api/v1/sources

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, chunkStore.count(), port, port, port, port, port, port
        );
    }
}
