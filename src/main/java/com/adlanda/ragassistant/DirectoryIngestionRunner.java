package com.adlanda.ragassistant;

import com.adlanda.ragassistant.config.RagProperties;
import com.adlanda.ragassistant.model.IngestionReport;
import com.adlanda.ragassistant.service.IngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Ingests the documents of a local directory on application startup.
 *
 * Disabled unless assistant.ingestion.bootstrap-path is set.
 */
@Component
@Order(1) // Run before StartupInfoLogger
public class DirectoryIngestionRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DirectoryIngestionRunner.class);

    private final IngestionService ingestionService;
    private final RagProperties properties;

    public DirectoryIngestionRunner(IngestionService ingestionService, RagProperties properties) {
        this.ingestionService = ingestionService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        String bootstrapPath = properties.getIngestion().getBootstrapPath();
        if (bootstrapPath == null || bootstrapPath.isBlank()) {
            log.debug("No bootstrap path configured, skipping startup ingestion");
            return;
        }

        log.info("Starting document ingestion from {}...", bootstrapPath);
        List<IngestionReport> reports = ingestionService.ingestDirectory(Path.of(bootstrapPath));

        long skipped = reports.stream().filter(IngestionReport::skipped).count();
        int chunks = reports.stream().mapToInt(IngestionReport::chunksProduced).sum();
        log.info("Startup ingestion complete: {} documents ({} unchanged), {} chunks indexed",
                reports.size(), skipped, chunks);
    }
}
