package com.adlanda.ragassistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * RAG Assistant - Main Application
 *
 * Answers questions from chat messages and documents (PDF, DOCX, DOC) sent through chat,
 * grounding every answer in the most relevant stored chunks.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring AI for embeddings and chat generation via OpenAI
 * - Apache PDFBox and Apache Tika for text extraction
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class RagAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(RagAssistantApplication.class, args);
    }
}
