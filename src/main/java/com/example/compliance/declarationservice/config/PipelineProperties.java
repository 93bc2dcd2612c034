package com.example.compliance.declarationservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings for the declaration pipeline. Injected into each component instead
 * of being read from scattered properties.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    /**
     * Mongo collection holding indexed declaration chunks.
     */
    private String collectionName = "declaration_chunks";

    private Chunking chunking = new Chunking();

    private Generation generation = new Generation();

    private Mentions mentions = new Mentions();

    private Vector vector = new Vector();

    @Data
    public static class Chunking {
        /**
         * Words per chunk.
         */
        private int size = 300;

        /**
         * Words shared by consecutive chunks, must be smaller than size.
         */
        private int overlap = 50;
    }

    @Data
    public static class Generation {
        /**
         * Chunks retrieved per extraction field.
         */
        private int maxResults = 3;

        private double temperature = 0.4;

        private int maxTokens = 2048;
    }

    @Data
    public static class Mentions {
        /**
         * Lines captured on each side of the first matching line.
         */
        private int windowLines = 50;

        /**
         * Ask the model to judge compliance for each scanned snippet.
         */
        private boolean assessWithModel = true;

        private double temperature = 0.0;

        private int maxTokens = 700;
    }

    @Data
    public static class Vector {
        /**
         * Use Atlas $vectorSearch; otherwise rank by cosine in process.
         */
        private boolean useAtlasVector = false;

        private String indexName = "vector_index";

        private int numCandidatesFactor = 40;
    }
}
