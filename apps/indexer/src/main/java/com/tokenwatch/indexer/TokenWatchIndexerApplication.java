package com.tokenwatch.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * TokenWatch Indexer Application
 * Keeps a bounded, reorg-aware window of token transfers in PostgreSQL and serves it over REST
 */
@SpringBootApplication
@EnableScheduling
public class TokenWatchIndexerApplication {

    private static final Logger logger = LoggerFactory.getLogger(TokenWatchIndexerApplication.class);

    public static void main(String[] args) {
        logger.info("Starting TokenWatch Indexer Application...");
        SpringApplication.run(TokenWatchIndexerApplication.class, args);
        logger.info("TokenWatch Indexer Application started successfully!");
    }
}
