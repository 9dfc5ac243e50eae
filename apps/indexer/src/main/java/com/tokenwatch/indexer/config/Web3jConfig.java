package com.tokenwatch.indexer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Builds the single HTTP Web3j client shared by the whole process.
 * Closed on application shutdown.
 */
@Configuration
public class Web3jConfig {

    private static final Logger logger = LoggerFactory.getLogger(Web3jConfig.class);

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(IndexerProperties properties) {
        properties.validate();
        logger.info("Initialized HTTP client for {}", properties.getRpcUrl());
        return Web3j.build(new HttpService(properties.getRpcUrl()));
    }
}
