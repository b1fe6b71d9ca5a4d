package com.tokencatalog.importer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Token catalog importer.
 * Merges indexed token metadata into the catalog and maintains holder counts.
 */
@SpringBootApplication
public class TokenCatalogImporterApplication {

    private static final Logger logger = LoggerFactory.getLogger(TokenCatalogImporterApplication.class);

    public static void main(String[] args) {
        logger.info("Starting token catalog importer...");
        SpringApplication.run(TokenCatalogImporterApplication.class, args);
        logger.info("Token catalog importer started");
    }
}
