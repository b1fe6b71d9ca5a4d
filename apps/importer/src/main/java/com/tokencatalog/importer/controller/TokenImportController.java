package com.tokencatalog.importer.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokencatalog.importer.entity.Token;
import com.tokencatalog.importer.model.ImportOptions;
import com.tokencatalog.importer.model.TokenHolderCount;
import com.tokencatalog.importer.sync.TokenImportHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;

/**
 * HTTP intake for indexer batches.
 */
@Slf4j
@RestController
@RequestMapping("/api/tokens")
@RequiredArgsConstructor
public class TokenImportController {

    private final TokenImportHandler importHandler;

    /**
     * POST /api/tokens/import
     *
     * @param timeoutMs overrides the configured timeout for this call
     * @return current rows for every token in the batch
     */
    @PostMapping("/import")
    public ResponseEntity<List<Token>> importTokens(@RequestBody JsonNode body,
                                                    @RequestParam(required = false) Long timeoutMs) {
        log.debug("Received token import request");
        return ResponseEntity.ok(importHandler.handleTokens(body, options(timeoutMs)));
    }

    /**
     * POST /api/tokens/holder-counts/deltas
     *
     * @return new holder counts of the tokens that were updated
     */
    @PostMapping("/holder-counts/deltas")
    public ResponseEntity<List<TokenHolderCount>> applyHolderCountDeltas(@RequestBody JsonNode body,
                                                                         @RequestParam(required = false) Long timeoutMs) {
        log.debug("Received holder count delta request");
        return ResponseEntity.ok(importHandler.handleHolderCountDeltas(body, options(timeoutMs)));
    }

    private static ImportOptions options(Long timeoutMs) {
        return ImportOptions.builder()
                .timeout(timeoutMs != null ? Duration.ofMillis(timeoutMs) : null)
                .build();
    }
}
