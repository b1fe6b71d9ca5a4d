package com.tokencatalog.importer.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokencatalog.importer.entity.AddressHash;
import com.tokencatalog.importer.entity.Token;
import com.tokencatalog.importer.exception.TokenValidationException;
import com.tokencatalog.importer.model.Cataloged;
import com.tokencatalog.importer.model.HolderCountDelta;
import com.tokencatalog.importer.model.ImportOptions;
import com.tokencatalog.importer.model.TokenHolderCount;
import com.tokencatalog.importer.model.TokenParams;
import com.tokencatalog.importer.service.TokenHolderCountService;
import com.tokencatalog.importer.service.TokenImportRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns JSON batches from the indexer into import calls.
 *
 * <p>A missing or null member means "no opinion" and leaves the stored value alone. Any malformed
 * entry rejects the whole batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenImportHandler {

    private final TokenImportRunner importRunner;
    private final TokenHolderCountService holderCountService;

    public List<Token> handleTokens(JsonNode tokensNode, ImportOptions options) {
        List<TokenParams> batch = new ArrayList<>();
        for (JsonNode tokenNode : requireArray(tokensNode, "tokens")) {
            batch.add(parseToken(tokenNode));
        }
        log.info("Received {} token candidates", batch.size());
        return importRunner.run(batch, options);
    }

    public List<TokenHolderCount> handleHolderCountDeltas(JsonNode deltasNode, ImportOptions options) {
        List<HolderCountDelta> deltas = new ArrayList<>();
        for (JsonNode deltaNode : requireArray(deltasNode, "holder count deltas")) {
            deltas.add(parseDelta(deltaNode));
        }
        log.info("Received {} holder count deltas", deltas.size());
        return holderCountService.applyDeltas(deltas, options);
    }

    TokenParams parseToken(JsonNode node) {
        AddressHash hash = parseAddress(node);
        return TokenParams.builder()
                .contractAddressHash(hash)
                .name(parseText(node, "name"))
                .symbol(parseText(node, "symbol"))
                .totalSupply(parseBigDecimal(hash, node, "totalSupply"))
                .decimals(parseBigDecimal(hash, node, "decimals"))
                .type(parseText(node, "type"))
                .cataloged(parseCataloged(hash, node))
                .skipMetadata(parseBoolean(hash, node, "skipMetadata"))
                .bridged(parseBoolean(hash, node, "bridged"))
                .holderCount(parseLong(hash, node, "holderCount"))
                .build();
    }

    HolderCountDelta parseDelta(JsonNode node) {
        AddressHash hash = parseAddress(node);
        Long delta = parseLong(hash, node, "delta");
        if (delta == null) {
            throw new TokenValidationException(hash, "delta is missing");
        }
        return new HolderCountDelta(hash, delta);
    }

    private static Iterable<JsonNode> requireArray(JsonNode node, String what) {
        if (node == null || !node.isArray()) {
            throw new TokenValidationException(null, "Expected a JSON array of " + what);
        }
        return node;
    }

    private static AddressHash parseAddress(JsonNode node) {
        String text = parseText(node, "contractAddressHash");
        if (text == null) {
            throw new TokenValidationException(null, "contractAddressHash is missing");
        }
        return AddressHash.fromHex(text.toLowerCase());
    }

    private static boolean isAbsent(JsonNode field) {
        return field == null || field.isNull() || field.isMissingNode();
    }

    private static String parseText(JsonNode node, String fieldName) {
        JsonNode field = node.get(fieldName);
        return isAbsent(field) ? null : field.asText();
    }

    private static BigDecimal parseBigDecimal(AddressHash hash, JsonNode node, String fieldName) {
        JsonNode field = node.get(fieldName);
        if (isAbsent(field)) {
            return null;
        }
        try {
            return new BigDecimal(field.asText());
        } catch (NumberFormatException e) {
            throw new TokenValidationException(hash, "Invalid " + fieldName + ": " + field.asText(), e);
        }
    }

    private static Long parseLong(AddressHash hash, JsonNode node, String fieldName) {
        JsonNode field = node.get(fieldName);
        if (isAbsent(field)) {
            return null;
        }
        if (!field.canConvertToLong() || !field.isIntegralNumber()) {
            throw new TokenValidationException(hash, "Invalid " + fieldName + ": " + field);
        }
        return field.asLong();
    }

    private static Boolean parseBoolean(AddressHash hash, JsonNode node, String fieldName) {
        JsonNode field = node.get(fieldName);
        if (isAbsent(field)) {
            return null;
        }
        if (!field.isBoolean()) {
            throw new TokenValidationException(hash, "Invalid " + fieldName + ": " + field);
        }
        return field.asBoolean();
    }

    private static Cataloged parseCataloged(AddressHash hash, JsonNode node) {
        Boolean cataloged = parseBoolean(hash, node, "cataloged");
        return cataloged == null ? null : Cataloged.fromColumn(cataloged);
    }
}
