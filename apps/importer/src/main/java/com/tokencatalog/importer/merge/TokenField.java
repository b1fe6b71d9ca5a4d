package com.tokencatalog.importer.merge;

import com.tokencatalog.importer.entity.Token;
import com.tokencatalog.importer.model.TokenParams;

import java.math.BigDecimal;
import java.sql.Types;

/**
 * Columns of the {@code tokens} table as seen by the import path.
 *
 * <p>Values are exchanged in column form: {@code cataloged} as a nullable {@link Boolean},
 * the key as raw bytes.
 */
public enum TokenField {
    NAME("name", Types.VARCHAR, true),
    SYMBOL("symbol", Types.VARCHAR, true),
    TOTAL_SUPPLY("total_supply", Types.NUMERIC, true),
    DECIMALS("decimals", Types.NUMERIC, true),
    TYPE("type", Types.VARCHAR, true),
    CATALOGED("cataloged", Types.BOOLEAN, true),
    BRIDGED("bridged", Types.BOOLEAN, true),
    SKIP_METADATA("skip_metadata", Types.BOOLEAN, true),
    CONTRACT_ADDRESS_HASH("contract_address_hash", Types.BINARY, false),
    HOLDER_COUNT("holder_count", Types.BIGINT, false),
    INSERTED_AT("inserted_at", Types.TIMESTAMP, false),
    UPDATED_AT("updated_at", Types.TIMESTAMP, false);

    private final String column;
    private final int sqlType;
    private final boolean mergeable;

    TokenField(String column, int sqlType, boolean mergeable) {
        this.column = column;
        this.sqlType = sqlType;
        this.mergeable = mergeable;
    }

    public String column() {
        return column;
    }

    public int sqlType() {
        return sqlType;
    }

    /**
     * Whether the field may take part in a merge policy. The key, the holder count and the
     * timestamps never do.
     */
    public boolean isMergeable() {
        return mergeable;
    }

    public Object candidateValue(TokenParams params) {
        return switch (this) {
            case NAME -> params.getName();
            case SYMBOL -> params.getSymbol();
            case TOTAL_SUPPLY -> params.getTotalSupply();
            case DECIMALS -> params.getDecimals();
            case TYPE -> params.getType();
            case CATALOGED -> params.getCataloged() == null ? null : params.getCataloged().toColumn();
            case BRIDGED -> params.getBridged();
            case SKIP_METADATA -> params.getSkipMetadata();
            case CONTRACT_ADDRESS_HASH -> params.getContractAddressHash() == null
                    ? null : params.getContractAddressHash().toBytes();
            case HOLDER_COUNT -> params.getHolderCount();
            case INSERTED_AT, UPDATED_AT -> throw new UnsupportedOperationException(
                    "Candidates do not carry " + column + "; it comes from the import timestamps");
        };
    }

    public Object existingValue(Token token) {
        return switch (this) {
            case NAME -> token.getName();
            case SYMBOL -> token.getSymbol();
            case TOTAL_SUPPLY -> token.getTotalSupply();
            case DECIMALS -> token.getDecimals();
            case TYPE -> token.getType();
            case CATALOGED -> token.getCataloged();
            case BRIDGED -> token.getBridged();
            case SKIP_METADATA -> token.getSkipMetadata();
            case CONTRACT_ADDRESS_HASH -> token.getContractAddressHash() == null
                    ? null : token.getContractAddressHash().toBytes();
            case HOLDER_COUNT -> token.getHolderCount();
            case INSERTED_AT -> token.getInsertedAt();
            case UPDATED_AT -> token.getUpdatedAt();
        };
    }

    /**
     * Writes a merged column value back onto a token. Only mergeable fields are assignable.
     */
    void assign(Token token, Object value) {
        switch (this) {
            case NAME -> token.setName((String) value);
            case SYMBOL -> token.setSymbol((String) value);
            case TOTAL_SUPPLY -> token.setTotalSupply((BigDecimal) value);
            case DECIMALS -> token.setDecimals((BigDecimal) value);
            case TYPE -> token.setType((String) value);
            case CATALOGED -> token.setCataloged((Boolean) value);
            case BRIDGED -> token.setBridged((Boolean) value);
            case SKIP_METADATA -> token.setSkipMetadata((Boolean) value);
            default -> throw new IllegalArgumentException(column + " is not a mergeable field");
        }
    }
}
