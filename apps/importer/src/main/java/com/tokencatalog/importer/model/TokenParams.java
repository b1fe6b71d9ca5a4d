package com.tokencatalog.importer.model;

import com.tokencatalog.importer.entity.AddressHash;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Candidate token row from chain indexing. Null fields carry no opinion and leave the stored value
 * unchanged.
 */
@Value
@Builder(toBuilder = true)
public class TokenParams {
    AddressHash contractAddressHash;
    String name;
    String symbol;
    BigDecimal totalSupply;
    BigDecimal decimals;
    String type;
    Cataloged cataloged;
    Boolean skipMetadata;
    Boolean bridged;
    Long holderCount;
}
