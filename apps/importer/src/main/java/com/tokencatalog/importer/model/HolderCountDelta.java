package com.tokencatalog.importer.model;

import com.tokencatalog.importer.entity.AddressHash;
import lombok.Value;

/**
 * Signed change to a token's holder count.
 */
@Value
public class HolderCountDelta {
    AddressHash contractAddressHash;
    long delta;
}
