package com.tokencatalog.importer.model;

import com.tokencatalog.importer.entity.AddressHash;
import lombok.Value;

@Value
public class TokenHolderCount {
    AddressHash contractAddressHash;
    Long holderCount;
}
