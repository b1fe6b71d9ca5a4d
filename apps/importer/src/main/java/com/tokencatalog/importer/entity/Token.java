package com.tokencatalog.importer.entity;

import com.tokencatalog.importer.model.Cataloged;
import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Catalog row for a token contract.
 *
 * <p>Rows are written through {@code TokenRepositoryCustom}, never through {@code save}, so there
 * are no lifecycle callbacks touching the timestamps here.
 */
@Data
@Entity
@Table(name = "tokens")
public class Token {

    @EmbeddedId
    private AddressHash contractAddressHash;

    @Column(name = "name")
    private String name;

    @Column(name = "symbol")
    private String symbol;

    @Column(name = "total_supply")
    private BigDecimal totalSupply;

    @Column(name = "decimals")
    private BigDecimal decimals;

    @Column(name = "type")
    private String type;

    // null means not known yet
    @Column(name = "cataloged")
    private Boolean cataloged;

    @Column(name = "skip_metadata")
    private Boolean skipMetadata;

    @Column(name = "bridged")
    private Boolean bridged;

    // null until initialized by the holder count backfill
    @Column(name = "holder_count")
    private Long holderCount;

    @Column(name = "inserted_at", nullable = false)
    private Instant insertedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Cataloged getCatalogedState() {
        return Cataloged.fromColumn(cataloged);
    }
}
