package com.tokencatalog.importer.repository;

import com.tokencatalog.importer.entity.AddressHash;
import com.tokencatalog.importer.entity.Token;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Reads go through JPA; writes go through {@link TokenRepositoryCustom}.
 */
@Repository
public interface TokenRepository extends JpaRepository<Token, AddressHash>, TokenRepositoryCustom {
}
