package com.tokencatalog.importer.repository;

import com.tokencatalog.importer.config.TokenImportProperties;
import com.tokencatalog.importer.entity.AddressHash;
import com.tokencatalog.importer.entity.Token;
import com.tokencatalog.importer.merge.MergePolicy;
import com.tokencatalog.importer.merge.TokenField;
import com.tokencatalog.importer.model.HolderCountDelta;
import com.tokencatalog.importer.model.TokenHolderCount;
import com.tokencatalog.importer.model.TokenParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * JDBC implementation of the bulk token writes.
 */
public class TokenRepositoryCustomImpl implements TokenRepositoryCustom {

    private static final Logger log = LoggerFactory.getLogger(TokenRepositoryCustomImpl.class);

    static final String ALIAS = "token";

    private static final String SELECT_COLUMNS = """
            contract_address_hash, name, symbol, total_supply, decimals, type, cataloged,
            skip_metadata, bridged, holder_count, inserted_at, updated_at""";

    // Locks the rows FOR NO KEY UPDATE in key order before the join updates them, so concurrent
    // delta batches and upserts queue up in the same direction.
    private static final String APPLY_DELTAS_SQL = """
            UPDATE tokens AS token
            SET holder_count = token.holder_count + deltas.delta,
                updated_at = ?
            FROM (SELECT unnest(?::bytea[]) AS contract_address_hash, unnest(?::bigint[]) AS delta) AS deltas
            WHERE token.contract_address_hash = deltas.contract_address_hash
              AND token.contract_address_hash IN (
                  SELECT locked.contract_address_hash
                  FROM tokens AS locked
                  WHERE locked.contract_address_hash = ANY(?::bytea[])
                    AND locked.holder_count IS NOT NULL
                  ORDER BY locked.contract_address_hash
                  FOR NO KEY UPDATE)
              AND token.holder_count IS NOT NULL
            RETURNING token.contract_address_hash, token.holder_count
            """;

    // one array parameter, so the key count is not bounded by the bind-parameter limit
    private static final String FIND_ROWS_SQL = "SELECT " + SELECT_COLUMNS
            + " FROM tokens WHERE contract_address_hash = ANY(?::bytea[]) ORDER BY contract_address_hash";

    private static final RowMapper<Token> TOKEN_ROW_MAPPER = (rs, rowNum) -> {
        Token token = new Token();
        token.setContractAddressHash(AddressHash.of(rs.getBytes("contract_address_hash")));
        token.setName(rs.getString("name"));
        token.setSymbol(rs.getString("symbol"));
        token.setTotalSupply(rs.getBigDecimal("total_supply"));
        token.setDecimals(rs.getBigDecimal("decimals"));
        token.setType(rs.getString("type"));
        token.setCataloged(rs.getObject("cataloged", Boolean.class));
        token.setSkipMetadata(rs.getObject("skip_metadata", Boolean.class));
        token.setBridged(rs.getObject("bridged", Boolean.class));
        token.setHolderCount(rs.getObject("holder_count", Long.class));
        token.setInsertedAt(toInstant(rs.getTimestamp("inserted_at")));
        token.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
        return token;
    };

    private static final RowMapper<TokenHolderCount> HOLDER_COUNT_ROW_MAPPER = (rs, rowNum) ->
            new TokenHolderCount(AddressHash.of(rs.getBytes(1)), rs.getLong(2));

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final TokenImportProperties properties;

    public TokenRepositoryCustomImpl(JdbcTemplate jdbcTemplate,
                                     NamedParameterJdbcTemplate namedJdbcTemplate,
                                     TokenImportProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = namedJdbcTemplate;
        this.properties = properties;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public List<Token> upsertAll(List<TokenParams> orderedBatch, MergePolicy policy,
                                 Instant insertedAt, Instant updatedAt, Duration timeout) {
        if (orderedBatch.isEmpty()) {
            return List.of();
        }
        long deadline = deadline(timeout);

        List<TokenField> columns = insertColumns(policy);
        Map<AddressHash, Token> rows = new HashMap<>();
        int chunkSize = Math.max(1, properties.getUpsertChunkSize());
        for (int from = 0; from < orderedBatch.size(); from += chunkSize) {
            List<TokenParams> chunk = orderedBatch.subList(from, Math.min(from + chunkSize, orderedBatch.size()));
            applyTimeout(deadline, timeout);
            String sql = upsertSql(columns, chunk.size(), policy);
            MapSqlParameterSource params = upsertParams(columns, chunk, insertedAt, updatedAt);
            for (Token token : namedJdbcTemplate.query(sql, params, TOKEN_ROW_MAPPER)) {
                rows.put(token.getContractAddressHash(), token);
            }
        }
        int written = rows.size();

        // RETURNING skips rows the write guard left alone; read them back under the same locks
        List<AddressHash> untouched = orderedBatch.stream()
                .map(TokenParams::getContractAddressHash)
                .filter(key -> !rows.containsKey(key))
                .toList();
        if (!untouched.isEmpty()) {
            applyTimeout(deadline, timeout);
            for (Token token : findRows(untouched)) {
                rows.put(token.getContractAddressHash(), token);
            }
        }
        log.debug("Upserted tokens: batch={}, written={}, unchanged={}",
                orderedBatch.size(), written, untouched.size());

        List<Token> result = new ArrayList<>(orderedBatch.size());
        for (TokenParams params : orderedBatch) {
            Token token = rows.get(params.getContractAddressHash());
            if (token != null) {
                result.add(token);
            }
        }
        return result;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public List<TokenHolderCount> applyHolderCountDeltas(List<HolderCountDelta> orderedDeltas,
                                                         Instant updatedAt, Duration timeout) {
        if (orderedDeltas.isEmpty()) {
            return List.of();
        }
        applyTimeout(deadline(timeout), timeout);

        byte[][] hashes = new byte[orderedDeltas.size()][];
        Long[] deltas = new Long[orderedDeltas.size()];
        for (int i = 0; i < orderedDeltas.size(); i++) {
            hashes[i] = orderedDeltas.get(i).getContractAddressHash().toBytes();
            deltas[i] = orderedDeltas.get(i).getDelta();
        }

        List<TokenHolderCount> counts = jdbcTemplate.query(con -> {
            PreparedStatement ps = con.prepareStatement(APPLY_DELTAS_SQL);
            Array hashArray = con.createArrayOf("bytea", hashes);
            ps.setTimestamp(1, Timestamp.from(updatedAt));
            ps.setArray(2, hashArray);
            ps.setArray(3, con.createArrayOf("bigint", deltas));
            ps.setArray(4, hashArray);
            return ps;
        }, HOLDER_COUNT_ROW_MAPPER);

        List<TokenHolderCount> ordered = new ArrayList<>(counts);
        ordered.sort((a, b) -> a.getContractAddressHash().compareTo(b.getContractAddressHash()));
        return ordered;
    }

    @Override
    public List<Token> findRows(Collection<AddressHash> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        byte[][] hashes = keys.stream().map(AddressHash::toBytes).toArray(byte[][]::new);
        return jdbcTemplate.query(con -> {
            PreparedStatement ps = con.prepareStatement(FIND_ROWS_SQL);
            ps.setArray(1, con.createArrayOf("bytea", hashes));
            return ps;
        }, TOKEN_ROW_MAPPER);
    }

    /**
     * Bounds the next statement by what is left of the call's budget, so a call made of several
     * statements still fails within {@code timeout} overall.
     */
    private void applyTimeout(long deadline, Duration timeout) {
        long ms = remainingMillis(deadline, System.nanoTime(), timeout);
        jdbcTemplate.execute("SET LOCAL lock_timeout = " + ms);
        jdbcTemplate.execute("SET LOCAL statement_timeout = " + ms);
    }

    private static long deadline(Duration timeout) {
        return System.nanoTime() + timeout.toNanos();
    }

    static long remainingMillis(long deadline, long now, Duration timeout) {
        long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - now);
        // 0 would switch the timeout off
        if (remaining <= 0) {
            throw new QueryTimeoutException("Token import exceeded its timeout of " + timeout.toMillis() + " ms");
        }
        return remaining;
    }

    static List<TokenField> insertColumns(MergePolicy policy) {
        List<TokenField> columns = new ArrayList<>();
        columns.add(TokenField.CONTRACT_ADDRESS_HASH);
        columns.addAll(policy.fieldSet().fields());
        columns.add(TokenField.HOLDER_COUNT);
        columns.add(TokenField.INSERTED_AT);
        columns.add(TokenField.UPDATED_AT);
        return columns;
    }

    static String upsertSql(List<TokenField> columns, int rows, MergePolicy policy) {
        String columnList = columns.stream().map(TokenField::column).collect(Collectors.joining(", "));
        StringBuilder values = new StringBuilder();
        for (int i = 0; i < rows; i++) {
            if (i > 0) {
                values.append(",\n       ");
            }
            final int row = i;
            values.append(columns.stream()
                    .map(c -> ":" + paramName(c, row))
                    .collect(Collectors.joining(", ", "(", ")")));
        }
        return "INSERT INTO tokens AS " + ALIAS + " (" + columnList + ")\n"
                + "VALUES " + values + "\n"
                + "ON CONFLICT (contract_address_hash) " + policy.conflictAction(ALIAS) + "\n"
                + "RETURNING " + SELECT_COLUMNS;
    }

    private static MapSqlParameterSource upsertParams(List<TokenField> columns, List<TokenParams> chunk,
                                                      Instant insertedAt, Instant updatedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        for (int row = 0; row < chunk.size(); row++) {
            TokenParams candidate = chunk.get(row);
            for (TokenField column : columns) {
                Object value = switch (column) {
                    case INSERTED_AT -> Timestamp.from(insertedAt);
                    case UPDATED_AT -> Timestamp.from(updatedAt);
                    default -> column.candidateValue(candidate);
                };
                params.addValue(paramName(column, row), value, column.sqlType());
            }
        }
        return params;
    }

    private static String paramName(TokenField column, int row) {
        return column.column() + "_" + row;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
