package com.tokencatalog.importer.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.tokencatalog.importer.exception.TokenValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import org.web3j.utils.Numeric;

import java.io.Serializable;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * 20-byte contract address, the primary key of a token row.
 *
 * <p>Ordering is unsigned lexicographic over the raw bytes, which is how PostgreSQL orders
 * {@code bytea}. Every lock-taking path sorts by this ordering.
 */
@Embeddable
public class AddressHash implements Serializable, Comparable<AddressHash> {

    public static final int LENGTH = 20;

    private static final Pattern HEX = Pattern.compile("0x[0-9a-fA-F]{" + (LENGTH * 2) + "}");

    @Column(name = "contract_address_hash", nullable = false, updatable = false, length = LENGTH)
    private byte[] bytes;

    protected AddressHash() {
        // JPA
    }

    private AddressHash(byte[] bytes) {
        this.bytes = bytes;
    }

    public static AddressHash of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new TokenValidationException(null,
                    "Address must be " + LENGTH + " bytes, got " + (bytes == null ? "null" : bytes.length));
        }
        return new AddressHash(bytes.clone());
    }

    @JsonCreator
    public static AddressHash fromHex(String hex) {
        if (hex == null || !HEX.matcher(hex).matches()) {
            throw new TokenValidationException(null, "Malformed address: " + hex);
        }
        return new AddressHash(Numeric.hexStringToByteArray(hex));
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    @Override
    public int compareTo(AddressHash other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AddressHash)) {
            return false;
        }
        return Arrays.equals(bytes, ((AddressHash) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @JsonValue
    @Override
    public String toString() {
        return Numeric.toHexString(bytes);
    }
}
