package com.tokencatalog.importer.entity;

import com.tokencatalog.importer.exception.TokenValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AddressHashTest {

    private static final String USDC = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";

    @Test
    void parsesAndPrintsLowercaseHex() {
        AddressHash hash = AddressHash.fromHex("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48");

        assertEquals(USDC, hash.toString());
        assertEquals(20, hash.toBytes().length);
        assertEquals(hash, AddressHash.fromHex(USDC));
        assertEquals(hash.hashCode(), AddressHash.fromHex(USDC).hashCode());
    }

    @Test
    void rejectsMalformedHex() {
        assertThrows(TokenValidationException.class, () -> AddressHash.fromHex(null));
        assertThrows(TokenValidationException.class, () -> AddressHash.fromHex("a0b86991c6218b36c1d19d4a2e9eb0ce3606eb48"));
        assertThrows(TokenValidationException.class, () -> AddressHash.fromHex("0xa0b8"));
        assertThrows(TokenValidationException.class, () -> AddressHash.fromHex("0xzzb86991c6218b36c1d19d4a2e9eb0ce3606eb48"));
        assertThrows(TokenValidationException.class, () -> AddressHash.of(new byte[32]));
    }

    @Test
    void ordersByUnsignedBytes() {
        AddressHash low = AddressHash.fromHex("0x0000000000000000000000000000000000000001");
        AddressHash mid = AddressHash.fromHex("0x7f00000000000000000000000000000000000000");
        AddressHash high = AddressHash.fromHex("0x8000000000000000000000000000000000000000");

        // 0x80 is negative as a signed byte but must sort after 0x7f, like bytea does
        assertTrue(mid.compareTo(high) < 0);
        assertTrue(low.compareTo(mid) < 0);

        List<AddressHash> keys = new ArrayList<>(List.of(high, low, mid));
        Collections.sort(keys);
        assertEquals(List.of(low, mid, high), keys);
    }

    @Test
    void bytesAreCopied() {
        byte[] raw = new byte[20];
        AddressHash hash = AddressHash.of(raw);
        raw[0] = 1;
        hash.toBytes()[1] = 1;

        assertNotEquals(AddressHash.of(raw), hash);
        assertEquals(AddressHash.of(new byte[20]), hash);
    }
}
