package com.priceintel.harvester.identity;

import com.priceintel.harvester.model.IdentityKey;
import com.priceintel.harvester.model.IdentityType;
import com.priceintel.harvester.model.SourceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class IdentityEngineTest {

    private final IdentityEngine engine = new IdentityEngine();

    @Nested
    @DisplayName("deriveIdentity()")
    class DeriveIdentity {

        @Test
        @DisplayName("network item id outranks SKU and URL")
        void networkItemFirst() {
            SourceRecord record = SourceRecord.builder()
                    .networkItemId(" 99812 ").sku("abc 1").url("https://shop.example.com/p").build();

            assertEquals(new IdentityKey(IdentityType.NETWORK_ITEM_ID, "99812"), engine.deriveIdentity(record));
        }

        @Test
        @DisplayName("SKU is upper-cased with whitespace runs turned into dashes")
        void skuNormalized() {
            SourceRecord record = SourceRecord.builder().sku(" fed  9mm 115 ").url("https://shop.example.com/p").build();

            IdentityKey key = engine.deriveIdentity(record);

            assertEquals(IdentityType.SKU, key.type());
            assertEquals("SKU:FED-9MM-115", key.asString());
        }

        @Test
        @DisplayName("URL identity ignores tracking parameters, param order and trailing slashes")
        void urlHashStable() {
            SourceRecord a = SourceRecord.builder()
                    .url("HTTPS://Shop.Example.com/p/9mm/?b=2&utm_source=mail&a=1&gclid=xyz").build();
            SourceRecord b = SourceRecord.builder()
                    .url("https://shop.example.com/p/9mm?a=1&b=2").build();

            assertEquals(IdentityType.URL_HASH, engine.deriveIdentity(a).type());
            assertEquals(engine.deriveIdentity(a), engine.deriveIdentity(b));
        }

        @Test
        @DisplayName("a record with no identity source is rejected")
        void noSource() {
            assertThrows(IllegalArgumentException.class, () -> engine.deriveIdentity(SourceRecord.builder().build()));
        }
    }

    @Test
    @DisplayName("canonical URL keeps path case and drops only tracking params")
    void canonicalUrl() {
        assertEquals("https://shop.example.com:8443/P/Item?color=Red&size=L",
                engine.canonicalizeUrl("https://SHOP.example.com:8443/P/Item/?size=L&irclickid=1&color=Red&fbclid=2"));
    }

    @Nested
    @DisplayName("priceSignature()")
    class PriceSignature {

        @Test
        @DisplayName("hashes price|CURRENCY at two decimals")
        void material() {
            assertEquals("18.99|USD", engine.signatureMaterial(new BigDecimal("18.99"), "usd", null));
            assertEquals("18.99|USD", engine.signatureMaterial(new BigDecimal("18.985"), null, null));
            assertEquals("18.99|USD|24.00", engine.signatureMaterial(new BigDecimal("18.99"), "USD", new BigDecimal("24")));
            assertEquals(Hashing.sha256Hex("18.99|USD"), engine.priceSignature(new BigDecimal("18.990"), "USD", null));
        }

        @Test
        @DisplayName("different original price → different signature")
        void originalPriceMatters() {
            assertNotEquals(engine.priceSignature(new BigDecimal("18.99"), "USD", null),
                    engine.priceSignature(new BigDecimal("18.99"), "USD", new BigDecimal("21.99")));
        }
    }
}
