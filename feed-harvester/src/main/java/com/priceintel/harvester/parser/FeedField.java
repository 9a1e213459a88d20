package com.priceintel.harvester.parser;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Logical product fields and the column names retailers use for them, in lookup order.
 *
 * The {@link #key()} is the name used in quarantine snapshots and operator corrections.
 */
public enum FeedField {

    TITLE("title", "Name", "ProductName", "Product Name", "PRODUCT_NAME", "product_name", "Title", "title"),
    URL("url", "Url", "URL", "ProductURL", "Product URL", "ProductUrl", "Link", "link", "url"),
    SALE_PRICE("salePrice", "SalePrice", "Sale Price", "sale_price", "CurrentPrice", "Current Price"),
    PRICE("price", "Price", "price", "ListPrice", "List Price", "list_price"),
    ORIGINAL_PRICE("originalPrice", "OriginalPrice", "Original Price", "original_price", "MSRP",
            "RetailPrice", "Retail Price"),
    CURRENCY("currency", "Currency", "CurrencyCode", "currency_code", "currency"),
    STOCK("stock", "StockAvailability", "Stock Availability", "Availability", "InStock", "In Stock",
            "inStock", "in_stock", "stock"),
    NETWORK_ITEM_ID("networkItemId", "CatalogItemId", "ItemId", "item_id", "catalogItemId"),
    SKU("sku", "SKU", "MerchantSKU", "sku", "merchant_sku", "ProductSKU", "Unique Merchant SKU",
            "UniqueMerchantSKU", "unique_merchant_sku"),
    UPC("upc", "Gtin", "GTIN", "UPC", "EAN", "ISBN", "upc", "gtin", "ean"),
    BRAND("brand", "Brand", "Manufacturer", "brand", "manufacturer"),
    CATEGORY("category", "Category", "ProductCategory", "category"),
    IMAGE_URL("imageUrl", "ImageUrl", "Image URL", "ImageURL", "image_url", "image"),
    DESCRIPTION("description", "Description", "ProductDescription", "description");

    private final String key;
    private final List<String> aliases;

    FeedField(String key, String... aliases) {
        this.key = key;
        this.aliases = List.of(aliases);
    }

    public String key() {
        return key;
    }

    public List<String> aliases() {
        return aliases;
    }

    public static Optional<FeedField> fromKey(String key) {
        if (key == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(f -> f.key.equalsIgnoreCase(key.trim()))
                .findFirst();
    }
}
