package com.priceintel.harvester.parser;

import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;
import java.util.Locale;
import java.util.Set;

/**
 * Turns retailer price strings ("$1,299.99", "19,99 €", "USD 18.5") into two-decimal amounts.
 */
public final class PriceNormalizer {

    // Codes looked for inside raw price strings
    private static final Set<String> KNOWN_CURRENCIES =
            Set.of("USD", "EUR", "GBP", "CAD", "AUD", "JPY", "CHF", "CNY", "MXN");

    private PriceNormalizer() {
    }

    /**
     * @return the amount rounded half-up to two decimals, or null when the input is blank
     * @throws NumberFormatException when the input has no parseable amount
     */
    public static BigDecimal parse(String raw) {
        if (StringUtils.isBlank(raw)) return null;

        String cleaned = raw.replaceAll("[^0-9.,-]", "");
        if (cleaned.isEmpty() || cleaned.equals("-")) {
            throw new NumberFormatException("No amount in '" + raw + "'");
        }

        int lastComma = cleaned.lastIndexOf(',');
        int lastDot = cleaned.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            // whichever separator comes last is the decimal point
            cleaned = lastComma > lastDot
                    ? cleaned.replace(".", "").replace(',', '.')
                    : cleaned.replace(",", "");
        } else if (lastComma >= 0) {
            cleaned = cleaned.matches("-?\\d{1,3}(,\\d{3})+")
                    ? cleaned.replace(",", "")
                    : cleaned.replace(',', '.');
        } else if (cleaned.indexOf('.') != lastDot) {
            cleaned = cleaned.replace(".", "");
        }

        return new BigDecimal(cleaned).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Currency from an explicit column (any ISO 4217 code), else from a symbol in the raw price,
     * else USD. An explicit value that is not an ISO code falls back to USD.
     */
    public static String currency(String explicit, String rawPrice) {
        if (StringUtils.isNotBlank(explicit)) {
            try {
                return Currency.getInstance(explicit.trim().toUpperCase(Locale.ROOT)).getCurrencyCode();
            } catch (IllegalArgumentException e) {
                return "USD";
            }
        }
        if (rawPrice != null) {
            if (rawPrice.contains("€")) return "EUR";
            if (rawPrice.contains("£")) return "GBP";
            String upper = rawPrice.toUpperCase(Locale.ROOT);
            for (String code : KNOWN_CURRENCIES) {
                if (upper.contains(code)) return code;
            }
        }
        return "USD";
    }
}
