package com.priceintel.harvester.quarantine;

import com.priceintel.harvester.model.BlockingError;
import com.priceintel.harvester.model.BlockingErrorCode;
import com.priceintel.harvester.parser.FeedField;
import com.priceintel.harvester.parser.PriceNormalizer;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Admission rules for records entering the price history. Works on a field snapshot keyed by
 * {@link FeedField#key()}, so freshly parsed and operator-corrected records go through the same rules.
 *
 * A record is admitted when it has a usable identifier (UPC of 8 to 14 digits, network item id
 * or SKU), a title, and a price above zero.
 */
@Component
public class RecordValidator {

    public static final int MIN_UPC_DIGITS = 8;
    public static final int MAX_UPC_DIGITS = 14;

    public ValidationResult validate(Map<String, String> fields) {
        List<BlockingError> errors = new ArrayList<>();

        String upc = fields.get(FeedField.UPC.key());
        boolean upcValid = isValidUpc(upc);
        boolean hasOtherIdentity = StringUtils.isNotBlank(fields.get(FeedField.SKU.key()))
                || StringUtils.isNotBlank(fields.get(FeedField.NETWORK_ITEM_ID.key()));

        if (!upcValid && !hasOtherIdentity) {
            if (StringUtils.isNotBlank(upc)) {
                errors.add(new BlockingError(BlockingErrorCode.INVALID_UPC,
                        "UPC '" + upc + "' must have " + MIN_UPC_DIGITS + " to " + MAX_UPC_DIGITS + " digits"));
            } else {
                errors.add(new BlockingError(BlockingErrorCode.MISSING_IDENTIFIER,
                        "Still missing valid UPC, SKU or network item id"));
            }
        }

        if (StringUtils.isBlank(fields.get(FeedField.TITLE.key()))) {
            errors.add(new BlockingError(BlockingErrorCode.MISSING_TITLE, "Title is required"));
        }

        String rawPrice = fields.get(FeedField.PRICE.key());
        if (StringUtils.isBlank(rawPrice)) {
            errors.add(new BlockingError(BlockingErrorCode.MISSING_PRICE, "Price is required"));
        } else {
            BigDecimal price = parsePrice(rawPrice);
            if (price == null || price.signum() <= 0) {
                errors.add(new BlockingError(BlockingErrorCode.INVALID_PRICE,
                        "Price must be greater than zero, got '" + rawPrice + "'"));
            }
        }

        return new ValidationResult(errors);
    }

    public static boolean isValidUpc(String upc) {
        if (upc == null) return false;
        int digits = upc.replaceAll("\\D", "").length();
        return digits >= MIN_UPC_DIGITS && digits <= MAX_UPC_DIGITS;
    }

    private static BigDecimal parsePrice(String raw) {
        try {
            return PriceNormalizer.parse(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
