package com.priceintel.harvester.resolver;

import com.priceintel.harvester.model.CanonicalProduct;
import com.priceintel.harvester.model.SourceProduct;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts caliber, grain weight and round count from ammunition product titles.
 */
public final class AmmoAttributeExtractor {

    private record CaliberPattern(Pattern pattern, String normalized) {}

    private static final List<CaliberPattern> CALIBERS = List.of(
            caliber("\\b9\\s?mm|9x19|9\\s?luger\\b", "9mm"),
            caliber("\\.?\\b45\\s?acp\\b", ".45 ACP"),
            caliber("\\.?\\b40\\s?s&w\\b", ".40 S&W"),
            caliber("\\.?\\b38\\s?(special|spl)\\b", ".38 Special"),
            caliber("\\.?\\b357\\s?mag(num)?\\b", ".357 Magnum"),
            caliber("\\b10\\s?mm\\b", "10mm Auto"),
            caliber("\\.?\\b380\\s?(acp|auto)\\b", ".380 ACP"),
            caliber("\\.?\\b32\\s?(acp|auto)\\b", ".32 ACP"),
            caliber("\\.?\\b25\\s?(acp|auto)\\b", ".25 ACP"),
            caliber("\\b5\\.56\\s?nato|5\\.56x45(mm)?\\b", "5.56 NATO"),
            caliber("\\.?\\b223\\s?rem(ington)?\\b", ".223 Remington"),
            caliber("\\.?\\b22\\s?(lr|long\\s?rifle)\\b", ".22 LR"),
            caliber("\\b7\\.62x39\\b", "7.62x39mm"),
            caliber("\\b7\\.62x54r\\b", "7.62x54R"),
            caliber("\\b7\\.62\\s?nato|7\\.62x51|\\.?\\b308\\s?win(chester)?\\b", ".308 Winchester"),
            caliber("\\.?\\b30-06\\b", ".30-06 Springfield"),
            caliber("\\.?\\b30\\s?carbine\\b", ".30 Carbine"),
            caliber("\\.?\\b300\\s?(aac\\s*)?(blk|blackout)\\b", ".300 Blackout"),
            caliber("\\.?\\b300\\s?win(chester)?\\s?mag\\b", ".300 Winchester Magnum"),
            caliber("\\b6\\.5\\s?(creedmoor|cm)\\b", "6.5 Creedmoor"),
            caliber("\\b6\\.5\\s?grendel\\b", "6.5 Grendel"),
            caliber("\\.?\\b270\\s?win(chester)?\\b", ".270 Winchester"),
            caliber("\\.?\\b243\\s?win(chester)?\\b", ".243 Winchester"),
            caliber("\\.?\\b50\\s?bmg\\b", ".50 BMG"),
            caliber("\\b12\\s?(ga|gauge)\\b", "12 Gauge"),
            caliber("\\b20\\s?(ga|gauge)\\b", "20 Gauge"),
            caliber("\\b16\\s?(ga|gauge)\\b", "16 Gauge"),
            caliber("\\b28\\s?(ga|gauge)\\b", "28 Gauge"),
            caliber("\\.?\\b410\\s?bore\\b", ".410 Bore"));

    private static final Pattern GRAIN = Pattern.compile("\\b(\\d{2,3})\\s?-?gr(ain)?s?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ROUNDS = Pattern.compile("\\b(\\d+)\\s?-?(rounds?|rds?|count|ct)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BOX_OF = Pattern.compile("\\bbox\\s+of\\s+(\\d+)\\b", Pattern.CASE_INSENSITIVE);

    private AmmoAttributeExtractor() {
    }

    public static ProductAttributes from(SourceProduct product) {
        String title = StringUtils.defaultString(product.getTitle());
        return new ProductAttributes(normalizeBrand(product.getBrand()), caliber(title), grainWeight(title), roundCount(title));
    }

    /** Stored attributes win; the title fills the gaps. */
    public static ProductAttributes from(CanonicalProduct product) {
        String title = StringUtils.defaultString(product.getTitle());
        return new ProductAttributes(
                normalizeBrand(product.getBrand()),
                product.getCaliber() != null ? product.getCaliber() : caliber(title),
                product.getGrainWeight() != null ? product.getGrainWeight() : grainWeight(title),
                product.getRoundCount() != null ? product.getRoundCount() : roundCount(title));
    }

    public static String caliber(String title) {
        if (title == null) return null;
        String lower = title.toLowerCase(Locale.ROOT);
        for (CaliberPattern c : CALIBERS) {
            if (c.pattern().matcher(lower).find()) return c.normalized();
        }
        return null;
    }

    public static Integer grainWeight(String title) {
        if (title == null) return null;
        Matcher m = GRAIN.matcher(title);
        while (m.find()) {
            int grain = Integer.parseInt(m.group(1));
            if (grain >= 20 && grain <= 800) return grain;
        }
        return null;
    }

    public static Integer roundCount(String title) {
        if (title == null) return null;
        for (Pattern pattern : List.of(ROUNDS, BOX_OF)) {
            Matcher m = pattern.matcher(title);
            while (m.find()) {
                long count = Long.parseLong(m.group(1));
                if (count >= 5 && count <= 5000) return (int) count;
            }
        }
        return null;
    }

    static String normalizeBrand(String brand) {
        if (StringUtils.isBlank(brand)) return null;
        return brand.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    private static CaliberPattern caliber(String regex, String normalized) {
        return new CaliberPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), normalized);
    }
}
