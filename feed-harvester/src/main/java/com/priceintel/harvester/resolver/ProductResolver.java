package com.priceintel.harvester.resolver;

import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.model.CanonicalProduct;
import com.priceintel.harvester.model.ConfidenceTier;
import com.priceintel.harvester.model.LinkStatus;
import com.priceintel.harvester.model.ProductLink;
import com.priceintel.harvester.model.SourceProduct;
import com.priceintel.harvester.repository.CatalogRepository;
import com.priceintel.harvester.repository.PriceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Links source products to canonical catalog products.
 *
 * <p>Each candidate is scored from three independent signals:
 * <ul>
 *   <li>identifier: normalized UPCs equal (weight 0.5)</li>
 *   <li>attributes: brand, caliber and pack size all known and equal, grain not conflicting (0.3)</li>
 *   <li>title: token similarity of normalized titles, scaled (0.2)</li>
 * </ul>
 * The best score maps to a confidence tier. At or above the configured match tier the link is
 * MATCHED; a weaker or ambiguous best candidate is NEEDS_REVIEW (with the best candidate kept as a
 * suggestion); no candidate at all is UNMATCHED.
 *
 * <p>The resolver never reads or writes price history.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProductResolver {

    public static final String SIGNAL_UPC = "UPC";
    public static final String SIGNAL_ATTRIBUTES = "ATTRIBUTES";
    public static final String SIGNAL_TITLE = "TITLE";

    private static final double WEIGHT_IDENTIFIER = 0.5;
    private static final double WEIGHT_ATTRIBUTES = 0.3;
    private static final double WEIGHT_TITLE = 0.2;
    private static final double TITLE_SIGNAL_MIN = 0.5;

    private final CatalogRepository catalogRepository;
    private final PriceRepository priceRepository;
    private final HarvesterProperties properties;
    private final Clock clock;

    public String currentVersion() {
        return properties.getResolver().getVersion();
    }

    public ProductLink resolve(SourceProduct product) {
        return resolve(product, currentVersion());
    }

    /**
     * Resolves and stores the link, unless the stored link came from a newer resolver version.
     */
    public ProductLink resolve(SourceProduct product, String resolverVersion) {
        Optional<ProductLink> existing = catalogRepository.findLink(product.getId());
        if (existing.isPresent() && ResolverVersion.compare(existing.get().getResolverVersion(), resolverVersion) > 0) {
            log.info("Keeping link for {}: stored version {} is newer than {}",
                    product.getId(), existing.get().getResolverVersion(), resolverVersion);
            return existing.get();
        }

        ProductLink link = score(product, resolverVersion);
        catalogRepository.saveLink(link);
        log.debug("Resolved {} → {} ({} {}, {})", product.getId(), link.getCanonicalProductId(),
                link.getStatus(), link.getTier(), link.getMatchedSignals());
        return link;
    }

    /** Resolves every listed product regardless of its current link. */
    public BatchResolveResult resolveProducts(List<String> sourceProductIds) {
        return run(sourceProductIds, currentVersion(), false);
    }

    /**
     * Idempotent bulk re-resolution tagged with {@code resolverVersion}. Products whose link
     * already carries that version are skipped.
     */
    public BatchResolveResult resolveBatch(List<String> sourceProductIds, String resolverVersion) {
        return run(sourceProductIds, resolverVersion, true);
    }

    /** Re-runs links that are open (NEEDS_REVIEW, UNMATCHED) or were produced by another version. */
    public BatchResolveResult reresolveOpenLinks(Integer limit) {
        int max = properties.getResolver().getReresolveLimit();
        int cap = limit == null || limit <= 0 ? max : Math.min(limit, max);
        List<String> ids = catalogRepository.findSourceProductIdsToReresolve(currentVersion(), cap);
        log.info("Re-resolving {} open or outdated links", ids.size());
        return run(ids, currentVersion(), false);
    }

    // ── Scoring ──────────────────────────────────────────────────────────────

    ProductLink score(SourceProduct product, String resolverVersion) {
        HarvesterProperties.Resolver settings = properties.getResolver();
        ProductAttributes attrs = AmmoAttributeExtractor.from(product);
        String upc = normalizeUpc(product.getUpc());

        Map<String, CanonicalProduct> candidates = new LinkedHashMap<>();
        if (upc != null) {
            catalogRepository.findByUpc(upc).forEach(c -> candidates.putIfAbsent(c.getId(), c));
        }
        if (attrs.caliber() != null || attrs.brand() != null) {
            catalogRepository.findCandidates(attrs.caliber(), product.getBrand(), settings.getCandidateLimit())
                    .forEach(c -> candidates.putIfAbsent(c.getId(), c));
        }

        ProductLink.ProductLinkBuilder link = ProductLink.builder()
                .sourceProductId(product.getId())
                .candidateCount(candidates.size())
                .resolverVersion(resolverVersion)
                .resolvedAt(clock.instant());

        List<CandidateScore> scores = new ArrayList<>();
        for (CanonicalProduct candidate : candidates.values()) {
            scores.add(scoreCandidate(product, attrs, upc, candidate));
        }
        scores.sort(Comparator.comparingDouble(CandidateScore::confidence).reversed());

        if (scores.isEmpty()) {
            return link.status(LinkStatus.UNMATCHED)
                    .tier(ConfidenceTier.NONE)
                    .confidence(0.0)
                    .build();
        }

        CandidateScore best = scores.get(0);
        ConfidenceTier tier = tierFor(best.confidence());
        boolean ambiguous = scores.size() > 1
                && scores.get(1).confidence() >= settings.getLowThreshold()
                && best.confidence() - scores.get(1).confidence() < settings.getAmbiguityGap();

        LinkStatus status = tier.isAtLeast(settings.getMatchTier()) && !ambiguous
                ? LinkStatus.MATCHED
                : LinkStatus.NEEDS_REVIEW;

        if (ambiguous) {
            log.info("Ambiguous match for {}: {} vs {} ({} / {})", product.getId(),
                    best.candidate().getId(), scores.get(1).candidate().getId(),
                    best.confidence(), scores.get(1).confidence());
        }

        return link.canonicalProductId(best.candidate().getId())
                .status(status)
                .tier(tier)
                .confidence(round(best.confidence()))
                .matchedSignals(best.signals())
                .build();
    }

    ConfidenceTier tierFor(double confidence) {
        HarvesterProperties.Resolver settings = properties.getResolver();
        if (confidence >= settings.getHighThreshold()) return ConfidenceTier.HIGH;
        if (confidence >= settings.getMediumThreshold()) return ConfidenceTier.MEDIUM;
        if (confidence >= settings.getLowThreshold()) return ConfidenceTier.LOW;
        return ConfidenceTier.NONE;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private CandidateScore scoreCandidate(SourceProduct product, ProductAttributes attrs, String upc,
                                          CanonicalProduct candidate) {
        List<String> signals = new ArrayList<>();
        double confidence = 0.0;

        if (upc != null && upc.equals(normalizeUpc(candidate.getUpc()))) {
            confidence += WEIGHT_IDENTIFIER;
            signals.add(SIGNAL_UPC);
        }

        if (attributesAgree(attrs, AmmoAttributeExtractor.from(candidate))) {
            confidence += WEIGHT_ATTRIBUTES;
            signals.add(SIGNAL_ATTRIBUTES);
        }

        double titleScore = TitleSimilarity.score(product.getTitle(), candidate.getTitle());
        confidence += WEIGHT_TITLE * titleScore;
        if (titleScore >= TITLE_SIGNAL_MIN) {
            signals.add(SIGNAL_TITLE);
        }

        return new CandidateScore(candidate, confidence, signals);
    }

    private static boolean attributesAgree(ProductAttributes a, ProductAttributes b) {
        if (a.brand() == null || a.caliber() == null || a.roundCount() == null) return false;
        boolean grainConflict = a.grainWeight() != null && b.grainWeight() != null
                && !a.grainWeight().equals(b.grainWeight());
        return !grainConflict
                && a.brand().equals(b.brand())
                && a.caliber().equals(b.caliber())
                && Objects.equals(a.roundCount(), b.roundCount());
    }

    /** Digits only; UPC-A with a dropped leading zero is padded back to 12. */
    static String normalizeUpc(String upc) {
        if (upc == null) return null;
        String digits = upc.replaceAll("\\D", "");
        if (digits.length() == 11) digits = "0" + digits;
        return digits.length() >= 8 && digits.length() <= 14 ? digits : null;
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    private BatchResolveResult run(List<String> sourceProductIds, String version, boolean skipCurrent) {
        List<SourceProduct> products = priceRepository.findSourceProductsByIds(sourceProductIds);
        int matched = 0, review = 0, unmatched = 0, skipped = 0;

        for (SourceProduct product : products) {
            if (skipCurrent && isCurrent(product.getId(), version)) {
                skipped++;
                continue;
            }
            switch (resolve(product, version).getStatus()) {
                case MATCHED -> matched++;
                case NEEDS_REVIEW -> review++;
                case UNMATCHED -> unmatched++;
            }
        }

        int missing = sourceProductIds.size() - products.size();
        if (missing > 0) {
            log.warn("{} source products no longer exist and were skipped", missing);
        }
        log.info("Resolver {}: {} matched, {} needs review, {} unmatched, {} already current",
                version, matched, review, unmatched, skipped);
        return new BatchResolveResult(version, matched, review, unmatched, skipped, missing);
    }

    private boolean isCurrent(String sourceProductId, String version) {
        return catalogRepository.findLink(sourceProductId)
                .filter(l -> ResolverVersion.compare(l.getResolverVersion(), version) == 0)
                .isPresent();
    }

    private record CandidateScore(CanonicalProduct candidate, double confidence, List<String> signals) {}
}
