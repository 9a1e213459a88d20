package com.priceintel.harvester.visibility;

import com.priceintel.harvester.model.MerchantRetailerRelationship;
import com.priceintel.harvester.model.RetailerEligibility;
import com.priceintel.harvester.repository.RetailerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@Service
@RequiredArgsConstructor
public class RetailerVisibilityService {

    private final RetailerRepository retailerRepository;

    /** Unknown retailers are never visible. */
    public boolean isVisible(String retailerId) {
        RetailerEligibility eligibility = retailerRepository.findEligibility(retailerId)
                .orElse(RetailerEligibility.INELIGIBLE);
        if (eligibility != RetailerEligibility.ELIGIBLE) return false;
        return VisibilityPredicate.isVisible(eligibility, retailerRepository.findRelationships(retailerId));
    }

    public Map<String, Object> describe(String retailerId) {
        RetailerEligibility eligibility = retailerRepository.findEligibility(retailerId)
                .orElseThrow(() -> new NoSuchElementException("Unknown retailer: " + retailerId));
        List<MerchantRetailerRelationship> relationships = retailerRepository.findRelationships(retailerId);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("retailerId", retailerId);
        result.put("eligibility", eligibility);
        result.put("relationships", relationships.size());
        result.put("activeListed", relationships.stream().filter(MerchantRetailerRelationship::isActiveAndListed).count());
        result.put("visible", VisibilityPredicate.isVisible(eligibility, relationships));
        return result;
    }
}
