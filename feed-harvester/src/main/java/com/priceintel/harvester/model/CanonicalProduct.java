package com.priceintel.harvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalProduct {

    private String id;
    private String upc;
    private String title;
    private String brand;
    private String caliber;
    private Integer grainWeight;
    private Integer roundCount;
}
