package com.eainde.vendorrisk.model;

import lombok.Builder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Caller-supplied profile describing how sensitive and critical the vendor relationship is.
 * Missing values fall back to {@link #defaults()}.
 *
 * @param dataSensitivity     how sensitive the shared data is
 * @param geographicLocations where the vendor processes data, e.g. {@code US}, {@code EU}, {@code HIGH_RISK}
 * @param regulatoryExposures regimes in scope, e.g. {@code GDPR}, {@code HIPAA}
 * @param accessLevel         how much access the vendor gets to our systems
 * @param businessCriticality how much the business depends on the vendor
 * @param dataTypes           informational list of shared data types
 */
@Builder
public record RiskCriteria(
        DataSensitivity dataSensitivity,
        List<String> geographicLocations,
        List<String> regulatoryExposures,
        AccessLevel accessLevel,
        BusinessCriticality businessCriticality,
        List<String> dataTypes
) implements Serializable {

    public RiskCriteria {
        if (dataSensitivity == null) dataSensitivity = DataSensitivity.MEDIUM;
        geographicLocations = geographicLocations == null ? List.of("US") : upperCased(geographicLocations);
        regulatoryExposures = regulatoryExposures == null ? List.of() : upperCased(regulatoryExposures);
        if (accessLevel == null) accessLevel = AccessLevel.LIMITED;
        if (businessCriticality == null) businessCriticality = BusinessCriticality.MEDIUM;
        dataTypes = dataTypes == null ? List.of("business_data") : List.copyOf(dataTypes);
    }

    public static RiskCriteria defaults() {
        return RiskCriteria.builder().build();
    }

    /**
     * Builds criteria from loosely typed values, e.g. from a request payload.
     *
     * @throws IllegalArgumentException for an unknown sensitivity, access level or criticality
     */
    public static RiskCriteria parse(String dataSensitivity,
                                     List<String> geographicLocations,
                                     List<String> regulatoryExposures,
                                     String accessLevel,
                                     String businessCriticality) {
        return RiskCriteria.builder()
                .dataSensitivity(dataSensitivity == null ? null : DataSensitivity.fromValue(dataSensitivity))
                .geographicLocations(geographicLocations)
                .regulatoryExposures(regulatoryExposures)
                .accessLevel(accessLevel == null ? null : AccessLevel.fromValue(accessLevel))
                .businessCriticality(businessCriticality == null ? null : BusinessCriticality.fromValue(businessCriticality))
                .build();
    }

    public boolean hasExposure(String regulation) {
        return regulatoryExposures.contains(regulation.toUpperCase(Locale.ROOT));
    }

    private static List<String> upperCased(List<String> values) {
        List<String> out = new ArrayList<>(values.size());
        for (String v : values) {
            if (v == null || v.isBlank()) {
                throw new IllegalArgumentException("Risk criteria lists must not contain blank entries");
            }
            out.add(v.strip().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_'));
        }
        return List.copyOf(out);
    }
}
