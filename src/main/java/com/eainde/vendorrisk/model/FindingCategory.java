package com.eainde.vendorrisk.model;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fixed vocabulary of finding categories.
 */
public final class FindingCategory {

    public static final String ENCRYPTION = "encryption";
    public static final String ACCESS_CONTROL = "access_control";
    public static final String NETWORK_SECURITY = "network_security";
    public static final String DATA_PROTECTION = "data_protection";
    public static final String INCIDENT_RESPONSE = "incident_response";
    public static final String COMPLIANCE_FRAMEWORKS = "compliance_frameworks";
    public static final String PRIVACY_COMPLIANCE = "privacy_compliance";
    public static final String DATA_SUBJECT_RIGHTS = "data_subject_rights";
    public static final String CONSENT_MANAGEMENT = "consent_management";
    public static final String SOC2_COMPLIANCE = "soc2_compliance";
    public static final String ISO27001 = "iso27001";
    public static final String BUSINESS_CONTINUITY = "business_continuity";
    public static final String VENDOR_MANAGEMENT = "vendor_management";
    public static final String MISSING_ELEMENTS = "missing_elements";
    public static final String DOCUMENT_CONTENT = "document_content";
    public static final String AI_ANALYSIS = "ai_analysis";

    public static final Set<String> ALL = Set.of(
            ENCRYPTION, ACCESS_CONTROL, NETWORK_SECURITY, DATA_PROTECTION, INCIDENT_RESPONSE,
            COMPLIANCE_FRAMEWORKS, PRIVACY_COMPLIANCE, DATA_SUBJECT_RIGHTS, CONSENT_MANAGEMENT,
            SOC2_COMPLIANCE, ISO27001, BUSINESS_CONTINUITY, VENDOR_MANAGEMENT, MISSING_ELEMENTS,
            DOCUMENT_CONTENT, AI_ANALYSIS);

    public static final List<String> DATA_SECURITY_GROUP =
            List.of(ENCRYPTION, ACCESS_CONTROL, NETWORK_SECURITY, DATA_PROTECTION);
    public static final List<String> PRIVACY_GROUP =
            List.of(PRIVACY_COMPLIANCE, DATA_SUBJECT_RIGHTS, CONSENT_MANAGEMENT);
    public static final List<String> COMPLIANCE_GROUP =
            List.of(SOC2_COMPLIANCE, ISO27001, COMPLIANCE_FRAMEWORKS);
    public static final List<String> OPERATIONAL_GROUP =
            List.of(INCIDENT_RESPONSE, BUSINESS_CONTINUITY, VENDOR_MANAGEMENT);

    private FindingCategory() {
    }

    /**
     * Maps free-form category names (e.g. from model output) onto the vocabulary.
     * Unknown names fall back to {@link #AI_ANALYSIS}.
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) return AI_ANALYSIS;
        String key = raw.strip().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return ALL.contains(key) ? key : AI_ANALYSIS;
    }

    /** {@code privacy_compliance} becomes {@code Privacy Compliance}. */
    public static String title(String category) {
        StringBuilder sb = new StringBuilder();
        for (String part : category.split("_")) {
            if (part.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }
}
