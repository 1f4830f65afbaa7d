package com.eainde.vendorrisk.analysis;

import com.eainde.vendorrisk.model.DocumentType;
import com.eainde.vendorrisk.model.FindingCategory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Declarative tables driving the deterministic analysis passes.
 */
public final class IndicatorCatalog {

    public static final List<ComplianceIndicator> INDICATORS = List.of(
            new ComplianceIndicator(FindingCategory.ENCRYPTION,
                    List.of("encryption", "encrypted", "tls", "ssl", "aes", "rsa"),
                    patterns("AES[-\\s]?256", "TLS\\s*1\\.[23]", "encryption\\s+at\\s+rest",
                            "encryption\\s+in\\s+transit"),
                    0.25),
            new ComplianceIndicator(FindingCategory.ACCESS_CONTROL,
                    List.of("access control", "authentication", "authorization", "mfa", "2fa"),
                    patterns("multi[-\\s]?factor\\s+authentication", "role[-\\s]?based\\s+access",
                            "principle\\s+of\\s+least\\s+privilege", "access\\s+reviews?"),
                    0.20),
            new ComplianceIndicator(FindingCategory.DATA_PROTECTION,
                    List.of("data protection", "gdpr", "ccpa", "personal data", "pii"),
                    patterns("GDPR\\s+complian(t|ce)", "data\\s+subject\\s+rights",
                            "data\\s+retention\\s+policy", "right\\s+to\\s+erasure"),
                    0.20),
            new ComplianceIndicator(FindingCategory.INCIDENT_RESPONSE,
                    List.of("incident response", "breach notification", "security incident"),
                    patterns("incident\\s+response\\s+plan", "breach\\s+notification",
                            "security\\s+incident\\s+management", "72\\s+hours?\\s+notification"),
                    0.15),
            new ComplianceIndicator(FindingCategory.COMPLIANCE_FRAMEWORKS,
                    List.of("soc 2", "iso 27001", "pci dss", "hipaa", "fedramp"),
                    patterns("SOC\\s*2\\s*Type\\s*(II|2)\\b", "ISO\\s*27001", "PCI[-\\s]?DSS",
                            "HIPAA\\s+complian(t|ce)"),
                    0.20));

    /** Attestation-report evidence: name → pattern. */
    public static final Map<String, Pattern> ATTESTATION_PATTERNS = Map.of(
            "type_ii_report", Pattern.compile("type\\s*(ii|2)\\s*report", Pattern.CASE_INSENSITIVE),
            "trust_services_criteria", Pattern.compile("trust\\s+services?\\s+criteria", Pattern.CASE_INSENSITIVE),
            "control_exceptions", Pattern.compile("\\b(exceptions?|deviations?|deficienc(y|ies))\\b",
                    Pattern.CASE_INSENSITIVE),
            "testing_results", Pattern.compile("testing\\s+results?|test\\s+work\\s+performed",
                    Pattern.CASE_INSENSITIVE));

    /** Order in which {@link #ATTESTATION_PATTERNS} are reported. */
    public static final List<String> ATTESTATION_ORDER =
            List.of("type_ii_report", "trust_services_criteria", "control_exceptions", "testing_results");

    /**
     * A privacy-notice disclosure and the phrasings that satisfy it.
     */
    public record Disclosure(String name, String label, List<Pattern> patterns) {
    }

    public static final List<Disclosure> PRIVACY_DISCLOSURES = List.of(
            new Disclosure("data_subject_rights", "Data subject rights",
                    patterns("right\\s+to\\s+access", "right\\s+to\\s+rectification", "right\\s+to\\s+erasure",
                            "right\\s+to\\s+(data\\s+)?portability", "right\\s+to\\s+object")),
            new Disclosure("legal_basis", "Legal basis for processing",
                    patterns("legal\\s+basis", "lawful\\s+basis", "legitimate\\s+interests?")),
            new Disclosure("data_retention", "Data retention period",
                    patterns("retention\\s+period", "how\\s+long\\s+we\\s+(keep|retain)", "retain\\s+(your\\s+)?personal")),
            new Disclosure("international_transfers", "International transfer safeguards",
                    patterns("international\\s+(data\\s+)?transfers?", "adequacy\\s+decision",
                            "standard\\s+contractual\\s+clauses")));

    /** Terms every document of a type is expected to mention. */
    public static final Map<DocumentType, List<String>> EXPECTED_ELEMENTS = Map.of(
            DocumentType.ATTESTATION_REPORT, List.of(
                    "management assertion", "service auditor's report", "description of controls",
                    "testing procedures"),
            DocumentType.PRIVACY_POLICY, List.of(
                    "data collection", "purpose of processing", "data sharing", "user rights",
                    "contact information"),
            DocumentType.SECURITY_POLICY, List.of(
                    "access controls", "encryption", "incident response", "security monitoring",
                    "employee training"),
            DocumentType.DATA_PROCESSING_AGREEMENT, List.of(
                    "subprocessor", "technical and organizational measures", "audit rights",
                    "data deletion"));

    private IndicatorCatalog() {
    }

    private static List<Pattern> patterns(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
