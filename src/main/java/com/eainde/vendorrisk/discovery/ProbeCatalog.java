package com.eainde.vendorrisk.discovery;

import com.eainde.vendorrisk.model.DocumentType;
import com.eainde.vendorrisk.model.VendorProfile;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * URL catalogs probed during discovery. Order matters: earlier entries win ties.
 */
final class ProbeCatalog {

    /**
     * A conventional path and the type a page there usually has.
     * {@code type} is {@code null} when the page must be classified by its title or content.
     */
    record PathProbe(String path, DocumentType type) {
    }

    static final List<PathProbe> COMMON_PATHS = List.of(
            new PathProbe("/privacy", DocumentType.PRIVACY_POLICY),
            new PathProbe("/privacy-policy", DocumentType.PRIVACY_POLICY),
            new PathProbe("/legal/privacy", DocumentType.PRIVACY_POLICY),
            new PathProbe("/security", DocumentType.SECURITY_POLICY),
            new PathProbe("/security-policy", DocumentType.SECURITY_POLICY),
            new PathProbe("/legal/security", DocumentType.SECURITY_POLICY),
            new PathProbe("/compliance", null),
            new PathProbe("/certifications", null),
            new PathProbe("/legal/compliance", null),
            new PathProbe("/legal/dpa", DocumentType.DATA_PROCESSING_AGREEMENT),
            new PathProbe("/dpa", DocumentType.DATA_PROCESSING_AGREEMENT),
            new PathProbe("/gdpr", DocumentType.PRIVACY_POLICY),
            new PathProbe("/legal/gdpr", DocumentType.PRIVACY_POLICY),
            new PathProbe("/trust/incident-response", DocumentType.INCIDENT_RESPONSE));

    /** Framework suffixes for {@code /legal/<vendor>-<framework>} pages. */
    static final List<PathProbe> VENDOR_FRAMEWORKS = List.of(
            new PathProbe("gdpr", DocumentType.PRIVACY_POLICY),
            new PathProbe("ccpa", DocumentType.PRIVACY_POLICY),
            new PathProbe("hipaa", DocumentType.SECURITY_POLICY),
            new PathProbe("soc2", DocumentType.ATTESTATION_REPORT),
            new PathProbe("security", DocumentType.SECURITY_POLICY),
            new PathProbe("privacy", DocumentType.PRIVACY_POLICY),
            new PathProbe("dpa", DocumentType.DATA_PROCESSING_AGREEMENT));

    private ProbeCatalog() {
    }

    static List<String> trustCenterUrls(VendorProfile vendor) {
        String d = vendor.domain();
        return List.of(
                "https://trust." + d,
                "https://security." + d,
                "https://compliance." + d,
                "https://" + d + "/trust",
                "https://" + d + "/trust-center",
                "https://" + d + "/security",
                "https://" + d + "/compliance",
                "https://" + d + "/legal",
                "https://www." + d + "/trust",
                "https://www." + d + "/security");
    }

    static List<String> rootUrls(VendorProfile vendor) {
        return List.of(vendor.rootUrl(), vendor.wwwRootUrl());
    }

    /**
     * Common paths followed by vendor-specific variants, each against the bare domain and then {@code www}.
     */
    static List<Probe> pathProbes(VendorProfile vendor) {
        List<PathProbe> paths = new ArrayList<>(COMMON_PATHS);
        String shortName = vendor.shortName();
        for (PathProbe framework : VENDOR_FRAMEWORKS) {
            paths.add(new PathProbe("/legal/" + shortName + "-" + framework.path(), framework.type()));
        }
        Set<Probe> probes = new LinkedHashSet<>();
        for (String root : rootUrls(vendor)) {
            for (PathProbe p : paths) {
                probes.add(new Probe(root + p.path(), p.type()));
            }
        }
        return List.copyOf(probes);
    }

    /** A concrete URL to probe. */
    record Probe(String url, DocumentType expectedType) {
    }
}
