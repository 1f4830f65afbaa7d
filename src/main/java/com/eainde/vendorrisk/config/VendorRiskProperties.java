package com.eainde.vendorrisk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed settings for the whole pipeline, bound from {@code vendor-risk.*}.
 * <p>
 * Each stage receives its own section through its constructor. Defaults here are the tuned values;
 * {@code application.yml} only needs to override what differs.
 */
@Data
@ConfigurationProperties(prefix = "vendor-risk")
public class VendorRiskProperties {

    private Discovery discovery = new Discovery();
    private Retrieval retrieval = new Retrieval();
    private Analysis analysis = new Analysis();
    private Scoring scoring = new Scoring();
    private FollowUp followUp = new FollowUp();
    private Storage storage = new Storage();
    private Llm llm = new Llm();

    @Data
    public static class Discovery {
        private int concurrency = 6;
        private Duration probeTimeout = Duration.ofSeconds(10);
        private int trustIndicatorThreshold = 3;
        private int maxCandidatesPerType = 5;
        /** Discovery stops after a stage once this many candidates are known. */
        private int sufficientCandidates = 12;
        private boolean llmEnabled = false;
    }

    @Data
    public static class Retrieval {
        private int concurrency = 6;
        private Duration fetchTimeout = Duration.ofSeconds(30);
        private long maxDocumentBytes = 50L * 1024 * 1024;
    }

    @Data
    public static class Analysis {
        private int chunkingThreshold = 8_000;
        private int chunkSize = 4_000;
        private int chunkOverlap = 200;
        private boolean narrativeEnabled = true;
        private int concurrency = 4;
        /** Upper bound for all passes over one document, narrative completions included. */
        private Duration documentTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class Scoring {
        private double highRiskThreshold = 85.0;
        private ComponentWeights componentWeights = new ComponentWeights();

        /** Keyed by upper-case location; {@code UNKNOWN} is used for anything not listed. */
        private Map<String, Double> geographyMultipliers = new LinkedHashMap<>(Map.of(
                "US", 1.0, "EU", 1.0, "UK", 1.0, "CA", 1.0, "AU", 1.0,
                "OTHER_HIGH", 1.2, "MEDIUM_RISK", 1.4, "HIGH_RISK", 1.8, "UNKNOWN", 1.2));

        private Map<String, Double> regulatoryMultipliers = new LinkedHashMap<>(Map.of(
                "GDPR", 1.3, "HIPAA", 1.4, "PCI_DSS", 1.2, "SOX", 1.3, "CCPA", 1.1,
                "SOC2", 1.0, "ISO27001", 0.9, "UNKNOWN", 1.1));

        private Map<String, Double> sensitivityMultipliers = new LinkedHashMap<>(Map.of(
                "LOW", 0.8, "MEDIUM", 1.0, "HIGH", 1.3, "CRITICAL", 1.6));

        private Map<String, Double> accessMultipliers = new LinkedHashMap<>(Map.of(
                "READ_ONLY", 0.9, "LIMITED", 1.0, "FULL", 1.2, "ADMIN", 1.4));

        private Map<String, Double> criticalityMultipliers = new LinkedHashMap<>(Map.of(
                "LOW", 0.8, "MEDIUM", 1.0, "HIGH", 1.2, "CRITICAL", 1.4));
    }

    @Data
    public static class ComponentWeights {
        private double dataSecurity = 0.30;
        private double privacy = 0.25;
        private double compliance = 0.20;
        private double operational = 0.25;

        public double sum() {
            return dataSecurity + privacy + compliance + operational;
        }
    }

    @Data
    public static class FollowUp {
        private int maxAttempts = 3;
        /** Vendor recipient is {@code <local-part>@<vendor domain>}. */
        private String vendorContactLocalPart = "security";
        private String internalReviewer = "risk-review@localhost";
        private String contactName = "Security Team";
        private String senderName = "Vendor Risk Management";
    }

    @Data
    public static class Storage {
        /** Blank disables archiving. */
        private String basePath = "";
    }

    @Data
    public static class Llm {
        private String apiKey = "";
        private String baseUrl;
        private String modelName = "gpt-4o-mini";
        private double temperature = 0.1;
        private Duration timeout = Duration.ofSeconds(30);
    }
}
