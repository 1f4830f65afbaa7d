package com.eainde.vendorrisk.discovery;

import com.eainde.vendorrisk.config.VendorRiskProperties;
import com.eainde.vendorrisk.extract.ContentExtractor;
import com.eainde.vendorrisk.fetch.StubFetchClient;
import com.eainde.vendorrisk.llm.StubCompletionClient;
import com.eainde.vendorrisk.model.DiscoveryMethod;
import com.eainde.vendorrisk.model.DocumentCandidate;
import com.eainde.vendorrisk.model.DocumentType;
import com.eainde.vendorrisk.model.VendorProfile;
import com.eainde.vendorrisk.thread.CancellationSignal;
import com.eainde.vendorrisk.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentDiscoveryEngineTest {

    private static final String TRUST_CENTER_HTML = """
            <html><head><title>Acme Trust Center</title></head><body>
            <h1>Trust Center</h1>
            <p>Acme maintains SOC 2 Type II and ISO 27001 certifications and complies with GDPR.</p>
            <a href="https://trust.acme.com/files/soc2-type-ii-report.pdf">SOC 2 Type II Report</a>
            <a href="https://acme.com/privacy">Privacy Policy</a>
            <a href="https://acme.com/privacy/">Privacy Policy</a>
            <a href="/dpa">Data Processing Agreement</a>
            <a href="https://acme.com/">Home</a>
            <a href="https://acme.com/pp.pdf">PP</a>
            </body></html>""";

    private VendorRiskProperties.Discovery settings;
    private StubFetchClient web;
    private MdcAwareExecutor executor;

    @BeforeEach
    void setUp() {
        settings = new VendorRiskProperties.Discovery();
        web = new StubFetchClient();
        executor = new MdcAwareExecutor("discovery-test", 4);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private DocumentDiscoveryEngine engine() {
        return new DocumentDiscoveryEngine(settings, web, new ContentExtractor(),
                new LlmDiscoveryAdvisor(new ObjectMapper()));
    }

    private List<DocumentCandidate> discover(VendorProfile vendor) {
        return engine().discover(vendor, executor, CancellationSignal.create(), null);
    }

    private void acmeTrustCenter() {
        web.html("https://trust.acme.com", TRUST_CENTER_HTML)
                .html("https://acme.com/security", """
                        <html><head><title>Security Overview</title></head>
                        <body><p>We encrypt customer data at rest.</p></body></html>""")
                .text("https://acme.com/legal/acme-soc2", "Our latest SOC 2 examination is available on request.");
    }

    // =========================================================================
    //  Trust center and scraping
    // =========================================================================

    @Nested
    @DisplayName("Trust center discovery")
    class TrustCenter {

        @Test
        @DisplayName("should put the trust center first, followed by links scraped from it")
        void trustCenterFirst() {
            acmeTrustCenter();

            List<DocumentCandidate> candidates = discover(VendorProfile.of("acme.com"));

            DocumentCandidate first = candidates.get(0);
            assertThat(first.url()).isEqualTo("https://trust.acme.com");
            assertThat(first.method()).isEqualTo(DiscoveryMethod.TRUST_CENTER);
            assertThat(first.type()).isEqualTo(DocumentType.SECURITY_POLICY);
            assertThat(first.title()).isEqualTo("Acme Trust Center");

            assertThat(candidates).anySatisfy(c -> {
                assertThat(c.url()).isEqualTo("https://trust.acme.com/files/soc2-type-ii-report.pdf");
                assertThat(c.type()).isEqualTo(DocumentType.ATTESTATION_REPORT);
                assertThat(c.method()).isEqualTo(DiscoveryMethod.SCRAPE);
            });
            assertThat(candidates).anySatisfy(c -> {
                assertThat(c.url()).isEqualTo("https://trust.acme.com/dpa");
                assertThat(c.type()).isEqualTo(DocumentType.DATA_PROCESSING_AGREEMENT);
            });
        }

        @Test
        @DisplayName("should deduplicate candidates by normalized URL")
        void deduplicates() {
            acmeTrustCenter();

            List<DocumentCandidate> candidates = discover(VendorProfile.of("acme.com"));

            Set<String> normalized = candidates.stream()
                    .map(DocumentCandidate::normalizedUrl)
                    .collect(Collectors.toSet());
            assertThat(normalized).hasSize(candidates.size());
            assertThat(candidates).filteredOn(c -> c.normalizedUrl().equals("https://acme.com/privacy")).hasSize(1);
        }

        @Test
        @DisplayName("should skip links whose text is too short to classify")
        void skipsShortLinkText() {
            acmeTrustCenter();

            assertThat(discover(VendorProfile.of("acme.com")))
                    .noneMatch(c -> c.url().equals("https://acme.com/pp.pdf"));
        }

        @Test
        @DisplayName("should use a caller supplied trust center instead of probing")
        void knownTrustCenter() {
            web.html("https://acme.com/trust-portal", TRUST_CENTER_HTML);

            List<DocumentCandidate> candidates = discover(
                    new VendorProfile("acme.com", "Acme", "https://acme.com/trust-portal"));

            assertThat(candidates.get(0).url()).isEqualTo("https://acme.com/trust-portal");
            assertThat(candidates.get(0).method()).isEqualTo(DiscoveryMethod.TRUST_CENTER);
            assertThat(web.requested()).doesNotContain("https://trust.acme.com");
        }

        @Test
        @DisplayName("should follow a trust link on the site root when no trust center URL answers")
        void followsRootLink() {
            web.html("https://acme.com", """
                    <html><body><a href="https://acme.com/about">About us</a>
                    <a href="https://acme.com/our-trust-portal">Trust</a></body></html>""")
                    .html("https://acme.com/our-trust-portal", TRUST_CENTER_HTML);

            List<DocumentCandidate> candidates = discover(VendorProfile.of("acme.com"));

            assertThat(candidates.get(0).url()).isEqualTo("https://acme.com/our-trust-portal");
            assertThat(candidates.get(0).method()).isEqualTo(DiscoveryMethod.TRUST_CENTER);
        }
    }

    // =========================================================================
    //  Path probes
    // =========================================================================

    @Nested
    @DisplayName("Path probes")
    class PathProbes {

        @Test
        @DisplayName("should find conventional and vendor specific paths")
        void conventionalAndVendorPaths() {
            acmeTrustCenter();

            List<DocumentCandidate> candidates = discover(VendorProfile.of("acme.com"));

            assertThat(candidates).anySatisfy(c -> {
                assertThat(c.url()).isEqualTo("https://acme.com/security");
                assertThat(c.type()).isEqualTo(DocumentType.SECURITY_POLICY);
                assertThat(c.method()).isEqualTo(DiscoveryMethod.PATTERN);
            });
            assertThat(candidates).anySatisfy(c -> {
                assertThat(c.url()).isEqualTo("https://acme.com/legal/acme-soc2");
                assertThat(c.type()).isEqualTo(DocumentType.ATTESTATION_REPORT);
            });
        }

        @Test
        @DisplayName("should stop after scraping once enough candidates are known")
        void stopsWhenSufficient() {
            acmeTrustCenter();
            settings.setSufficientCandidates(3);

            discover(VendorProfile.of("acme.com"));

            assertThat(web.requested()).doesNotContain("https://acme.com/legal/acme-soc2");
        }

        @Test
        @DisplayName("should cap candidates per document type")
        void capsPerType() {
            StringBuilder html = new StringBuilder("<html><head><title>Trust Center</title></head><body>"
                    + "<p>SOC 2, GDPR and compliance</p>");
            for (int i = 1; i <= 8; i++) {
                html.append("<a href=\"https://trust.acme.com/soc2-").append(i).append(".pdf\">SOC 2 report ")
                        .append(i).append("</a>");
            }
            web.html("https://trust.acme.com", html.append("</body></html>").toString());

            List<DocumentCandidate> candidates = discover(VendorProfile.of("acme.com"));

            assertThat(candidates).filteredOn(c -> c.type() == DocumentType.ATTESTATION_REPORT)
                    .hasSize(settings.getMaxCandidatesPerType());
        }
    }

    // =========================================================================
    //  Failures and determinism
    // =========================================================================

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should return no candidates when every fetch fails")
        void everythingFails() {
            web.failEverything();

            assertThat(discover(VendorProfile.of("acme.com"))).isEmpty();
        }

        @Test
        @DisplayName("should reject an empty domain before doing any work")
        void emptyDomain() {
            assertThatThrownBy(() -> engine().discover(""))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(web.requested()).isEmpty();
        }

        @Test
        @DisplayName("should produce the same candidates in the same order for the same web")
        void deterministic() {
            acmeTrustCenter();

            List<DocumentCandidate> first = discover(VendorProfile.of("acme.com"));
            List<DocumentCandidate> second = discover(VendorProfile.of("acme.com"));

            assertThat(second).containsExactlyElementsOf(first);
        }

        @Test
        @DisplayName("should return nothing further once cancelled")
        void cancelled() {
            acmeTrustCenter();
            CancellationSignal signal = CancellationSignal.create();
            signal.cancel();

            List<DocumentCandidate> candidates = engine().discover(VendorProfile.of("acme.com"), executor, signal, null);

            assertThat(candidates).isEmpty();
        }
    }

    // =========================================================================
    //  LLM widening
    // =========================================================================

    @Nested
    @DisplayName("LLM suggestions")
    class LlmSuggestions {

        @Test
        @DisplayName("should keep confirmed on-domain suggestions only")
        void confirmedOnly() {
            settings.setLlmEnabled(true);
            web.text("https://acme.com/docs/iso-certificate.txt", "ISO 27001 certificate");
            StubCompletionClient model = StubCompletionClient.replying("""
                    [{"url": "https://acme.com/docs/iso-certificate.txt", "title": "ISO certificate", "type": "attestation_report"},
                     {"url": "https://acme.com/docs/missing.pdf", "title": "Missing", "type": "other"},
                     {"url": "https://evil.example.org/acme.pdf", "title": "Elsewhere", "type": "other"}]""");

            List<DocumentCandidate> candidates = engine().discover(VendorProfile.of("acme.com"), executor,
                    CancellationSignal.create(), model);

            assertThat(candidates).singleElement().satisfies(c -> {
                assertThat(c.method()).isEqualTo(DiscoveryMethod.LLM);
                assertThat(c.type()).isEqualTo(DocumentType.ATTESTATION_REPORT);
            });
            assertThat(web.requested()).doesNotContain("https://evil.example.org/acme.pdf");
        }

        @Test
        @DisplayName("should skip the model when LLM discovery is disabled")
        void disabled() {
            StubCompletionClient model = StubCompletionClient.replying("[]");

            engine().discover(VendorProfile.of("acme.com"), executor, CancellationSignal.create(), model);

            assertThat(model.calls()).isZero();
        }
    }
}
