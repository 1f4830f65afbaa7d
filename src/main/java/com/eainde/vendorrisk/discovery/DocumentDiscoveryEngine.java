package com.eainde.vendorrisk.discovery;

import com.eainde.vendorrisk.config.VendorRiskProperties;
import com.eainde.vendorrisk.extract.ContentExtractor;
import com.eainde.vendorrisk.extract.ExtractedContent;
import com.eainde.vendorrisk.extract.PageLink;
import com.eainde.vendorrisk.fetch.FetchClient;
import com.eainde.vendorrisk.fetch.FetchException;
import com.eainde.vendorrisk.fetch.FetchResponse;
import com.eainde.vendorrisk.llm.CompletionClient;
import com.eainde.vendorrisk.model.DiscoveryMethod;
import com.eainde.vendorrisk.model.DocumentCandidate;
import com.eainde.vendorrisk.model.DocumentType;
import com.eainde.vendorrisk.model.VendorProfile;
import com.eainde.vendorrisk.thread.BoundedFanOut;
import com.eainde.vendorrisk.thread.CancellationSignal;
import com.eainde.vendorrisk.thread.MdcAwareExecutor;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Finds candidate compliance documents for a vendor domain.
 *
 * <h3>Stages (in priority order):</h3>
 * <ol>
 *   <li><b>Trust center</b>: the known URL, else the first conventional trust-center URL whose page
 *       scores enough trust indicators, else a trust-looking link on the site root.</li>
 *   <li><b>Scrape</b>: links on the trust center (or the site root) classified by {@link DocumentPatterns}.</li>
 *   <li><b>Path probes</b>: conventional and vendor-specific paths on the domain and its {@code www} host.</li>
 *   <li><b>LLM</b>: optional, model-suggested URLs confirmed by a probe.</li>
 * </ol>
 * Discovery stops after any stage once enough candidates are known. Candidates are deduplicated
 * by normalized URL and capped per document type, keeping the earliest (most confident) ones.
 *
 * <p>Per-URL failures never surface; the only exception is {@link IllegalArgumentException} for
 * an unusable domain, raised when the {@link VendorProfile} is built.</p>
 */
public class DocumentDiscoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(DocumentDiscoveryEngine.class);

    private static final int MIN_LINK_TEXT = 3;

    private final VendorRiskProperties.Discovery settings;
    private final FetchClient fetchClient;
    private final ContentExtractor extractor;
    private final TrustCenterDetector trustCenterDetector;
    private final LlmDiscoveryAdvisor llmAdvisor;

    public DocumentDiscoveryEngine(VendorRiskProperties.Discovery settings,
                                   FetchClient fetchClient,
                                   ContentExtractor extractor,
                                   LlmDiscoveryAdvisor llmAdvisor) {
        this.settings = settings;
        this.fetchClient = fetchClient;
        this.extractor = extractor;
        this.llmAdvisor = llmAdvisor;
        this.trustCenterDetector = new TrustCenterDetector(settings.getTrustIndicatorThreshold());
    }

    /**
     * Standalone discovery with a private worker pool, no cancellation and no LLM widening.
     */
    public List<DocumentCandidate> discover(String domain) {
        VendorProfile vendor = VendorProfile.of(domain);
        try (MdcAwareExecutor executor = new MdcAwareExecutor("discovery", settings.getConcurrency())) {
            return discover(vendor, executor, CancellationSignal.create(), null);
        }
    }

    /**
     * @param completion model used for the optional LLM stage; {@code null} skips that stage
     */
    public List<DocumentCandidate> discover(VendorProfile vendor,
                                            MdcAwareExecutor executor,
                                            CancellationSignal cancellation,
                                            CompletionClient completion) {
        CandidateSet found = new CandidateSet(settings.getMaxCandidatesPerType());
        log.info("Starting discovery for {}", vendor.domain());

        // ── Stage 1: trust center ──
        Optional<Page> root = Optional.empty();
        Optional<Page> trustCenter = locateKnownTrustCenter(vendor, cancellation)
                .or(() -> probeTrustCenter(vendor, executor, cancellation));
        if (trustCenter.isEmpty()) {
            root = fetchRoot(vendor, cancellation);
            trustCenter = root.flatMap(page -> followTrustLink(page, cancellation));
        }
        trustCenter.ifPresent(page -> {
            log.info("Trust center for {}: {}", vendor.domain(), page.url());
            found.add(new DocumentCandidate(DocumentType.SECURITY_POLICY,
                    page.content().title().isEmpty() ? "Trust Center" : page.content().title(),
                    page.url(), DiscoveryMethod.TRUST_CENTER));
        });

        // ── Stage 2: scrape links ──
        Optional<Page> scrapeSource = trustCenter.isPresent() ? trustCenter : root;
        scrapeSource.ifPresent(page -> scrapeLinks(page, found));
        if (enough(found, cancellation, "scrape")) {
            return found.toList();
        }

        // ── Stage 3: conventional paths ──
        List<ProbeCatalog.Probe> probes = ProbeCatalog.pathProbes(vendor).stream()
                .filter(p -> !found.contains(p.url()))
                .toList();
        List<DocumentCandidate> probed = BoundedFanOut.map(probes, this::probePath, executor,
                settings.getProbeTimeout(), cancellation);
        probed.forEach(found::add);
        log.info("Path probes for {}: {} of {} URLs responded with a classifiable page",
                vendor.domain(), probed.size(), probes.size());
        if (enough(found, cancellation, "path probes")) {
            return found.toList();
        }

        // ── Stage 4: LLM widening ──
        if (settings.isLlmEnabled() && completion != null && llmAdvisor != null) {
            List<DocumentCandidate> suggested = llmAdvisor.suggest(vendor, completion).stream()
                    .filter(c -> !found.contains(c.url()))
                    .toList();
            List<DocumentCandidate> confirmed = BoundedFanOut.map(suggested, this::confirm, executor,
                    settings.getProbeTimeout(), cancellation);
            confirmed.forEach(found::add);
            log.info("LLM stage for {}: {} of {} suggestions confirmed",
                    vendor.domain(), confirmed.size(), suggested.size());
        }

        List<DocumentCandidate> result = found.toList();
        log.info("Discovery for {} finished with {} candidates", vendor.domain(), result.size());
        return result;
    }

    // =========================================================================
    //  Trust center
    // =========================================================================

    private Optional<Page> locateKnownTrustCenter(VendorProfile vendor, CancellationSignal cancellation) {
        return vendor.trustCenter().flatMap(url -> fetchHtml(url, cancellation));
    }

    private Optional<Page> probeTrustCenter(VendorProfile vendor, MdcAwareExecutor executor,
                                            CancellationSignal cancellation) {
        List<Page> qualifying = BoundedFanOut.map(ProbeCatalog.trustCenterUrls(vendor),
                url -> fetchHtml(url, cancellation)
                        .filter(page -> trustCenterDetector.isTrustCenter(page.content().text())),
                executor, settings.getProbeTimeout(), cancellation);
        // results keep catalog order, so the first qualifying pattern wins
        return qualifying.stream().findFirst();
    }

    private Optional<Page> fetchRoot(VendorProfile vendor, CancellationSignal cancellation) {
        for (String url : ProbeCatalog.rootUrls(vendor)) {
            Optional<Page> page = fetchHtml(url, cancellation);
            if (page.isPresent()) {
                return page;
            }
        }
        log.debug("Site root of {} not reachable", vendor.domain());
        return Optional.empty();
    }

    private Optional<Page> followTrustLink(Page root, CancellationSignal cancellation) {
        List<PageLink> links = extractor.links(root.document());
        for (String keyword : TrustCenterDetector.LINK_KEYWORDS) {
            for (PageLink link : links) {
                String haystack = (link.text() + " " + link.url()).toLowerCase(Locale.ROOT);
                if (haystack.contains(keyword)
                        && !DocumentCandidate.normalize(link.url()).equals(DocumentCandidate.normalize(root.url()))) {
                    Optional<Page> page = fetchHtml(link.url(), cancellation);
                    if (page.isPresent()) {
                        return page;
                    }
                }
            }
        }
        return Optional.empty();
    }

    // =========================================================================
    //  Scraping and probing
    // =========================================================================

    private void scrapeLinks(Page page, CandidateSet found) {
        int before = found.size();
        for (PageLink link : extractor.links(page.document())) {
            if (link.text().length() < MIN_LINK_TEXT) {
                continue;
            }
            DocumentPatterns.classifyLink(link.text(), link.url())
                    .ifPresent(type -> found.add(new DocumentCandidate(type, link.text(), link.url(),
                            DiscoveryMethod.SCRAPE)));
        }
        log.info("Scraped {} candidates from {}", found.size() - before, page.url());
    }

    private Optional<DocumentCandidate> probePath(ProbeCatalog.Probe probe) {
        return fetch(probe.url(), settings.getProbeTimeout()).flatMap(response -> {
            Optional<ExtractedContent> content = extractor.extract(response.body(), response.contentType(),
                    response.charset(), response.url());
            if (content.isEmpty() || content.get().isBlank()) {
                return Optional.empty();
            }
            String title = content.get().title();
            Optional<DocumentType> type = DocumentPatterns.classify(probe.url() + " " + title)
                    .or(() -> Optional.ofNullable(probe.expectedType()))
                    .or(() -> DocumentPatterns.classify(head(content.get().text())));
            return type.map(t -> new DocumentCandidate(t, title, response.url(), DiscoveryMethod.PATTERN));
        });
    }

    private Optional<DocumentCandidate> confirm(DocumentCandidate suggestion) {
        return fetch(suggestion.url(), settings.getProbeTimeout())
                .map(response -> new DocumentCandidate(suggestion.type(), suggestion.title(),
                        response.url(), DiscoveryMethod.LLM));
    }

    private Optional<Page> fetchHtml(String url, CancellationSignal cancellation) {
        if (cancellation.isCancelled()) {
            return Optional.empty();
        }
        return fetch(url, settings.getProbeTimeout())
                .filter(FetchResponse::isHtml)
                .flatMap(this::parsePage);
    }

    private Optional<Page> parsePage(FetchResponse response) {
        try {
            Document document = extractor.parseHtml(response.body(), response.charset(), response.url());
            return Optional.of(new Page(response.url(), document, extractor.fromHtml(document)));
        } catch (IOException e) {
            log.debug("Could not parse {}: {}", response.url(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return the response when it is 2xx; failures are logged at debug and dropped
     */
    private Optional<FetchResponse> fetch(String url, Duration timeout) {
        try {
            FetchResponse response = fetchClient.get(url, timeout);
            if (!response.isSuccessful()) {
                log.debug("Probe {} returned {}", url, response.status());
                return Optional.empty();
            }
            return Optional.of(response);
        } catch (FetchException e) {
            log.debug("Probe {} failed: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean enough(CandidateSet found, CancellationSignal cancellation, String stage) {
        if (cancellation.isCancelled()) {
            log.info("Discovery cancelled after {} with {} candidates", stage, found.size());
            return true;
        }
        if (found.size() >= settings.getSufficientCandidates()) {
            log.info("Enough candidates after {} ({}), skipping remaining stages", stage, found.size());
            return true;
        }
        return false;
    }

    private static String head(String text) {
        return text.length() > 2_000 ? text.substring(0, 2_000) : text;
    }

    private record Page(String url, Document document, ExtractedContent content) {
    }

    /**
     * Insertion-ordered candidates keyed by normalized URL with a per-type cap.
     */
    static final class CandidateSet {

        private final Map<String, DocumentCandidate> byUrl = new LinkedHashMap<>();
        private final Map<DocumentType, Integer> perType = new LinkedHashMap<>();
        private final int maxPerType;

        CandidateSet(int maxPerType) {
            this.maxPerType = maxPerType;
        }

        boolean add(DocumentCandidate candidate) {
            String key = candidate.normalizedUrl();
            if (byUrl.containsKey(key)) {
                return false;
            }
            int count = perType.getOrDefault(candidate.type(), 0);
            if (count >= maxPerType) {
                return false;
            }
            byUrl.put(key, candidate);
            perType.put(candidate.type(), count + 1);
            return true;
        }

        boolean contains(String url) {
            return byUrl.containsKey(DocumentCandidate.normalize(url));
        }

        int size() {
            return byUrl.size();
        }

        List<DocumentCandidate> toList() {
            return List.copyOf(new ArrayList<>(byUrl.values()));
        }
    }
}
