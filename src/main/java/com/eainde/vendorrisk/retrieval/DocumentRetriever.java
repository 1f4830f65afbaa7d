package com.eainde.vendorrisk.retrieval;

import com.eainde.vendorrisk.config.VendorRiskProperties;
import com.eainde.vendorrisk.extract.ContentExtractor;
import com.eainde.vendorrisk.extract.ExtractedContent;
import com.eainde.vendorrisk.fetch.FetchClient;
import com.eainde.vendorrisk.fetch.FetchException;
import com.eainde.vendorrisk.fetch.FetchResponse;
import com.eainde.vendorrisk.model.DocumentCandidate;
import com.eainde.vendorrisk.model.RetrievedDocument;
import com.eainde.vendorrisk.model.VendorProfile;
import com.eainde.vendorrisk.storage.DocumentStorage;
import com.eainde.vendorrisk.thread.BoundedFanOut;
import com.eainde.vendorrisk.thread.CancellationSignal;
import com.eainde.vendorrisk.thread.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Materializes candidates: fetch, size check, text extraction, hashing and best-effort archiving.
 * <p>
 * A candidate that cannot be retrieved (non-2xx, timeout, oversized or unsupported body, no text)
 * simply produces nothing. Archiving failures are logged and the document is analyzed in memory.
 */
@Slf4j
public class DocumentRetriever {

    private final VendorRiskProperties.Retrieval settings;
    private final FetchClient fetchClient;
    private final ContentExtractor extractor;
    private final DocumentStorage storage;

    public DocumentRetriever(VendorRiskProperties.Retrieval settings,
                             FetchClient fetchClient,
                             ContentExtractor extractor,
                             DocumentStorage storage) {
        this.settings = settings;
        this.fetchClient = fetchClient;
        this.extractor = extractor;
        this.storage = storage;
    }

    /**
     * Retrieves all candidates concurrently; results keep candidate order.
     */
    public List<RetrievedDocument> retrieveAll(VendorProfile vendor,
                                               List<DocumentCandidate> candidates,
                                               MdcAwareExecutor executor,
                                               CancellationSignal cancellation) {
        // extraction of a large PDF can take a while after the body has arrived
        Duration budget = settings.getFetchTimeout().multipliedBy(2);
        List<RetrievedDocument> documents = BoundedFanOut.map(candidates,
                candidate -> retrieve(vendor, candidate), executor, budget, cancellation);
        log.info("Retrieved {} of {} candidates for {}", documents.size(), candidates.size(), vendor.domain());
        return documents;
    }

    public Optional<RetrievedDocument> retrieve(VendorProfile vendor, DocumentCandidate candidate) {
        FetchResponse response;
        try {
            response = fetchClient.get(candidate.url(), settings.getFetchTimeout());
        } catch (FetchException e) {
            log.debug("Retrieval of {} failed: {}", candidate.url(), e.getMessage());
            return Optional.empty();
        }
        if (!response.isSuccessful()) {
            log.debug("Retrieval of {} returned {}", candidate.url(), response.status());
            return Optional.empty();
        }
        byte[] body = response.body();
        if (body.length > settings.getMaxDocumentBytes()) {
            log.warn("Skipping {}: {} bytes exceeds limit", candidate.url(), body.length);
            return Optional.empty();
        }

        Optional<ExtractedContent> extracted = extractor.extract(body, response.contentType(), response.charset(),
                response.url());
        if (extracted.isEmpty() || extracted.get().isBlank()) {
            log.debug("No text extracted from {}", candidate.url());
            return Optional.empty();
        }
        ExtractedContent content = extracted.get();

        String hash = sha256(body);
        String location = archive(vendor, hash, content.contentType(), body);
        String title = content.title().isEmpty() ? candidate.title() : content.title();
        return Optional.of(new RetrievedDocument(candidate, title, content.text(), hash, body.length,
                content.contentType(), location));
    }

    private String archive(VendorProfile vendor, String hash, String contentType, byte[] body) {
        String key = vendor.shortName() + "_" + hash.substring(0, 12) + extension(contentType);
        try {
            return storage.save(key, body);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not archive {}: {}", key, e.toString());
            return null;
        }
    }

    static String extension(String contentType) {
        if (ContentExtractor.PDF.equals(contentType)) return ".pdf";
        if (ContentExtractor.HTML.equals(contentType)) return ".html";
        return ".txt";
    }

    static String sha256(byte[] body) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(body));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String sha256(String text) {
        return sha256(text.getBytes(StandardCharsets.UTF_8));
    }
}
