package com.eainde.vendorrisk.model;

public enum DiscoveryMethod {
    /** The vendor's trust-center page itself. */
    TRUST_CENTER,
    /** Link found on a trust-center page or the site root. */
    SCRAPE,
    /** Conventional path probed directly. */
    PATTERN,
    /** Suggested by the language model and confirmed with a probe. */
    LLM
}
