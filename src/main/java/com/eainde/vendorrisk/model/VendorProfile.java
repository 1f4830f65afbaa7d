package com.eainde.vendorrisk.model;

import java.io.Serializable;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The vendor being assessed. Created once at the start of a run and never mutated.
 *
 * @param domain         normalized host, e.g. {@code acme.com}; unique key of the vendor
 * @param displayName    human readable name used in outbound messages
 * @param trustCenterUrl trust-center page when the caller already knows it, otherwise {@code null}
 */
public record VendorProfile(String domain, String displayName, String trustCenterUrl) implements Serializable {

    private static final Pattern HOST = Pattern.compile(
            "^(?=.{1,253}$)([a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,63}$");

    public VendorProfile {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("Vendor domain must not be empty");
        }
        domain = normalizeDomain(domain);
        if (!HOST.matcher(domain).matches()) {
            throw new IllegalArgumentException("Malformed vendor domain: " + domain);
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = capitalize(shortName(domain));
        }
        if (trustCenterUrl != null && trustCenterUrl.isBlank()) {
            trustCenterUrl = null;
        }
    }

    public static VendorProfile of(String domain) {
        return new VendorProfile(domain, null, null);
    }

    public Optional<String> trustCenter() {
        return Optional.ofNullable(trustCenterUrl);
    }

    /**
     * Domain with {@code www.} and the top-level domain stripped; {@code www.mixpanel.com} becomes
     * {@code mixpanel}. Used to build vendor-specific legal paths.
     */
    public String shortName() {
        return shortName(domain);
    }

    public String rootUrl() {
        return "https://" + domain;
    }

    public String wwwRootUrl() {
        return "https://www." + domain;
    }

    /**
     * Strips scheme, path, port and a leading {@code www.} from user input.
     */
    public static String normalizeDomain(String raw) {
        String d = raw.strip().toLowerCase(Locale.ROOT);
        int scheme = d.indexOf("://");
        if (scheme >= 0) {
            d = d.substring(scheme + 3);
        }
        int slash = d.indexOf('/');
        if (slash >= 0) {
            d = d.substring(0, slash);
        }
        int port = d.indexOf(':');
        if (port >= 0) {
            d = d.substring(0, port);
        }
        if (d.startsWith("www.")) {
            d = d.substring(4);
        }
        while (d.endsWith(".")) {
            d = d.substring(0, d.length() - 1);
        }
        return d;
    }

    private static String shortName(String domain) {
        int dot = domain.lastIndexOf('.');
        String withoutTld = dot > 0 ? domain.substring(0, dot) : domain;
        int previous = withoutTld.lastIndexOf('.');
        return previous >= 0 ? withoutTld.substring(previous + 1) : withoutTld;
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) return s;
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
