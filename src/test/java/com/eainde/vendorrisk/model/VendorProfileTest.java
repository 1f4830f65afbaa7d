package com.eainde.vendorrisk.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VendorProfileTest {

    @Test
    @DisplayName("should normalize scheme, path, port and www prefix away")
    void normalizes() {
        VendorProfile vendor = VendorProfile.of("  https://WWW.Mixpanel.com:443/legal ");

        assertThat(vendor.domain()).isEqualTo("mixpanel.com");
        assertThat(vendor.shortName()).isEqualTo("mixpanel");
        assertThat(vendor.displayName()).isEqualTo("Mixpanel");
        assertThat(vendor.rootUrl()).isEqualTo("https://mixpanel.com");
        assertThat(vendor.wwwRootUrl()).isEqualTo("https://www.mixpanel.com");
        assertThat(vendor.trustCenter()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "localhost", "acme", "acme..com", "-acme.com"})
    @DisplayName("should reject empty or malformed domains")
    void rejects(String domain) {
        assertThatThrownBy(() -> VendorProfile.of(domain)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should keep a caller supplied name and trust center")
    void explicitValues() {
        VendorProfile vendor = new VendorProfile("acme.co.uk", "ACME Ltd", "https://trust.acme.co.uk");

        assertThat(vendor.displayName()).isEqualTo("ACME Ltd");
        assertThat(vendor.trustCenter()).contains("https://trust.acme.co.uk");
    }
}
