package com.eainde.vendorrisk.scoring;

import com.eainde.vendorrisk.config.VendorRiskProperties;
import com.eainde.vendorrisk.model.AccessLevel;
import com.eainde.vendorrisk.model.BusinessCriticality;
import com.eainde.vendorrisk.model.DataSensitivity;
import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FindingCategory;
import com.eainde.vendorrisk.model.FindingType;
import com.eainde.vendorrisk.model.RiskAssessment;
import com.eainde.vendorrisk.model.RiskCriteria;
import com.eainde.vendorrisk.model.RiskLevel;
import com.eainde.vendorrisk.model.ScoreBreakdown;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RiskScoringEngineTest {

    private final VendorRiskProperties.Scoring settings = new VendorRiskProperties.Scoring();
    private final RiskScoringEngine engine = new RiskScoringEngine(settings);

    private static Finding finding(String category, FindingType type, RiskLevel level, double confidence, int impact) {
        return Finding.builder()
                .category(category)
                .type(type)
                .riskLevel(level)
                .confidence(confidence)
                .impact(impact)
                .description(category + " " + type.value())
                .build();
    }

    private static Finding missing(String category) {
        return finding(category, FindingType.MISSING, RiskLevel.HIGH, 0.8, 8);
    }

    private static RiskCriteria sensitiveGdpr() {
        return RiskCriteria.builder()
                .dataSensitivity(DataSensitivity.HIGH)
                .regulatoryExposures(List.of("GDPR"))
                .businessCriticality(BusinessCriticality.HIGH)
                .build();
    }

    // =========================================================================
    //  Reference scenarios
    // =========================================================================

    @Nested
    @DisplayName("Reference scenarios")
    class Scenarios {

        @Test
        @DisplayName("should rate a sensitive GDPR vendor with missing controls as critical")
        void sensitiveVendorWithGaps() {
            List<Finding> findings = List.of(
                    missing(FindingCategory.ENCRYPTION),
                    missing(FindingCategory.DATA_PROTECTION),
                    missing(FindingCategory.COMPLIANCE_FRAMEWORKS));

            RiskAssessment assessment = engine.score(findings, sensitiveGdpr());

            assertThat(assessment.components()).isEqualTo(new ScoreBreakdown(74.0, 60.0, 68.0, 60.0));
            assertThat(assessment.overallScore()).isCloseTo(85.54, within(0.01));
            assertThat(assessment.riskCategory()).isEqualTo(RiskLevel.CRITICAL);
            assertThat(assessment.requiresHumanReview()).isTrue();
            assertThat(assessment.keyRiskFactors()).contains("3 high-risk finding(s)", "Missing critical security controls");
            assertThat(assessment.recommendations()).contains("Request current SOC 2 Type II report",
                    "Verify GDPR compliance and DPA execution");
        }

        @Test
        @DisplayName("should rate a vendor without findings as neutral medium risk")
        void noFindings() {
            RiskAssessment assessment = engine.score(List.of(), RiskCriteria.defaults());

            assertThat(assessment.components()).isEqualTo(ScoreBreakdown.neutral());
            assertThat(assessment.overallScore()).isEqualTo(50.0);
            assertThat(assessment.riskCategory()).isEqualTo(RiskLevel.MEDIUM);
            assertThat(assessment.requiresHumanReview()).isFalse();
            assertThat(assessment.recommendations())
                    .containsExactly("Proceed with standard vendor onboarding and annual review");
        }
    }

    // =========================================================================
    //  Properties
    // =========================================================================

    @Nested
    @DisplayName("Score properties")
    class Properties {

        @Test
        @DisplayName("should stay within 0 and 100 for extreme inputs")
        void bounded() {
            List<Finding> findings = new ArrayList<>();
            for (String category : FindingCategory.ALL) {
                findings.add(finding(category, FindingType.MISSING, RiskLevel.CRITICAL, 1.0, 10));
            }
            RiskCriteria worst = RiskCriteria.builder()
                    .dataSensitivity(DataSensitivity.CRITICAL)
                    .geographicLocations(List.of("HIGH_RISK"))
                    .regulatoryExposures(List.of("GDPR", "CCPA", "PIPEDA", "HIPAA"))
                    .accessLevel(AccessLevel.ADMIN)
                    .businessCriticality(BusinessCriticality.CRITICAL)
                    .build();

            RiskAssessment assessment = engine.score(findings, worst);

            assertThat(assessment.overallScore()).isBetween(0.0, 100.0);
            assertThat(assessment.components().operational()).isBetween(0.0, 100.0);
            assertThat(assessment.overallScore()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("should not depend on finding order")
        void orderIndependent() {
            List<Finding> findings = new ArrayList<>(List.of(
                    missing(FindingCategory.ENCRYPTION),
                    finding(FindingCategory.ACCESS_CONTROL, FindingType.COMPLIANT, RiskLevel.LOW, 0.8, 2),
                    finding(FindingCategory.PRIVACY_COMPLIANCE, FindingType.UNCLEAR, RiskLevel.MEDIUM, 0.6, 5),
                    missing(FindingCategory.INCIDENT_RESPONSE)));
            RiskAssessment first = engine.score(findings, sensitiveGdpr());

            Collections.reverse(findings);
            RiskAssessment second = engine.score(findings, sensitiveGdpr());

            assertThat(second.overallScore()).isEqualTo(first.overallScore());
            assertThat(second.components()).isEqualTo(first.components());
        }

        @Test
        @DisplayName("should never lower the score when a compliant finding turns into a missing one")
        void monotonic() {
            for (String category : FindingCategory.ALL) {
                Finding compliant = finding(category, FindingType.COMPLIANT, RiskLevel.LOW, 0.8, 6);
                Finding missing = finding(category, FindingType.MISSING, RiskLevel.LOW, 0.8, 6);
                Finding other = finding(FindingCategory.INCIDENT_RESPONSE, FindingType.UNCLEAR, RiskLevel.MEDIUM, 0.6, 5);

                double before = engine.score(List.of(compliant, other), sensitiveGdpr()).overallScore();
                double after = engine.score(List.of(missing, other), sensitiveGdpr()).overallScore();

                assertThat(after).as(category).isGreaterThanOrEqualTo(before);
            }
        }

        @Test
        @DisplayName("should produce an equal assessment for equal input")
        void idempotent() {
            List<Finding> findings = List.of(
                    missing(FindingCategory.ENCRYPTION),
                    missing(FindingCategory.PRIVACY_COMPLIANCE),
                    finding(FindingCategory.SOC2_COMPLIANCE, FindingType.COMPLIANT, RiskLevel.LOW, 0.9, 3),
                    finding(FindingCategory.NETWORK_SECURITY, FindingType.UNCLEAR, RiskLevel.MEDIUM, 0.5, 8));

            RiskAssessment first = engine.score(findings, sensitiveGdpr());
            RiskAssessment second = engine.score(List.copyOf(findings), sensitiveGdpr());

            assertThat(second).isEqualTo(first);
            assertThat(second.keyRiskFactors()).isEqualTo(first.keyRiskFactors());
            assertThat(second.recommendations()).isEqualTo(first.recommendations());
        }

        @Test
        @DisplayName("should draw the critical boundary at 80")
        void criticalBoundary() {
            assertThat(RiskScoringEngine.categorize(80.0)).isEqualTo(RiskLevel.CRITICAL);
            assertThat(RiskScoringEngine.categorize(79.99)).isEqualTo(RiskLevel.HIGH);
            assertThat(RiskScoringEngine.categorize(65.0)).isEqualTo(RiskLevel.HIGH);
            assertThat(RiskScoringEngine.categorize(40.0)).isEqualTo(RiskLevel.MEDIUM);
            assertThat(RiskScoringEngine.categorize(39.99)).isEqualTo(RiskLevel.LOW);
        }
    }

    // =========================================================================
    //  Components and context
    // =========================================================================

    @Nested
    @DisplayName("Components")
    class Components {

        @Test
        @DisplayName("should weigh encryption double for sensitive data")
        void encryptionWeighting() {
            List<Finding> findings = List.of(missing(FindingCategory.ENCRYPTION));

            assertThat(engine.dataSecurityScore(findings, RiskCriteria.defaults())).isCloseTo(60.0, within(1e-9));
            assertThat(engine.dataSecurityScore(findings, sensitiveGdpr())).isCloseTo(66.0, within(1e-9));
        }

        @Test
        @DisplayName("should cap the privacy regime penalty at 30")
        void privacyPenaltyCap() {
            RiskCriteria manyRegimes = RiskCriteria.builder()
                    .regulatoryExposures(List.of("GDPR", "CCPA", "PIPEDA"))
                    .build();

            assertThat(engine.privacyScore(List.of(), manyRegimes)).isEqualTo(80.0);
        }

        @Test
        @DisplayName("should credit compliant and penalise missing compliance findings")
        void complianceScore() {
            List<Finding> findings = List.of(
                    finding(FindingCategory.SOC2_COMPLIANCE, FindingType.COMPLIANT, RiskLevel.LOW, 0.9, 3),
                    finding(FindingCategory.SOC2_COMPLIANCE, FindingType.COMPLIANT, RiskLevel.LOW, 0.9, 3),
                    missing(FindingCategory.ISO27001));

            assertThat(engine.complianceScore(findings)).isEqualTo(60.0 - 10.0 + 8.0);
            assertThat(engine.complianceScore(List.of())).isEqualTo(50.0);
        }

        @Test
        @DisplayName("should use the strongest context multiplier and treat unknown locations as elevated")
        void contextMultiplier() {
            RiskCriteria unknownLocation = RiskCriteria.builder()
                    .geographicLocations(List.of("US", "Atlantis"))
                    .build();

            assertThat(engine.contextMultiplier(RiskCriteria.defaults())).isEqualTo(1.0);
            assertThat(engine.contextMultiplier(unknownLocation)).isEqualTo(1.2);
            assertThat(engine.contextMultiplier(sensitiveGdpr())).isEqualTo(1.3);
        }

        @Test
        @DisplayName("should require review for a single critical finding even when the score is low")
        void singleCriticalFinding() {
            Finding critical = finding(FindingCategory.ENCRYPTION, FindingType.COMPLIANT, RiskLevel.CRITICAL, 0.9, 5);
            Finding low = finding(FindingCategory.ENCRYPTION, FindingType.COMPLIANT, RiskLevel.LOW, 0.9, 5);

            RiskAssessment withCritical = engine.score(List.of(critical), RiskCriteria.defaults());
            RiskAssessment withoutCritical = engine.score(List.of(low), RiskCriteria.defaults());

            assertThat(withCritical.overallScore()).isLessThan(85.0);
            assertThat(withCritical.requiresHumanReview()).isTrue();
            assertThat(withoutCritical.overallScore()).isEqualTo(withCritical.overallScore());
            assertThat(withoutCritical.requiresHumanReview()).isFalse();
        }

        @Test
        @DisplayName("should require review from the high-risk threshold upwards")
        void highRiskThreshold() {
            assertThat(engine.requiresHumanReview(85.0, List.of())).isTrue();
            assertThat(engine.requiresHumanReview(84.99, List.of())).isFalse();
        }

        @Test
        @DisplayName("should require review for several uncertain high-impact findings")
        void uncertainFindingsNeedReview() {
            List<Finding> findings = List.of(
                    finding(FindingCategory.NETWORK_SECURITY, FindingType.UNCLEAR, RiskLevel.MEDIUM, 0.5, 8),
                    finding(FindingCategory.VENDOR_MANAGEMENT, FindingType.UNCLEAR, RiskLevel.MEDIUM, 0.4, 7));

            assertThat(engine.score(findings, RiskCriteria.defaults()).requiresHumanReview()).isTrue();
        }
    }

    @Test
    @DisplayName("should reject component weights that do not sum to one")
    void invalidWeights() {
        VendorRiskProperties.Scoring invalid = new VendorRiskProperties.Scoring();
        invalid.getComponentWeights().setDataSecurity(0.5);

        assertThatThrownBy(() -> new RiskScoringEngine(invalid))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sum to 1.0");
    }
}
