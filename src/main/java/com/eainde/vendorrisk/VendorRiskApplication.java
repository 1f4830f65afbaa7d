package com.eainde.vendorrisk;

import com.eainde.vendorrisk.model.AssessmentResult;
import com.eainde.vendorrisk.model.RiskCriteria;
import com.eainde.vendorrisk.workflow.VendorAssessmentService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Assesses the vendor domains given as arguments and logs the outcome of each.
 */
@Slf4j
@SpringBootApplication
public class VendorRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(VendorRiskApplication.class, args);
    }

    @Bean
    public CommandLineRunner assessFromArguments(VendorAssessmentService service) {
        return args -> {
            for (String domain : args) {
                if (domain.startsWith("--")) {
                    continue;
                }
                try {
                    AssessmentResult result = service.assessVendor(domain, RiskCriteria.defaults());
                    log.info("{}: score {} ({}), {} follow-up actions, review required: {}",
                            result.vendor().domain(), result.overallScore(), result.riskCategory().value(),
                            result.followUpActions().size(), result.requiresHumanReview());
                } catch (IllegalArgumentException e) {
                    log.error("Skipping '{}': {}", domain, e.getMessage());
                }
            }
        };
    }
}
