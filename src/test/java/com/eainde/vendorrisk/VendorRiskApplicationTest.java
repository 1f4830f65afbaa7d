package com.eainde.vendorrisk;

import com.eainde.vendorrisk.llm.CompletionClient;
import com.eainde.vendorrisk.llm.DisabledCompletionClient;
import com.eainde.vendorrisk.storage.DocumentStorage;
import com.eainde.vendorrisk.storage.NoOpDocumentStorage;
import com.eainde.vendorrisk.workflow.RunContextRegistry;
import com.eainde.vendorrisk.workflow.VendorAssessmentService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {"vendor-risk.llm.api-key=", "vendor-risk.storage.base-path="})
class VendorRiskApplicationTest {

    @Autowired
    private VendorAssessmentService assessmentService;

    @Autowired
    private CompletionClient completionClient;

    @Autowired
    private DocumentStorage documentStorage;

    @Autowired
    private RunContextRegistry runContexts;

    @Test
    @DisplayName("should wire the pipeline without a language model or archive directory")
    void contextLoads() {
        assertThat(assessmentService).isNotNull();
        assertThat(completionClient).isInstanceOf(DisabledCompletionClient.class);
        assertThat(documentStorage).isInstanceOf(NoOpDocumentStorage.class);
        assertThat(runContexts.activeRuns()).isZero();
    }
}
