package com.eainde.vendorrisk.config;

import com.eainde.vendorrisk.analysis.ComplianceAnalysisEngine;
import com.eainde.vendorrisk.discovery.DocumentDiscoveryEngine;
import com.eainde.vendorrisk.discovery.LlmDiscoveryAdvisor;
import com.eainde.vendorrisk.extract.ContentExtractor;
import com.eainde.vendorrisk.fetch.FetchClient;
import com.eainde.vendorrisk.fetch.OkHttpFetchClient;
import com.eainde.vendorrisk.followup.EscalationProcessor;
import com.eainde.vendorrisk.followup.FollowUpEngine;
import com.eainde.vendorrisk.llm.ChatModelCompletionClient;
import com.eainde.vendorrisk.llm.CompletionClient;
import com.eainde.vendorrisk.llm.DisabledCompletionClient;
import com.eainde.vendorrisk.retrieval.DocumentRetriever;
import com.eainde.vendorrisk.scoring.RiskScoringEngine;
import com.eainde.vendorrisk.storage.DocumentStorage;
import com.eainde.vendorrisk.storage.FileSystemDocumentStorage;
import com.eainde.vendorrisk.storage.NoOpDocumentStorage;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
@EnableConfigurationProperties(VendorRiskProperties.class)
public class VendorRiskConfiguration {

    // =========================================================================
    //  I/O
    // =========================================================================

    @Bean
    public OkHttpClient okHttpClient(VendorRiskProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(properties.getDiscovery().getProbeTimeout())
                .readTimeout(properties.getRetrieval().getFetchTimeout())
                .connectionPool(new ConnectionPool(16, 5, TimeUnit.MINUTES))
                .build();
    }

    @Bean
    public FetchClient fetchClient(OkHttpClient okHttpClient, VendorRiskProperties properties) {
        return new OkHttpFetchClient(okHttpClient, properties.getRetrieval().getMaxDocumentBytes());
    }

    @Bean
    public ContentExtractor contentExtractor() {
        return new ContentExtractor();
    }

    @Bean
    public DocumentStorage documentStorage(VendorRiskProperties properties) {
        String basePath = properties.getStorage().getBasePath();
        if (basePath == null || basePath.isBlank()) {
            log.info("Document archiving disabled");
            return new NoOpDocumentStorage();
        }
        log.info("Archiving documents under {}", basePath);
        return new FileSystemDocumentStorage(Path.of(basePath));
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // =========================================================================
    //  Language model
    // =========================================================================

    @Bean
    @ConditionalOnExpression("!'${vendor-risk.llm.api-key:}'.isBlank()")
    public ChatModel vendorRiskChatModel(VendorRiskProperties properties) {
        VendorRiskProperties.Llm llm = properties.getLlm();
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModelName())
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout());
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    @Bean
    public CompletionClient completionClient(ObjectProvider<ChatModel> chatModel) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.info("No language model configured, narrative analysis and LLM discovery are off");
            return new DisabledCompletionClient();
        }
        return new ChatModelCompletionClient(model);
    }

    // =========================================================================
    //  Pipeline stages
    // =========================================================================

    @Bean
    public LlmDiscoveryAdvisor llmDiscoveryAdvisor(ObjectMapper objectMapper) {
        return new LlmDiscoveryAdvisor(objectMapper);
    }

    @Bean
    public DocumentDiscoveryEngine documentDiscoveryEngine(VendorRiskProperties properties,
                                                           FetchClient fetchClient,
                                                           ContentExtractor contentExtractor,
                                                           LlmDiscoveryAdvisor llmDiscoveryAdvisor) {
        return new DocumentDiscoveryEngine(properties.getDiscovery(), fetchClient, contentExtractor, llmDiscoveryAdvisor);
    }

    @Bean
    public DocumentRetriever documentRetriever(VendorRiskProperties properties,
                                               FetchClient fetchClient,
                                               ContentExtractor contentExtractor,
                                               DocumentStorage documentStorage) {
        return new DocumentRetriever(properties.getRetrieval(), fetchClient, contentExtractor, documentStorage);
    }

    @Bean
    public ComplianceAnalysisEngine complianceAnalysisEngine(VendorRiskProperties properties, ObjectMapper objectMapper) {
        return new ComplianceAnalysisEngine(properties.getAnalysis(), objectMapper);
    }

    @Bean
    public RiskScoringEngine riskScoringEngine(VendorRiskProperties properties) {
        return new RiskScoringEngine(properties.getScoring());
    }

    @Bean
    public FollowUpEngine followUpEngine(VendorRiskProperties properties, Clock clock) {
        return new FollowUpEngine(properties.getFollowUp(), clock);
    }

    @Bean
    public EscalationProcessor escalationProcessor(VendorRiskProperties properties, Clock clock) {
        return new EscalationProcessor(properties.getFollowUp(), clock);
    }
}
