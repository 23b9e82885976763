package com.sellerInsight.buyBox;

import com.sellerInsight.buyBox.marketplace.config.RetryProperties;
import com.sellerInsight.buyBox.marketplace.service.AccessTokenProvider;
import com.sellerInsight.buyBox.orchestrator.service.BuyBoxAnalysisService;
import com.sellerInsight.buyBox.quota.config.QuotaProperties;
import com.sellerInsight.buyBox.quota.model.QuotaCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "buybox.sp-api.access-token=Atza-context-test-token",
        "buybox.quota.pricing.burst=3"
})
class BuyBoxAnalyzerApplicationTest {
    
    @Autowired
    private BuyBoxAnalysisService analysisService;
    
    @Autowired
    private AccessTokenProvider accessTokenProvider;
    
    @Autowired
    private QuotaProperties quotaProperties;
    
    @Autowired
    private RetryProperties retryProperties;
    
    @Test
    @DisplayName("Context starts and binds quota and retry settings from application.yaml")
    void contextLoads() {
        assertThat(analysisService).isNotNull();
        assertThat(accessTokenProvider.isValid()).isTrue();
        
        assertThat(quotaProperties.forCategory(QuotaCategory.CATALOG).getRefillPerSecond()).isEqualTo(2.0d);
        assertThat(quotaProperties.forCategory(QuotaCategory.CATALOG).getBurst()).isEqualTo(2);
        assertThat(quotaProperties.forCategory(QuotaCategory.PRICING).getRefillPerSecond()).isEqualTo(0.5d);
        assertThat(quotaProperties.forCategory(QuotaCategory.PRICING).getBurst()).isEqualTo(3);
        
        assertThat(retryProperties.forCategory(QuotaCategory.CATALOG).getMaxDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(retryProperties.forCategory(QuotaCategory.PRICING).getInitialDelay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(retryProperties.forCategory(QuotaCategory.PRICING).getMaxAttempts()).isEqualTo(3);
    }
}
