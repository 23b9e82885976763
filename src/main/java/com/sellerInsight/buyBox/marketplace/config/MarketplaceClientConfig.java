package com.sellerInsight.buyBox.marketplace.config;

import com.sellerInsight.buyBox.marketplace.service.AccessTokenProvider;
import com.sellerInsight.buyBox.marketplace.service.StaticAccessTokenProvider;
import com.sellerInsight.buyBox.util.SecretMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wiring for the Selling Partner API HTTP client.
 */
@Slf4j
@Configuration
public class MarketplaceClientConfig {
    
    @Bean
    public RestClient spApiRestClient(
            RestClient.Builder builder,
            @Value("${buybox.sp-api.base-url:https://sellingpartnerapi-na.amazon.com}") String baseUrl,
            @Value("${buybox.sp-api.connect-timeout:5000}") int connectTimeoutMs,
            @Value("${buybox.sp-api.read-timeout:30000}") int readTimeoutMs) {
        
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        
        log.info("Configuring SP-API client - baseUrl: {}, connectTimeoutMs: {}, readTimeoutMs: {}", 
                baseUrl, connectTimeoutMs, readTimeoutMs);
        
        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
    
    @Bean
    @ConditionalOnMissingBean(AccessTokenProvider.class)
    public AccessTokenProvider accessTokenProvider(@Value("${buybox.sp-api.access-token:}") String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            log.warn("SP-API access token not configured - lookups will be rejected until buybox.sp-api.access-token is set");
        } else {
            log.info("Loaded SP-API access token from configuration - token: {}", SecretMasker.mask(accessToken));
        }
        return new StaticAccessTokenProvider(accessToken);
    }
}
