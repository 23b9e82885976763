package com.sellerInsight.buyBox.marketplace.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.sellerInsight.buyBox.marketplace.config.RetryConfigFactory;
import com.sellerInsight.buyBox.marketplace.config.RetryProperties;
import com.sellerInsight.buyBox.marketplace.exception.MarketplaceApiException;
import com.sellerInsight.buyBox.marketplace.exception.OperationCancelledException;
import com.sellerInsight.buyBox.marketplace.exception.RetriesExhaustedException;
import com.sellerInsight.buyBox.marketplace.exception.TransientApiException;
import com.sellerInsight.buyBox.quota.model.QuotaCategory;
import com.sellerInsight.buyBox.quota.service.QuotaGovernor;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Rate-governed, retrying access to catalog and pricing data.
 *
 * Each quota category has its own Resilience4j {@link Retry}. Every attempt takes a
 * fresh token from the category's quota bucket; tokens spent on failed attempts are
 * not refunded. Transient failures are retried with exponential backoff and jitter,
 * permanent failures surface immediately.
 */
@Slf4j
@Service
public class ResilientMarketplaceClient {
    
    static final String UNKNOWN_PRODUCT_NAME = "Unknown";
    
    private final MarketplaceGateway gateway;
    private final QuotaGovernor quotaGovernor;
    private final Map<QuotaCategory, Retry> retries = new EnumMap<>(QuotaCategory.class);
    private final String marketplaceId;
    private final String connectionCheckProductId;
    
    public ResilientMarketplaceClient(
            MarketplaceGateway gateway,
            QuotaGovernor quotaGovernor,
            RetryProperties retryProperties,
            @Value("${buybox.sp-api.marketplace-id:ATVPDKIKX0DER}") String marketplaceId,
            @Value("${buybox.sp-api.connection-check-asin:B08N5WRWNW}") String connectionCheckProductId) {
        this.gateway = gateway;
        this.quotaGovernor = quotaGovernor;
        this.marketplaceId = marketplaceId;
        this.connectionCheckProductId = connectionCheckProductId;
        for (QuotaCategory category : QuotaCategory.values()) {
            retries.put(category, createRetry(category, retryProperties));
        }
    }
    
    /**
     * Fetches the competing offers for a product.
     *
     * @param productId ASIN
     * @return The {@code payload} object of the getItemOffers response (raw, not normalized)
     * @throws com.sellerInsight.buyBox.marketplace.exception.PermanentApiException on a non-retryable failure
     * @throws RetriesExhaustedException if every attempt failed transiently
     * @throws OperationCancelledException if interrupted while waiting
     */
    public JsonNode fetchOffers(String productId) {
        JsonNode response = callWithRetry(QuotaCategory.PRICING, "getItemOffers", productId,
                () -> gateway.getItemOffers(productId));
        JsonNode payload = response.path("payload");
        return payload.isMissingNode() ? response : payload;
    }
    
    /**
     * Fetches the product title from the catalog.
     *
     * @param productId ASIN
     * @return Item name for the configured marketplace, the first summary's name, or "Unknown"
     */
    public String fetchProductName(String productId) {
        JsonNode item = callWithRetry(QuotaCategory.CATALOG, "getCatalogItem", productId,
                () -> gateway.getCatalogItem(productId));
        return extractItemName(item);
    }
    
    /**
     * Checks connectivity and authorization with a catalog lookup of a well-known product.
     *
     * @return true if the lookup succeeded
     */
    public boolean verifyConnection() {
        try {
            fetchProductName(connectionCheckProductId);
            log.info("SP-API connection test successful - connectionCheckProductId: {}", connectionCheckProductId);
            return true;
        } catch (MarketplaceApiException e) {
            log.error("SP-API connection test failed - connectionCheckProductId: {}, status: {}, error: {}",
                    connectionCheckProductId, e.getHttpStatus(), e.getMessage());
            return false;
        } catch (OperationCancelledException e) {
            log.warn("SP-API connection test cancelled - connectionCheckProductId: {}", connectionCheckProductId);
            return false;
        }
    }
    
    private <T> T callWithRetry(QuotaCategory category, String operation, String productId, Supplier<T> call) {
        Retry retry = retries.get(category);
        int maxAttempts = retry.getRetryConfig().getMaxAttempts();
        AtomicInteger attempts = new AtomicInteger();
        
        Supplier<T> attempt = () -> {
            attempts.incrementAndGet();
            awaitQuota(category, operation, productId);
            return call.get();
        };
        
        try {
            return Retry.decorateSupplier(retry, attempt).get();
        } catch (TransientApiException e) {
            if (attempts.get() < maxAttempts) {
                // Retry gave up early: its backoff sleep was interrupted
                Thread.currentThread().interrupt();
                throw new OperationCancelledException(
                        "Cancelled during retry backoff - operation: " + operation + ", productId: " + productId, e);
            }
            log.error("Retries exhausted - operation: {}, productId: {}, attempts: {}", operation, productId, maxAttempts);
            throw new RetriesExhaustedException(
                    "SP-API " + operation + " for " + productId + " failed after " + maxAttempts + " attempts",
                    productId, maxAttempts, e);
        }
    }
    
    private void awaitQuota(QuotaCategory category, String operation, String productId) {
        try {
            quotaGovernor.acquire(category);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(
                    "Cancelled while waiting for " + category + " quota - operation: " + operation + ", productId: " + productId, e);
        }
    }
    
    /**
     * Retry instance for a category, exposed for event inspection.
     */
    Retry retryFor(QuotaCategory category) {
        return retries.get(category);
    }
    
    private static Retry createRetry(QuotaCategory category, RetryProperties retryProperties) {
        Retry retry = Retry.of("sp-api-" + category.name().toLowerCase(Locale.ROOT),
                RetryConfigFactory.fromPolicy(retryProperties.forCategory(category)));
        retry.getEventPublisher()
                .onRetry(event -> log.warn("Transient failure, retrying - retry: {}, attempt: {}, delayMs: {}, error: {}",
                        event.getName(), event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null))
                .onSuccess(event -> log.info("SP-API call recovered - retry: {}, retries: {}",
                        event.getName(), event.getNumberOfRetryAttempts()));
        return retry;
    }
    
    private String extractItemName(JsonNode item) {
        JsonNode summaries = item.path("summaries");
        if (!summaries.isArray() || summaries.isEmpty()) {
            return UNKNOWN_PRODUCT_NAME;
        }
        for (JsonNode summary : summaries) {
            if (marketplaceId.equals(summary.path("marketplaceId").asText(null))) {
                return itemNameOrUnknown(summary);
            }
        }
        // Fallback to first summary if the configured marketplace is not listed
        return itemNameOrUnknown(summaries.get(0));
    }
    
    private static String itemNameOrUnknown(JsonNode summary) {
        String name = summary.path("itemName").asText("");
        return name.isBlank() ? UNKNOWN_PRODUCT_NAME : name;
    }
}
