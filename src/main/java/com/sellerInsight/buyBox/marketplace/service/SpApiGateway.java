package com.sellerInsight.buyBox.marketplace.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.sellerInsight.buyBox.marketplace.exception.PermanentApiException;
import com.sellerInsight.buyBox.marketplace.exception.TransientApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.function.Supplier;

/**
 * Client for calling the Amazon Selling Partner API.
 * 
 * Handles HTTP communication with:
 * - Product Pricing API (getItemOffers)
 * - Catalog Items API 2022-04-01 (getCatalogItem, summaries only)
 * 
 * Every failure is classified as transient (429, 408, 5xx, I/O) or permanent (other 4xx).
 */
@Slf4j
@Service
public class SpApiGateway implements MarketplaceGateway {
    
    static final String ACCESS_TOKEN_HEADER = "x-amz-access-token";
    
    private final RestClient restClient;
    private final AccessTokenProvider accessTokenProvider;
    private final String marketplaceId;
    private final String itemCondition;
    
    public SpApiGateway(
            @Qualifier("spApiRestClient") RestClient restClient,
            AccessTokenProvider accessTokenProvider,
            @Value("${buybox.sp-api.marketplace-id:ATVPDKIKX0DER}") String marketplaceId,
            @Value("${buybox.sp-api.item-condition:New}") String itemCondition) {
        this.restClient = restClient;
        this.accessTokenProvider = accessTokenProvider;
        this.marketplaceId = marketplaceId;
        this.itemCondition = itemCondition;
    }
    
    @Override
    public JsonNode getItemOffers(String productId) {
        return execute("getItemOffers", productId, () -> restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/products/pricing/v0/items/{asin}/offers")
                        .queryParam("MarketplaceId", marketplaceId)
                        .queryParam("ItemCondition", itemCondition)
                        .build(productId))
                .header(ACCESS_TOKEN_HEADER, accessTokenProvider.accessToken())
                .retrieve()
                .body(JsonNode.class));
    }
    
    @Override
    public JsonNode getCatalogItem(String productId) {
        return execute("getCatalogItem", productId, () -> restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/catalog/2022-04-01/items/{asin}")
                        .queryParam("marketplaceIds", marketplaceId)
                        .queryParam("includedData", "summaries")
                        .build(productId))
                .header(ACCESS_TOKEN_HEADER, accessTokenProvider.accessToken())
                .retrieve()
                .body(JsonNode.class));
    }
    
    private JsonNode execute(String operation, String productId, Supplier<JsonNode> call) {
        log.debug("Calling SP-API - operation: {}, productId: {}", operation, productId);
        
        JsonNode body;
        try {
            body = call.get();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String message = String.format("SP-API %s failed for %s with status %d", operation, productId, status);
            if (isTransientStatus(status)) {
                Duration retryAfter = parseRetryAfter(e.getResponseHeaders());
                log.warn("Transient SP-API error - operation: {}, productId: {}, status: {}, retryAfter: {}", 
                        operation, productId, status, retryAfter);
                throw new TransientApiException(message, productId, status, retryAfter, e);
            }
            log.warn("Permanent SP-API error - operation: {}, productId: {}, status: {}", operation, productId, status);
            throw new PermanentApiException(message, productId, status, e);
        } catch (ResourceAccessException e) {
            log.warn("SP-API connectivity error - operation: {}, productId: {}, error: {}", 
                    operation, productId, e.getMessage());
            throw new TransientApiException(
                    "SP-API " + operation + " I/O failure for " + productId + ": " + e.getMessage(), 
                    productId, null, null, e);
        } catch (RestClientException e) {
            log.error("Unreadable SP-API response - operation: {}, productId: {}", operation, productId, e);
            throw new PermanentApiException(
                    "SP-API " + operation + " returned an unreadable response for " + productId, 
                    productId, null, e);
        }
        
        if (body == null || body.isNull()) {
            throw new PermanentApiException(
                    "SP-API " + operation + " returned an empty response for " + productId, productId, null, null);
        }
        
        log.debug("SP-API call successful - operation: {}, productId: {}", operation, productId);
        return body;
    }
    
    private static boolean isTransientStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }
    
    /**
     * Reads Retry-After as delta-seconds or an HTTP-date. Unparseable values are ignored.
     */
    static Duration parseRetryAfter(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() <= 9 && trimmed.chars().allMatch(Character::isDigit)) {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration until = Duration.between(ZonedDateTime.now(at.getZone()), at);
            return until.isNegative() ? Duration.ZERO : until;
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable Retry-After header: {}", trimmed);
            return null;
        }
    }
}
