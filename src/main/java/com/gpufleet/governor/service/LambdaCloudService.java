package com.gpufleet.governor.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gpufleet.governor.model.InstanceTypeOffer;
import com.gpufleet.governor.model.ProviderInstance;
import com.gpufleet.governor.model.ProviderSshKey;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the cloud provider's REST API. Every call is rate limited per API key.
 */
@Service
public class LambdaCloudService {

    private static final Logger log = LoggerFactory.getLogger(LambdaCloudService.class);

    private final RestTemplate restTemplate;
    private final CredentialRateLimiter rateLimiter;

    @Autowired
    public LambdaCloudService(RestTemplateBuilder builder,
                              CredentialRateLimiter rateLimiter,
                              @Value("${lambda.api.base-url:https://cloud.lambda.ai/api/v1}") String baseUrl,
                              @Value("${lambda.api.timeout-seconds:20}") long timeoutSeconds) {
        this(builder.rootUri(baseUrl)
            .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
            .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
            .build(), rateLimiter);
    }

    public LambdaCloudService(RestTemplate restTemplate, CredentialRateLimiter rateLimiter) {
        this.restTemplate = restTemplate;
        this.rateLimiter = rateLimiter;
    }

    public List<ProviderInstance> listInstances(String apiKey) {
        List<ProviderInstance> instances = get("/instances", apiKey, new ParameterizedTypeReference<DataEnvelope<List<ProviderInstance>>>() {});
        return instances == null ? List.of() : instances;
    }

    /**
     * @return ids the provider reports as terminated
     */
    public List<String> terminateInstances(String apiKey, List<String> instanceIds) {
        if (instanceIds == null || instanceIds.isEmpty()) {
            return List.of();
        }
        TerminateResult result = exchange(HttpMethod.POST, "/instance-operations/terminate", apiKey,
            Map.of("instance_ids", instanceIds), new ParameterizedTypeReference<DataEnvelope<TerminateResult>>() {});
        List<String> terminated = new ArrayList<>();
        if (result != null && result.getTerminatedInstances() != null) {
            result.getTerminatedInstances().forEach(instance -> terminated.add(instance.getId()));
        }
        log.info("Provider confirmed termination of {}/{} instance(s)", terminated.size(), instanceIds.size());
        return terminated;
    }

    public List<ProviderSshKey> listSshKeys(String apiKey) {
        List<ProviderSshKey> keys = get("/ssh-keys", apiKey, new ParameterizedTypeReference<DataEnvelope<List<ProviderSshKey>>>() {});
        return keys == null ? List.of() : keys;
    }

    public List<InstanceTypeOffer> listInstanceTypes(String apiKey) {
        Map<String, InstanceTypeEntry> types = get("/instance-types", apiKey,
            new ParameterizedTypeReference<DataEnvelope<LinkedHashMap<String, InstanceTypeEntry>>>() {});
        List<InstanceTypeOffer> offers = new ArrayList<>();
        if (types == null) {
            return offers;
        }
        types.forEach((name, entry) -> {
            ProviderInstance.InstanceType type = entry.getInstanceType() == null
                ? new ProviderInstance.InstanceType() : entry.getInstanceType();
            List<String> regions = new ArrayList<>();
            if (entry.getRegionsWithCapacityAvailable() != null) {
                entry.getRegionsWithCapacityAvailable().forEach(region -> regions.add(region.getName()));
            }
            offers.add(InstanceTypeOffer.builder()
                .name(type.getName() == null ? name : type.getName())
                .description(type.getDescription())
                .priceCentsPerHour(type.getPriceCentsPerHour())
                .gpus(type.getSpecs() == null ? 0 : type.getSpecs().getGpus())
                .regionsWithCapacity(regions)
                .build());
        });
        return offers;
    }

    private <T> T get(String path, String apiKey, ParameterizedTypeReference<DataEnvelope<T>> type) {
        return exchange(HttpMethod.GET, path, apiKey, null, type);
    }

    private <T> T exchange(HttpMethod method, String path, String apiKey, Object body,
                           ParameterizedTypeReference<DataEnvelope<T>> type) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("API key is required");
        }
        try {
            rateLimiter.acquire(apiKey);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RestClientException("Interrupted while waiting for rate limiter", e);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        DataEnvelope<T> envelope = restTemplate.exchange(path, method, new HttpEntity<>(body, headers), type).getBody();
        return envelope == null ? null : envelope.getData();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DataEnvelope<T> {
        private T data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TerminateResult {
        @JsonProperty("terminated_instances")
        private List<ProviderInstance> terminatedInstances;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class InstanceTypeEntry {
        @JsonProperty("instance_type")
        private ProviderInstance.InstanceType instanceType;
        @JsonProperty("regions_with_capacity_available")
        private List<ProviderInstance.Region> regionsWithCapacityAvailable;
    }
}
