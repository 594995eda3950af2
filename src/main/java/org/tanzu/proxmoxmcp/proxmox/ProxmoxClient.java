package org.tanzu.proxmoxmcp.proxmox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.DependsOn;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import org.tanzu.proxmoxmcp.config.ProxmoxConfig;
import org.tanzu.proxmoxmcp.model.ResourceKind;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;

/**
 * Client for the Proxmox VE JSON API ({@code /api2/json}).
 * 
 * The client uses Spring WebClient in blocking mode: every orchestration call
 * runs on its own request thread and waits for the answer. It handles:
 * - API token authentication (PVEAPIToken header on every request)
 * - query parameters for GET/DELETE and form-encoded bodies for POST/PUT
 * - unwrapping of the {"data": ...} envelope
 * - translation of HTTP and connection failures into {@link BackendException}
 * 
 * Proxmox reports errors with a non-2xx status; the reason is carried in the
 * "message" member of the body (or the status line) and, for parameter
 * errors, in an "errors" object keyed by parameter name.
 */
@Component
@DependsOn("proxmoxConfigProcessor")
public class ProxmoxClient implements ProxmoxBackend {

    private static final Logger logger = LoggerFactory.getLogger(ProxmoxClient.class);

    /** Base URL of the JSON API, without trailing slash */
    private final String apiUrl;

    /** WebClient carrying the token header */
    private final WebClient webClient;

    private static final String UNREADABLE_RESPONSE = "Proxmox response could not be read: ";

    /** Jackson ObjectMapper for JSON processing */
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Constructs a client from the bound Proxmox configuration.
     * 
     * @param proxmoxConfig connection settings
     * @param webClientBuilder pre-configured builder with SSL settings
     */
    @Autowired
    public ProxmoxClient(ProxmoxConfig proxmoxConfig, WebClient.Builder webClientBuilder) {
        this(proxmoxConfig.getApiUrl(), proxmoxConfig.getTokenHeader(), webClientBuilder,
             proxmoxConfig.getMaxResponseBytes());
        logger.info("Initializing ProxmoxClient for {} as {}!{} (maxResponseBytes={})", apiUrl,
                    proxmoxConfig.getUser(), proxmoxConfig.getTokenName(), proxmoxConfig.getMaxResponseBytes());
    }

    ProxmoxClient(String apiUrl, String tokenHeader, WebClient.Builder webClientBuilder) {
        this(apiUrl, tokenHeader, webClientBuilder, ProxmoxConfig.DEFAULT_MAX_RESPONSE_BYTES);
    }

    /**
     * @param maxResponseBytes largest body the codecs buffer; Spring's own default of 256 KB
     *                         is below what a busy backup storage lists
     */
    ProxmoxClient(String apiUrl, String tokenHeader, WebClient.Builder webClientBuilder, int maxResponseBytes) {
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.webClient = webClientBuilder
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxResponseBytes))
            .defaultHeader(HttpHeaders.AUTHORIZATION, tokenHeader)
            .defaultHeader(HttpHeaders.ACCEPT, "application/json")
            .build();
    }

    @Override
    public JsonNode listNodes() {
        return invoke(HttpMethod.GET, "/nodes", null);
    }

    @Override
    public JsonNode listStorage(String node) {
        return invoke(HttpMethod.GET, ApiPath.of("nodes", node, "storage"), null);
    }

    @Override
    public JsonNode listResources(String node, ResourceKind kind) {
        return invoke(HttpMethod.GET, ApiPath.of("nodes", node, kind.getApiType()), null);
    }

    @Override
    public JsonNode read(String path, Map<String, ?> query) {
        return invoke(HttpMethod.GET, path, query);
    }

    @Override
    public JsonNode submitTask(HttpMethod method, String path, Map<String, ?> params) {
        return invoke(method, path, params);
    }

    @Override
    public JsonNode pollTask(String node, String upid) {
        return invoke(HttpMethod.GET, ApiPath.of("nodes", node, "tasks", upid, "status"), null);
    }

    /**
     * Performs one API call and returns the unwrapped data member.
     * 
     * @param method HTTP method
     * @param path encoded path relative to /api2/json
     * @param params query parameters (GET, DELETE) or form fields (POST, PUT)
     * @return the "data" member, or a NullNode when the response has none
     * @throws BackendException on a non-2xx status or when no response was received
     */
    private JsonNode invoke(HttpMethod method, String path, Map<String, ?> params) {
        boolean formBody = HttpMethod.POST.equals(method) || HttpMethod.PUT.equals(method);
        URI uri = buildUri(path, formBody ? null : params);
        logger.info("=== PROXMOX API: {} {} ===", method, path);

        try {
            WebClient.RequestBodySpec spec = webClient.method(method).uri(uri);
            WebClient.RequestHeadersSpec<?> request = spec;
            if (formBody && params != null && !params.isEmpty()) {
                MultiValueMap<String, String> form = toForm(params);
                logger.debug("Proxmox form fields: {}", form.keySet());
                request = spec.body(BodyInserters.fromFormData(form));
            }

            String response = request.retrieve()
                .bodyToMono(String.class)
                .block();

            logger.debug("Proxmox raw response: {}", response);
            return unwrap(response);
        } catch (WebClientResponseException e) {
            BackendException failure = toBackendException(e);
            logger.warn("Proxmox {} {} failed with {}: {}", method, path, failure.getStatusCode(), failure.getMessage());
            throw failure;
        } catch (WebClientRequestException e) {
            logger.error("Proxmox {} {} got no response: {}", method, path, e.getMessage());
            throw new BackendException("Proxmox API unreachable: " + e.getMessage(), e);
        } catch (DataBufferLimitException e) {
            logger.error("Proxmox {} {} answered with more than the buffer limit: {}", method, path, e.getMessage());
            throw new BackendException(200, UNREADABLE_RESPONSE + e.getMessage(), null);
        }
    }

    private URI buildUri(String path, Map<String, ?> query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(apiUrl + path);
        if (query != null) {
            query.forEach((name, value) -> {
                if (value != null) {
                    builder.queryParam(name, UriUtils.encodeQueryParam(formValue(value), StandardCharsets.UTF_8));
                }
            });
        }
        return builder.build(true).toUri();
    }

    /** A collection value becomes one field per element, which is how Proxmox takes array parameters. */
    private static MultiValueMap<String, String> toForm(Map<String, ?> params) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        params.forEach((name, value) -> {
            if (value instanceof Collection) {
                for (Object element : (Collection<?>) value) {
                    form.add(name, formValue(element));
                }
            } else if (value != null) {
                form.add(name, formValue(value));
            }
        });
        return form;
    }

    /** Proxmox expects booleans as 0/1. */
    private static String formValue(Object value) {
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "1" : "0";
        }
        return String.valueOf(value);
    }

    private JsonNode unwrap(String response) {
        if (response == null || response.trim().isEmpty()) {
            return NullNode.getInstance();
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode data = root.get("data");
            return data != null ? data : NullNode.getInstance();
        } catch (JsonProcessingException e) {
            throw new BackendException(200, "Unparseable Proxmox response: " + e.getOriginalMessage(), response);
        }
    }

    /**
     * Builds the error message from the body "message", the status line and any
     * per-parameter "errors" entries, in that order of preference.
     */
    private BackendException toBackendException(WebClientResponseException e) {
        if (e.getStatusCode().is2xxSuccessful()) {
            // the answer arrived but its body could not be decoded, e.g. it exceeded the buffer limit
            Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
            return new BackendException(e.getStatusCode().value(), UNREADABLE_RESPONSE + cause.getMessage(), null);
        }
        String body = e.getResponseBodyAsString();
        StringBuilder message = new StringBuilder();
        JsonNode root = null;
        try {
            if (body != null && !body.isBlank()) {
                root = objectMapper.readTree(body);
            }
        } catch (JsonProcessingException parseFailure) {
            logger.debug("Error body is not JSON: {}", body);
        }

        if (root != null && root.hasNonNull("message")) {
            message.append(root.get("message").asText().trim());
        } else if (e.getStatusText() != null && !e.getStatusText().isBlank()) {
            message.append(e.getStatusText().trim());
        } else {
            message.append("HTTP ").append(e.getStatusCode().value());
        }

        if (root != null && root.path("errors").isObject()) {
            Iterator<Map.Entry<String, JsonNode>> errors = root.get("errors").fields();
            while (errors.hasNext()) {
                Map.Entry<String, JsonNode> error = errors.next();
                message.append("; ").append(error.getKey()).append(": ").append(error.getValue().asText().trim());
            }
        }
        return new BackendException(e.getStatusCode().value(), message.toString(), body);
    }
}
