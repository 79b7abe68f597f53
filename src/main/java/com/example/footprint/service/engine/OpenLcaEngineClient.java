package com.example.footprint.service.engine;

import com.example.footprint.config.LciEngineConfig;
import com.example.footprint.exception.EngineDataException;
import com.example.footprint.exception.EngineUnavailableException;
import com.example.footprint.model.InventoryFlow;
import com.example.footprint.model.MaterialInput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Клиент openLCA IPC сервера (JSON-RPC 2.0 поверх HTTP).
 * <p>
 * Запрос {@code calculate} возвращает {@code totalFlowResults}: список {@code {flow, value}},
 * где {@code flow} содержит имя, категорию и единицу измерения.
 */
@Slf4j
@Service
public class OpenLcaEngineClient implements LciEngineClient {

    private final LciEngineConfig config;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public OpenLcaEngineClient(LciEngineConfig config, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;

        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(16 * 1024 * 1024));
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        }
        this.webClient = builder.build();
    }

    @Override
    public List<InventoryFlow> calculateInventory(ProductSystemDescriptor descriptor) {
        log.debug("Requesting inventory for subject {}", descriptor.getSubjectRef());
        JsonNode result = call("calculate", buildParams(descriptor));

        JsonNode flowResults = result.get("totalFlowResults");
        if (flowResults == null || !flowResults.isArray()) {
            throw new EngineDataException("Engine response has no totalFlowResults for subject "
                    + descriptor.getSubjectRef());
        }

        List<InventoryFlow> flows = new ArrayList<>();
        for (JsonNode entry : flowResults) {
            flows.add(toFlow(entry));
        }
        log.debug("Engine returned {} flows for subject {}", flows.size(), descriptor.getSubjectRef());
        return flows;
    }

    @Override
    public String engineVersion() {
        return config.getEngineVersion();
    }

    private JsonNode call(String method, ObjectNode params) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", UUID.randomUUID().toString());
        request.put("method", method);
        request.set("params", params);

        RpcResponse response;
        try {
            response = webClient.post()
                    .uri("/rpc")
                    .bodyValue(objectMapper.writeValueAsString(request))
                    .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new RpcResponse(clientResponse.statusCode(), body)))
                    .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                    .block();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize engine request", e);
        } catch (WebClientRequestException e) {
            throw new EngineUnavailableException("Engine is unreachable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new EngineUnavailableException(
                        "Engine did not respond within " + config.getTimeoutSeconds() + "s", e);
            }
            throw e;
        }

        if (response == null) {
            throw new EngineUnavailableException("Engine returned no response");
        }
        checkStatus(response);
        return parseResult(response.body);
    }

    private void checkStatus(RpcResponse response) {
        HttpStatusCode status = response.status;
        if (status.is2xxSuccessful()) {
            return;
        }
        String message = "Engine API error: " + status.value();
        if (status.is5xxServerError() || status.value() == 429 || status.value() == 408) {
            throw new EngineUnavailableException(message);
        }
        throw new EngineDataException(message + " " + abbreviate(response.body));
    }

    private JsonNode parseResult(String body) {
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new EngineDataException("Malformed engine response: " + e.getOriginalMessage(), e);
        }
        if (json == null || !json.isObject()) {
            throw new EngineDataException("Malformed engine response: not a JSON object");
        }
        JsonNode error = json.get("error");
        if (error != null && !error.isNull()) {
            throw new EngineDataException("Engine RPC error: " + error.path("message").asText("unknown"));
        }
        JsonNode result = json.get("result");
        if (result == null || !result.isObject()) {
            throw new EngineDataException("Engine response has no result");
        }
        return result;
    }

    private InventoryFlow toFlow(JsonNode entry) {
        JsonNode flow = entry.path("flow");
        String name = flow.path("name").asText(null);
        JsonNode value = entry.get("value");
        if (name == null || name.isBlank() || value == null || !value.isNumber()) {
            throw new EngineDataException("Engine returned incomplete flow result: " + abbreviate(entry.toString()));
        }
        return InventoryFlow.builder()
                .name(name)
                .category(flow.path("category").asText(null))
                .amount(value.asDouble())
                .unit(flow.path("refUnit").asText("kg"))
                .build();
    }

    private ObjectNode buildParams(ProductSystemDescriptor descriptor) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("@id", config.getDatabaseId());

        ObjectNode system = params.putObject("productSystem");
        system.put("subjectRef", descriptor.getSubjectRef());
        system.put("productCategory", descriptor.getProductCategory());
        ArrayNode materials = system.putArray("materials");
        for (MaterialInput material : descriptor.getMaterials()) {
            ObjectNode node = materials.addObject();
            node.put("name", material.getName());
            node.put("category", material.getCategory());
            node.put("amount", material.getMassKg());
            node.put("unit", "kg");
        }
        ObjectNode parameters = system.putObject("parameters");
        descriptor.getProductionParameters().forEach(parameters::put);

        if (descriptor.getAllocationMethod() != null) {
            params.put("allocationMethod", descriptor.getAllocationMethod().name());
        }
        return params;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }

    private static final class RpcResponse {
        private final HttpStatusCode status;
        private final String body;

        private RpcResponse(HttpStatusCode status, String body) {
            this.status = status;
            this.body = body;
        }
    }
}
