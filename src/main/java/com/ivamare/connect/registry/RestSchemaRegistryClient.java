package com.ivamare.connect.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.connect.exception.SchemaNotFoundException;
import com.ivamare.connect.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SchemaRegistryClient} over the Confluent-compatible REST API.
 *
 * <p>Endpoints used:
 * <ul>
 *   <li>GET /subjects/{subject}/versions/latest</li>
 *   <li>POST /subjects/{subject}/versions</li>
 *   <li>GET /schemas/ids/{id}</li>
 *   <li>GET /subjects</li>
 * </ul>
 */
public class RestSchemaRegistryClient implements SchemaRegistryClient {

    private static final Logger log = LoggerFactory.getLogger(RestSchemaRegistryClient.class);

    static final MediaType REGISTRY_JSON = MediaType.parseMediaType("application/vnd.schemaregistry.v1+json");

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public RestSchemaRegistryClient(RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<RegisteredSchema> getLatest(String subject) {
        try {
            String body = restClient.get()
                .uri("/subjects/{subject}/versions/latest", subject)
                .accept(REGISTRY_JSON, MediaType.APPLICATION_JSON)
                .retrieve()
                .body(String.class);
            JsonNode node = readTree(body);
            return Optional.of(new RegisteredSchema(
                node.path("subject").asText(subject),
                node.path("id").asInt(),
                node.path("version").asInt(),
                node.path("schema").asText()
            ));
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Subject {} not found in schema registry", subject);
            return Optional.empty();
        } catch (RestClientException e) {
            throw new TransportException("Schema registry fetch failed for subject " + subject, e);
        }
    }

    @Override
    public int register(String subject, String schema) {
        try {
            String body = restClient.post()
                .uri("/subjects/{subject}/versions", subject)
                .contentType(REGISTRY_JSON)
                .accept(REGISTRY_JSON, MediaType.APPLICATION_JSON)
                .body(objectMapper.writeValueAsString(Map.of("schema", schema)))
                .retrieve()
                .body(String.class);
            int id = readTree(body).path("id").asInt();
            log.info("Schema registered: subject={}, id={}", subject, id);
            return id;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize registration request", e);
        } catch (RestClientException e) {
            throw new TransportException("Schema registration failed for subject " + subject, e);
        }
    }

    @Override
    public String getById(int id) {
        try {
            String body = restClient.get()
                .uri("/schemas/ids/{id}", id)
                .accept(REGISTRY_JSON, MediaType.APPLICATION_JSON)
                .retrieve()
                .body(String.class);
            return readTree(body).path("schema").asText();
        } catch (HttpClientErrorException.NotFound e) {
            throw new SchemaNotFoundException("id " + id, e);
        } catch (RestClientException e) {
            throw new TransportException("Schema registry fetch failed for id " + id, e);
        }
    }

    @Override
    public List<String> getSubjects() {
        try {
            String body = restClient.get()
                .uri("/subjects")
                .accept(REGISTRY_JSON, MediaType.APPLICATION_JSON)
                .retrieve()
                .body(String.class);
            List<String> subjects = new ArrayList<>();
            readTree(body).forEach(node -> subjects.add(node.asText()));
            return subjects;
        } catch (RestClientException e) {
            throw new TransportException("Schema registry subject listing failed", e);
        }
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body != null ? body : "{}");
        } catch (JsonProcessingException e) {
            throw new TransportException("Malformed schema registry response", e);
        }
    }
}
