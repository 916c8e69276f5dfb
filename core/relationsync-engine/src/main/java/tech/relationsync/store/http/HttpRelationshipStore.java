package tech.relationsync.store.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.relationsync.config.RelationSyncConfig;
import tech.relationsync.model.Relationship;
import tech.relationsync.store.RelationStoreException;
import tech.relationsync.store.RelationshipFilter;
import tech.relationsync.store.RelationshipStore;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.List;

/**
 * HTTP client for the relationship store's relationships API.
 *
 * <p>Maps responses onto the store contract: 2xx succeeds, 409 is a conflict,
 * 400/422 and other 4xx are rejections, 408/429/5xx and I/O failures are transient.
 */
@ApplicationScoped
public class HttpRelationshipStore implements RelationshipStore {

    private static final Logger LOG = Logger.getLogger(HttpRelationshipStore.class);

    private static final String WRITE_PATH = "/relationships";
    private static final String DELETE_PATH = "/relationships/delete";
    private static final String READ_PATH = "/relationships/read";

    private final RelationSyncConfig.Store config;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    @Inject
    public HttpRelationshipStore(RelationSyncConfig config, ObjectMapper objectMapper) {
        this(config.store(), objectMapper);
    }

    public HttpRelationshipStore(RelationSyncConfig.Store config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(config.connectTimeout())
            .build();
    }

    @Override
    public void writeRelationships(boolean touch, List<Relationship> relationships) {
        if (relationships.isEmpty()) {
            return;
        }
        post(WRITE_PATH, new WriteRelationshipsRequest(touch, relationships));
        LOG.debugf("Wrote %d relationships (touch=%s)", Integer.valueOf(relationships.size()), Boolean.valueOf(touch));
    }

    @Override
    public void deleteRelationships(List<Relationship> relationships) {
        if (relationships.isEmpty()) {
            return;
        }
        post(DELETE_PATH, new DeleteRelationshipsRequest(relationships));
        LOG.debugf("Deleted %d relationships", relationships.size());
    }

    @Override
    public List<Relationship> readRelationships(RelationshipFilter filter) {
        String body = post(READ_PATH, new ReadRelationshipsRequest(filter));
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            ReadRelationshipsResponse response = objectMapper.readValue(body, ReadRelationshipsResponse.class);
            return response.relationships() == null ? List.of() : response.relationships();
        } catch (JsonProcessingException e) {
            throw new RelationStoreException.Unavailable("Unreadable response from " + READ_PATH + ": " + e.getMessage(), e);
        }
    }

    private String post(String path, Object body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Failed to serialize request body for %s", path);
            throw new RelationStoreException.Rejected("Failed to serialize request: " + e.getMessage(), null);
        }

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(URI.create(config.baseUrl() + path))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .timeout(config.requestTimeout())
            .POST(HttpRequest.BodyPublishers.ofString(json));

        config.token().ifPresent(token ->
            requestBuilder.header("Authorization", "Bearer " + token));

        HttpResponse<String> response;
        try {
            response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            LOG.warnf("Timeout calling relationship store: POST %s", path);
            throw new RelationStoreException.Unavailable("Request timeout: POST " + path, e);
        } catch (IOException e) {
            LOG.warnf("IO error calling relationship store: POST %s: %s", path, e.getMessage());
            throw new RelationStoreException.Unavailable("IO error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelationStoreException.Unavailable("Request interrupted: POST " + path, e);
        }

        int statusCode = response.statusCode();
        if (statusCode >= 200 && statusCode < 300) {
            LOG.debugf("POST %s returned %d", path, statusCode);
            return response.body();
        }

        String message = "POST " + path + " returned " + statusCode + ": " + response.body();
        if (statusCode == 409) {
            throw new RelationStoreException.Conflict(message);
        }
        if (statusCode == 408 || statusCode == 429 || statusCode >= 500) {
            LOG.warnf("Relationship store unavailable: %s", message);
            throw new RelationStoreException.Unavailable(message);
        }
        LOG.errorf("Relationship store rejected request: %s", message);
        throw new RelationStoreException.Rejected(message, offendingRelationship(response.body()));
    }

    /**
     * Error bodies may name the tuple that caused the rejection in a {@code relationship} field.
     */
    private Relationship offendingRelationship(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body).get("relationship");
            if (node == null || node.isNull()) {
                return null;
            }
            return objectMapper.treeToValue(node, Relationship.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.debugf("Could not parse offending relationship from error body: %s", e.getMessage());
            return null;
        }
    }

    record WriteRelationshipsRequest(boolean touch, List<Relationship> relationships) {
    }

    record DeleteRelationshipsRequest(List<Relationship> relationships) {
    }

    record ReadRelationshipsRequest(RelationshipFilter filter) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ReadRelationshipsResponse(List<Relationship> relationships) {
    }
}
