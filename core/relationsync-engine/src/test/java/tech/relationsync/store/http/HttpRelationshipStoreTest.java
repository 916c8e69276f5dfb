package tech.relationsync.store.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.http.Fault;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.relationsync.model.Relationship;
import tech.relationsync.store.RelationStoreException;
import tech.relationsync.store.RelationshipFilter;
import tech.relationsync.support.TestRelationSyncConfig;

import java.util.List;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * HttpRelationshipStore against a WireMock relationship store:
 * - 2xx -> success
 * - 409 -> Conflict
 * - 400 -> Rejected, with the offending tuple when the body names one
 * - 429/5xx/connection reset -> Unavailable
 */
class HttpRelationshipStoreTest {

    private static final Relationship MEMBER =
        Relationship.parse("group:9aca5b38-07b1-4873-aaae-d02c94c05673#member@user:user_dev");

    private WireMockServer wireMock;
    private HttpRelationshipStore store;

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(options().dynamicPort());
        wireMock.start();

        TestRelationSyncConfig config = new TestRelationSyncConfig();
        config.baseUrl = "http://localhost:" + wireMock.port() + "/api/rebac/v1";
        config.token = Optional.of("secret-token");
        store = new HttpRelationshipStore(config.store(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    void shouldPostTouchWriteWithBearerToken() {
        // Given
        wireMock.stubFor(post("/api/rebac/v1/relationships").willReturn(okJson("{}")));

        // When
        store.writeRelationships(true, List.of(MEMBER));

        // Then
        wireMock.verify(postRequestedFor(urlEqualTo("/api/rebac/v1/relationships"))
            .withHeader("Authorization", equalTo("Bearer secret-token"))
            .withRequestBody(matchingJsonPath("$.touch", equalTo("true")))
            .withRequestBody(matchingJsonPath("$.relationships[0].object.type", equalTo("group")))
            .withRequestBody(matchingJsonPath("$.relationships[0].subject.object.id", equalTo("user_dev"))));
    }

    @Test
    void shouldOmitSubjectRelationWhenAbsent() {
        wireMock.stubFor(post("/api/rebac/v1/relationships/delete").willReturn(okJson("{}")));

        store.deleteRelationships(List.of(MEMBER));

        wireMock.verify(postRequestedFor(urlEqualTo("/api/rebac/v1/relationships/delete"))
            .withRequestBody(notMatching(".*\"relation\":null.*")));
    }

    @Test
    void shouldSkipEmptyBatches() {
        store.writeRelationships(true, List.of());
        store.deleteRelationships(List.of());

        assertEquals(0, wireMock.getAllServeEvents().size());
    }

    @Test
    void shouldReadRelationshipsMatchingFilter() {
        wireMock.stubFor(post("/api/rebac/v1/relationships/read").willReturn(okJson("""
            {"relationships": [
              {"object": {"type": "group", "id": "9aca5b38-07b1-4873-aaae-d02c94c05673"},
               "relation": "member",
               "subject": {"object": {"type": "user", "id": "user_dev"}}}
            ], "continuation": null}
            """)));

        List<Relationship> result = store.readRelationships(
            RelationshipFilter.byObject("group", "9aca5b38-07b1-4873-aaae-d02c94c05673", "member"));

        assertThat(result).containsExactly(MEMBER);
        wireMock.verify(postRequestedFor(urlEqualTo("/api/rebac/v1/relationships/read"))
            .withRequestBody(matchingJsonPath("$.filter.relation", equalTo("member")))
            .withRequestBody(notMatching(".*subjectType.*")));
    }

    @Test
    void shouldMapConflictTo409() {
        wireMock.stubFor(post("/api/rebac/v1/relationships").willReturn(aResponse().withStatus(409)));

        assertThatThrownBy(() -> store.writeRelationships(false, List.of(MEMBER)))
            .isInstanceOf(RelationStoreException.Conflict.class);
    }

    @Test
    void shouldFailAWholeCreateBatchWhenOneTupleAlreadyExists() {
        // Given - MEMBER exists; the store refuses the create batch as a whole and accepts touch
        Relationship newcomer = Relationship.parse("group:9aca5b38-07b1-4873-aaae-d02c94c05673#member@user:user_new");
        wireMock.stubFor(post("/api/rebac/v1/relationships")
            .withRequestBody(matchingJsonPath("$.touch", equalTo("false")))
            .willReturn(aResponse().withStatus(409).withBody("relationship already exists")));
        wireMock.stubFor(post("/api/rebac/v1/relationships")
            .withRequestBody(matchingJsonPath("$.touch", equalTo("true")))
            .willReturn(okJson("{}")));

        // When / Then
        assertThatThrownBy(() -> store.writeRelationships(false, List.of(newcomer, MEMBER)))
            .isInstanceOf(RelationStoreException.Conflict.class);
        store.writeRelationships(true, List.of(newcomer, MEMBER));

        // And - each batch went out as one request carrying both tuples
        wireMock.verify(1, postRequestedFor(urlEqualTo("/api/rebac/v1/relationships"))
            .withRequestBody(matchingJsonPath("$.touch", equalTo("false")))
            .withRequestBody(matchingJsonPath("$.relationships[1].subject.object.id", equalTo("user_dev"))));
        wireMock.verify(1, postRequestedFor(urlEqualTo("/api/rebac/v1/relationships"))
            .withRequestBody(matchingJsonPath("$.touch", equalTo("true"))));
    }

    @Test
    void shouldMapBadRequestToRejectedNamingTheOffender() {
        wireMock.stubFor(post("/api/rebac/v1/relationships").willReturn(aResponse()
            .withStatus(400)
            .withHeader("Content-Type", "application/json")
            .withBody("""
                {"message": "unknown relation",
                 "relationship": {"object": {"type": "group", "id": "9aca5b38-07b1-4873-aaae-d02c94c05673"},
                                  "relation": "member",
                                  "subject": {"object": {"type": "user", "id": "user_dev"}}}}
                """)));

        assertThatThrownBy(() -> store.writeRelationships(true, List.of(MEMBER)))
            .isInstanceOfSatisfying(RelationStoreException.Rejected.class,
                e -> assertThat(e.getOffending()).contains(MEMBER));
    }

    @Test
    void shouldRejectWithoutOffenderWhenBodyIsPlainText() {
        wireMock.stubFor(post("/api/rebac/v1/relationships").willReturn(aResponse()
            .withStatus(422)
            .withBody("schema violation")));

        assertThatThrownBy(() -> store.writeRelationships(true, List.of(MEMBER)))
            .isInstanceOfSatisfying(RelationStoreException.Rejected.class,
                e -> assertThat(e.getOffending()).isEmpty());
    }

    @Test
    void shouldTreatServerErrorsAndThrottlingAsTransient() {
        wireMock.stubFor(post("/api/rebac/v1/relationships").willReturn(aResponse().withStatus(503)));
        wireMock.stubFor(post("/api/rebac/v1/relationships/delete").willReturn(aResponse().withStatus(429)));

        assertThatThrownBy(() -> store.writeRelationships(true, List.of(MEMBER)))
            .isInstanceOf(RelationStoreException.Unavailable.class);
        assertThatThrownBy(() -> store.deleteRelationships(List.of(MEMBER)))
            .isInstanceOf(RelationStoreException.Unavailable.class);
    }

    @Test
    void shouldTreatConnectionResetAsTransient() {
        wireMock.stubFor(post("/api/rebac/v1/relationships")
            .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        assertThatThrownBy(() -> store.writeRelationships(true, List.of(MEMBER)))
            .isInstanceOf(RelationStoreException.Unavailable.class);
    }
}
