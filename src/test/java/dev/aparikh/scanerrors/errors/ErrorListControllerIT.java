package dev.aparikh.scanerrors.errors;

import dev.aparikh.scanerrors.api.ErrorCountResponse;
import dev.aparikh.scanerrors.model.ErrorRecord;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrQuery;
import org.apache.solr.client.solrj.impl.HttpSolrClient;
import org.apache.solr.client.solrj.request.schema.SchemaRequest;
import org.apache.solr.common.SolrInputDocument;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.SolrContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ErrorListControllerIT {

    @Container
    static final SolrContainer SOLR = new SolrContainer(DockerImageName.parse("solr:9.6.1"));
    private static final String CORE = "project_errors";

    @Autowired
    private TestRestTemplate restTemplate;
    @Autowired
    private SolrClient solrClient;
    @Autowired
    private WebTestClient webTestClient;

    private static String solrBaseUrl() {
        return "http://" + SOLR.getHost() + ":" + SOLR.getMappedPort(8983) + "/solr";
    }

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry registry) {
        registry.add("solr.base-url", ErrorListControllerIT::solrBaseUrl);
        registry.add("solr.core", () -> CORE);
        registry.add("solr.fetch-batch-size", () -> 2);
        registry.add("errors.page-size", () -> 2);
    }

    @BeforeAll
    static void createCoreAndSchema() throws Exception {
        SOLR.execInContainer("solr", "create_collection", "-c", CORE, "-shards", "1", "-replicationFactor", "1");

        boolean coreReady = false;
        for (int i = 0; i < 10; i++) {
            try (SolrClient testClient = new HttpSolrClient.Builder(solrBaseUrl() + "/" + CORE).build()) {
                SolrQuery testQuery = new SolrQuery("*:*");
                testQuery.setRows(0);
                testClient.query(testQuery);
                coreReady = true;
                break;
            } catch (Exception e) {
                Thread.sleep(1000);
            }
        }
        if (!coreReady) {
            throw new RuntimeException("Core " + CORE + " not accessible after 10 attempts");
        }

        try (SolrClient core = new HttpSolrClient.Builder(solrBaseUrl() + "/" + CORE).build()) {
            addField(core, ErrorRecord.FIELD_PROJECT, Map.of("type", "string", "stored", true, "indexed", true));
            addField(core, ErrorRecord.FIELD_MODEL, Map.of("type", "string", "stored", true, "indexed", true));
            addField(core, ErrorRecord.FIELD_MESSAGE, Map.of("type", "string", "stored", true, "indexed", true));
            addField(core, ErrorRecord.FIELD_DETAILS, Map.of("type", "string", "stored", true, "indexed", false));
            addField(core, ErrorRecord.FIELD_TRACEBACK, Map.of("type", "string", "stored", true, "indexed", false));
            addField(core, ErrorRecord.FIELD_CREATED_DATE, Map.of("type", "pdate", "stored", true, "indexed", true));
        }
    }

    private static void addField(SolrClient core, String name, Map<String, Object> props) throws Exception {
        Map<String, Object> field = new HashMap<>(props);
        field.put("name", name);
        var response = new SchemaRequest.AddField(field).process(core);
        if (response.getStatus() != 0) {
            throw new IllegalStateException("Could not add field " + name);
        }
    }

    private static SolrInputDocument errorDoc(String id, String project, String model, String message,
                                              String detailsJson, Instant createdDate) {
        SolrInputDocument d = new SolrInputDocument();
        d.addField(ErrorRecord.FIELD_ID, id);
        d.addField(ErrorRecord.FIELD_PROJECT, project);
        d.addField(ErrorRecord.FIELD_MODEL, model);
        d.addField(ErrorRecord.FIELD_MESSAGE, message);
        d.addField(ErrorRecord.FIELD_DETAILS, detailsJson);
        d.addField(ErrorRecord.FIELD_TRACEBACK, "Traceback for " + id);
        d.addField(ErrorRecord.FIELD_CREATED_DATE, Date.from(createdDate));
        return d;
    }

    @BeforeEach
    void seedIndex() throws Exception {
        solrClient.deleteByQuery("*:*");
        Instant t = Instant.parse("2025-01-01T10:00:00Z");
        String resource = "{\"codebase_resource_pk\": \"42\", \"codebase_resource_path\": \"/src/a.c\"}";
        solrClient.add(List.of(
                errorDoc("e1", "demo", "A", "first", "{}", t),
                errorDoc("e2", "demo", "B", "second", "{}", t.plusSeconds(1)),
                errorDoc("e3", "demo", "A", "third", resource, t.plusSeconds(2)),
                errorDoc("e4", "demo", "C", "fourth", "{}", t.plusSeconds(3)),
                errorDoc("e5", "demo", "A", "fifth", "{}", t.plusSeconds(4)),
                errorDoc("o1", "other", "A", "elsewhere", "{}", t)
        ));
        solrClient.commit();
    }

    @Test
    @SuppressWarnings("unchecked")
    void listingFiltersAndPaginatesProjectErrors() {
        ResponseEntity<Map> response = restTemplate.getForEntity(
                "/api/projects/demo/errors?model=A&page=2", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> body = response.getBody();
        assertThat(body).containsEntry("pageNumber", 2)
                .containsEntry("pageCount", 2)
                .containsEntry("hasPrevious", true)
                .containsEntry("hasNext", false)
                .containsEntry("totalCount", 5)
                .containsEntry("filteredCount", 3);
        List<Map<String, Object>> rows = (List<Map<String, Object>>) body.get("rows");
        assertThat(rows).hasSize(1);
        Map<String, Object> message = (Map<String, Object>) rows.get(0).get("message");
        assertThat(message).containsEntry("text", "fifth").containsEntry("href", "?message=fifth");
    }

    @Test
    @SuppressWarnings("unchecked")
    void relatedResourceIsLinked() {
        ResponseEntity<Map> response = restTemplate.getForEntity(
                "/api/projects/demo/errors?message=third", Map.class);

        List<Map<String, Object>> rows = (List<Map<String, Object>>) response.getBody().get("rows");
        Map<String, Object> details = (Map<String, Object>) rows.get(0).get("details");
        assertThat((Map<String, Object>) details.get("relatedResource"))
                .containsEntry("href", "/project/demo/resources/42/")
                .containsEntry("text", "/src/a.c");
        assertThat((List<String>) details.get("lines"))
                .containsExactly("codebase_resource_pk: 42", "codebase_resource_path: /src/a.c");
    }

    @Test
    void countIsScopedToProject() {
        ResponseEntity<ErrorCountResponse> response = restTemplate.getForEntity(
                "/api/projects/other/errors/count", ErrorCountResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().count()).isEqualTo(1);
    }

    @Test
    void streamEmitsFilteredErrorsInOrder() {
        webTestClient.get()
                .uri("/api/projects/demo/errors/stream?model=A")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectBody(String.class)
                .value(body -> assertThat(body)
                        .contains("data:")
                        .containsSubsequence("\"message\":\"first\"", "\"message\":\"third\"",
                                "\"message\":\"fifth\"")
                        .doesNotContain("\"message\":\"second\"")
                        .doesNotContain("elsewhere"));
    }
}
