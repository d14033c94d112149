package app.anvil.generation.client.recordstore;

import app.anvil.generation.domain.type.DocumentKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RecordStoreClientTest {

    private MockRestServiceServer server;
    private RecordStoreClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new RecordStoreClient(builder, new RecordStoreProps("http://records.test", "service-key", null));
    }

    @Test
    void fetch_readsHtmlColumnOfKind() {
        server.expect(requestTo("http://records.test/rest/v1/prd?id=eq.prd-7&select=*"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("apikey", "service-key"))
                .andExpect(header("Authorization", "Bearer service-key"))
                .andRespond(withSuccess("[{\"id\":\"prd-7\",\"project_req_html\":\"<h1>PRD</h1>\"}]", MediaType.APPLICATION_JSON));

        Optional<GeneratedArtifact> artifact = client.fetch(DocumentKind.ProjectRequirements, "prd-7");

        assertThat(artifact).isPresent();
        assertThat(artifact.get().html()).isEqualTo("<h1>PRD</h1>");
        assertThat(artifact.get().externalId()).isEqualTo("prd-7");
        server.verify();
    }

    @Test
    void fetch_encodesExternalIdAsQueryValue() {
        server.expect(requestTo("http://records.test/rest/v1/prd?id=eq.prd-%7B7%7D%20x&select=*"))
                .andRespond(withSuccess("[{\"id\":\"prd-{7} x\",\"project_req_html\":\"<h1>PRD</h1>\"}]", MediaType.APPLICATION_JSON));

        Optional<GeneratedArtifact> artifact = client.fetch(DocumentKind.ProjectRequirements, "prd-{7} x");

        assertThat(artifact).isPresent();
        server.verify();
    }

    @Test
    void fetch_treatsBlankHtmlAsNotFound() {
        server.expect(requestTo("http://records.test/rest/v1/brd?id=eq.brd-1&select=*"))
                .andRespond(withSuccess("[{\"id\":\"brd-1\",\"brd_html\":\"  \"}]", MediaType.APPLICATION_JSON));

        assertThat(client.fetch(DocumentKind.BusinessRequirements, "brd-1")).isEmpty();
    }

    @Test
    void fetch_returnsEmptyWhenNoRows() {
        server.expect(requestTo("http://records.test/rest/v1/frd?id=eq.frd-1&select=*"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThat(client.fetch(DocumentKind.FunctionalRequirements, "frd-1")).isEmpty();
    }

    @Test
    void fetch_skipsKindsWithoutTable() {
        assertThat(client.supports(DocumentKind.Workflows)).isFalse();
        assertThat(client.fetch(DocumentKind.Workflows, "wf-1")).isEmpty();
        server.verify();
    }

    @Test
    void fetch_propagatesServerErrors() {
        server.expect(requestTo("http://records.test/rest/v1/prd?id=eq.prd-9&select=*"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThatThrownBy(() -> client.fetch(DocumentKind.ProjectRequirements, "prd-9"))
                .isInstanceOf(RestClientException.class);
    }
}
