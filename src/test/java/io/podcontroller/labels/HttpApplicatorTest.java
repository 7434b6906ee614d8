package io.podcontroller.labels;

import io.podcontroller.store.RetryPolicy;
import io.podcontroller.store.StoreException;
import io.podcontroller.store.WatchHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HttpApplicatorTest {

    private static final String ENDPOINT = "http://inventory.local/nodes";

    private static final String TWO_NODES = "["
        + "{\"id\": \"node-1\", \"labels\": {\"app\": \"web\", \"zone\": \"a\"}},"
        + "{\"id\": \"node-2\", \"labels\": {\"app\": \"db\"}}"
        + "]";

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private HttpApplicator applicator;

    @BeforeEach
    void setUp() {
        applicator = new HttpApplicator(httpClient, ENDPOINT, Map.of("Authorization", "Bearer token"),
            new RetryPolicy(2), Duration.ofMillis(50));
    }

    private void respond(int status, String body) throws Exception {
        lenient().when(response.statusCode()).thenReturn(status);
        lenient().when(response.body()).thenReturn(body);
        when(httpClient.<String>send(any(HttpRequest.class), any())).thenReturn(response);
    }

    @Test
    void testGetMatches_SendsEncodedSelectorAndHeaders() throws Exception {
        // Given
        respond(200, TWO_NODES);

        // When
        List<Labeled> nodes = applicator.getMatches(LabelSelector.parse("app=web"), LabelType.NODE);

        // Then
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().toString()).isEqualTo(ENDPOINT + "?selector=app%3Dweb");
        assertThat(request.getValue().method()).isEqualTo("GET");
        assertThat(request.getValue().headers().firstValue("Authorization")).contains("Bearer token");
        assertThat(nodes).extracting(Labeled::getId).containsExactly("node-1");
    }

    @Test
    void testGetMatches_RefiltersLenientServerResponse() throws Exception {
        respond(200, TWO_NODES);

        List<Labeled> nodes = applicator.getMatches(LabelSelector.parse("zone=a"), LabelType.NODE);

        assertThat(nodes).hasSize(1);
        assertThat(nodes.get(0).getLabels()).containsEntry("app", "web").containsEntry("zone", "a");
        assertThat(nodes.get(0).getLabelType()).isEqualTo(LabelType.NODE);
    }

    @Test
    void testGetMatches_SkipsEntriesWithoutId() throws Exception {
        respond(200, "[{\"labels\": {\"app\": \"web\"}}, {\"id\": \"node-3\"}]");

        List<Labeled> nodes = applicator.getMatches(LabelSelector.EVERYTHING, LabelType.NODE);

        assertThat(nodes).extracting(Labeled::getId).containsExactly("node-3");
        assertThat(nodes.get(0).getLabels()).isEmpty();
    }

    @Test
    void testGetMatches_ClientErrorIsNotRetried() throws Exception {
        respond(400, "bad selector");

        assertThatThrownBy(() -> applicator.getMatches(LabelSelector.EVERYTHING, LabelType.NODE))
            .isInstanceOf(StoreException.class)
            .hasMessageContaining("status 400");
        verify(httpClient, times(1)).send(any(HttpRequest.class), any());
    }

    @Test
    void testGetMatches_ServerErrorIsRetried() throws Exception {
        respond(503, "unavailable");

        assertThatThrownBy(() -> applicator.getMatches(LabelSelector.EVERYTHING, LabelType.NODE))
            .isInstanceOf(StoreException.class)
            .hasMessageContaining("after 2 attempts");
        verify(httpClient, times(2)).send(any(HttpRequest.class), any());
    }

    @Test
    void testGetMatches_ConnectionFailureIsRetried() throws Exception {
        when(httpClient.<String>send(any(HttpRequest.class), any()))
            .thenThrow(new IOException("connection refused"))
            .thenReturn(response);
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(TWO_NODES);

        List<Labeled> nodes = applicator.getMatches(LabelSelector.EVERYTHING, LabelType.NODE);

        assertThat(nodes).hasSize(2);
    }

    @Test
    void testGetMatches_UnparsableBody() throws Exception {
        respond(200, "not json");

        assertThatThrownBy(() -> applicator.getMatches(LabelSelector.EVERYTHING, LabelType.NODE))
            .isInstanceOf(StoreException.class)
            .hasMessageContaining("Unparsable");
    }

    @Test
    void testGetLabels_UnknownNodeIsEmpty() throws Exception {
        respond(200, TWO_NODES);

        assertThat(applicator.getLabels(LabelType.NODE, "node-2").getLabels()).containsEntry("app", "db");
        assertThat(applicator.getLabels(LabelType.NODE, "node-9").getLabels()).isEmpty();
    }

    @Test
    void testPodLabelsAreNotServed() {
        assertThatThrownBy(() -> applicator.getMatches(LabelSelector.EVERYTHING, LabelType.POD))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testWritesAreRejected() {
        assertThatThrownBy(() -> applicator.setLabel(LabelType.NODE, "node-1", "app", "web"))
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessageContaining("read-only");
        assertThatThrownBy(() -> applicator.removeAllLabels(LabelType.NODE, "node-1"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testConstructor_RejectsEmptyEndpoint() {
        assertThatThrownBy(() -> new HttpApplicator(httpClient, " ", Map.of(), new RetryPolicy(1), Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testWatchMatches_PollsUntilClosed() throws Exception {
        // Given
        respond(200, TWO_NODES);
        List<List<Labeled>> snapshots = new CopyOnWriteArrayList<>();

        // When
        WatchHandle handle = applicator.watchMatches(LabelSelector.parse("app=db"), LabelType.NODE, snapshots::add);

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> snapshots.size() >= 2);
        handle.close();
        assertThat(snapshots.get(0)).extracting(Labeled::getId).containsExactly("node-2");
    }
}
