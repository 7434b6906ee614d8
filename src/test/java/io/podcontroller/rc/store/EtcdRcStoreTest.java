package io.podcontroller.rc.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.KeyValue;
import io.podcontroller.labels.Applicator;
import io.podcontroller.labels.LabelSelector;
import io.podcontroller.labels.Labeled;
import io.podcontroller.labels.LabelType;
import io.podcontroller.models.PodManifest;
import io.podcontroller.models.RcRecord;
import io.podcontroller.store.ConflictException;
import io.podcontroller.store.EtcdOperations;
import io.podcontroller.store.NotFoundException;
import io.podcontroller.store.PodStore;
import io.podcontroller.store.PodTree;
import io.podcontroller.store.RetryPolicy;
import io.podcontroller.store.StaleRevisionException;
import io.podcontroller.store.StoreException;
import io.podcontroller.store.ValidationException;
import io.podcontroller.store.WatchHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EtcdRcStoreTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private EtcdOperations etcd;

    @Mock
    private Applicator applicator;

    @Mock
    private PodStore podStore;

    @Mock
    private WatchHandle watchHandle;

    private EtcdRcStore store;

    @BeforeEach
    void setUp() {
        store = new EtcdRcStore(etcd, new RetryPolicy(3), applicator, podStore);
    }

    private static RcRecord record(String id, int replicas) {
        RcRecord record = new RcRecord(id, new PodManifest("web", "1"), "app=web", Map.of("team", "search"));
        record.setReplicasDesired(replicas);
        return record;
    }

    private static KeyValue keyValue(String key, byte[] value, long modRevision) {
        KeyValue kv = mock(KeyValue.class);
        lenient().when(kv.getKey()).thenReturn(ByteSequence.from(key, UTF_8));
        lenient().when(kv.getValue()).thenReturn(ByteSequence.from(value));
        lenient().when(kv.getModRevision()).thenReturn(modRevision);
        return kv;
    }

    private static KeyValue stored(RcRecord record, long modRevision) throws Exception {
        return keyValue("replication_controllers/" + record.getId(), MAPPER.writeValueAsBytes(record), modRevision);
    }

    // =================================================================
    // CREATE
    // =================================================================

    @Test
    void testCreate_WritesRecordAndLabels() throws Exception {
        // Given
        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<byte[]> value = ArgumentCaptor.forClass(byte[].class);
        when(etcd.putIfAbsent(key.capture(), value.capture())).thenReturn(true);

        // When
        RcRecord created = store.create(new PodManifest("web", "1"), "app=web", Map.of("team", "search"));

        // Then
        assertThat(key.getValue()).isEqualTo("replication_controllers/" + created.getId());
        RcRecord written = MAPPER.readValue(value.getValue(), RcRecord.class);
        assertThat(written).isEqualTo(created);
        assertThat(written.getReplicasDesired()).isZero();
        verify(applicator).setLabels(LabelType.RC, created.getId(), Map.of("team", "search"));
    }

    @Test
    void testCreate_ExistingKeyIsConflict() throws Exception {
        when(etcd.putIfAbsent(anyString(), any())).thenReturn(false);

        assertThatThrownBy(() -> store.create(new PodManifest("web", "1"), "app=web", Map.of()))
            .isInstanceOf(ConflictException.class);
        verify(etcd, times(1)).putIfAbsent(anyString(), any());
        verifyNoInteractions(applicator);
    }

    @Test
    void testCreate_LabelFailureRollsBackRecord() throws Exception {
        // Given
        when(etcd.putIfAbsent(anyString(), any())).thenReturn(true);
        doThrow(new StoreException("labels unavailable"))
            .when(applicator).setLabels(eq(LabelType.RC), anyString(), anyMap());

        // When / Then
        assertThatThrownBy(() -> store.create(new PodManifest("web", "1"), "app=web", Map.of("team", "search")))
            .isInstanceOf(StoreException.class)
            .hasMessage("labels unavailable");
        verify(etcd).delete(startsWith("replication_controllers/"));
    }

    @Test
    void testCreate_InvalidSelectorNeverTouchesStore() {
        assertThatThrownBy(() -> store.create(new PodManifest("web", "1"), "a b", Map.of()))
            .isInstanceOf(ValidationException.class);
        verifyNoInteractions(etcd, applicator);
    }

    // =================================================================
    // READS
    // =================================================================

    @Test
    void testGet() throws Exception {
        RcRecord record = record("rc-1", 2);
        KeyValue kv = stored(record, 3L);
        when(etcd.get("replication_controllers/rc-1")).thenReturn(Optional.of(kv));

        assertThat(store.get("rc-1")).isEqualTo(record);
    }

    @Test
    void testGet_Missing() throws Exception {
        when(etcd.get("replication_controllers/rc-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.get("rc-1"))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("rc-1");
    }

    @Test
    void testGet_CorruptRecord() throws Exception {
        KeyValue kv = keyValue("replication_controllers/rc-1", "{oops".getBytes(UTF_8), 3L);
        when(etcd.get("replication_controllers/rc-1")).thenReturn(Optional.of(kv));

        assertThatThrownBy(() -> store.get("rc-1"))
            .isInstanceOf(StoreException.class)
            .hasMessageContaining("Corrupt replication controller");
    }

    @Test
    void testList_SkipsCorruptEntries() throws Exception {
        List<KeyValue> kvs = List.of(
            stored(record("rc-1", 0), 1L),
            keyValue("replication_controllers/rc-2", "{oops".getBytes(UTF_8), 2L),
            stored(record("rc-3", 1), 3L));
        when(etcd.getPrefix("replication_controllers")).thenReturn(kvs);

        assertThat(store.list()).extracting(RcRecord::getId).containsExactly("rc-1", "rc-3");
    }

    // =================================================================
    // UPDATES
    // =================================================================

    @Test
    void testSetDesiredReplicas_CompareAndSwap() throws Exception {
        // Given
        KeyValue kv = stored(record("rc-1", 0), 7L);
        when(etcd.get("replication_controllers/rc-1")).thenReturn(Optional.of(kv));

        // When
        store.setDesiredReplicas("rc-1", 4);

        // Then
        ArgumentCaptor<byte[]> value = ArgumentCaptor.forClass(byte[].class);
        verify(etcd).putAtRevision(eq("replication_controllers/rc-1"), value.capture(), eq(7L));
        assertThat(MAPPER.readValue(value.getValue(), RcRecord.class).getReplicasDesired()).isEqualTo(4);
    }

    @Test
    void testSetDesiredReplicas_RetriesLostRace() throws Exception {
        // Given
        KeyValue first = stored(record("rc-1", 0), 7L);
        KeyValue second = stored(record("rc-1", 1), 8L);
        when(etcd.get("replication_controllers/rc-1")).thenReturn(Optional.of(first), Optional.of(second));
        doThrow(new StaleRevisionException("replication_controllers/rc-1"))
            .when(etcd).putAtRevision(eq("replication_controllers/rc-1"), any(), eq(7L));

        // When
        store.setDesiredReplicas("rc-1", 5);

        // Then
        verify(etcd).putAtRevision(eq("replication_controllers/rc-1"), any(), eq(8L));
    }

    @Test
    void testSetDesiredReplicas_Negative() {
        assertThatThrownBy(() -> store.setDesiredReplicas("rc-1", -3)).isInstanceOf(ValidationException.class);
        verifyNoInteractions(etcd);
    }

    @Test
    void testDisable_AlreadyDisabledIsNotRewritten() throws Exception {
        RcRecord disabled = record("rc-1", 0);
        disabled.setDisabled(true);
        KeyValue kv = stored(disabled, 2L);
        when(etcd.get("replication_controllers/rc-1")).thenReturn(Optional.of(kv));

        store.disable("rc-1");

        verify(etcd, never()).putAtRevision(anyString(), any(), anyLong());
    }

    // =================================================================
    // DELETE
    // =================================================================

    @Test
    void testDelete_RefusedWithReplicas() throws Exception {
        KeyValue kv = stored(record("rc-1", 2), 2L);
        when(etcd.get("replication_controllers/rc-1")).thenReturn(Optional.of(kv));

        assertThatThrownBy(() -> store.delete("rc-1"))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("still wants 2 replica(s)");
        verify(etcd, never()).deleteAtRevision(anyString(), anyLong());
        verifyNoInteractions(applicator);
    }

    @Test
    void testDelete_RemovesRecordThenLabels() throws Exception {
        KeyValue kv = stored(record("rc-1", 0), 9L);
        when(etcd.get("replication_controllers/rc-1")).thenReturn(Optional.of(kv));

        store.delete("rc-1");

        verify(etcd).deleteAtRevision("replication_controllers/rc-1", 9L);
        verify(applicator).removeAllLabels(LabelType.RC, "rc-1");
    }

    @Test
    void testDelete_ReleasesOwnedPods() throws Exception {
        // Given
        KeyValue kv = stored(record("rc-1", 0), 9L);
        when(etcd.get("replication_controllers/rc-1")).thenReturn(Optional.of(kv));
        List<Labeled> owned = List.of(
            new Labeled(LabelType.POD, "node-a/web", Map.of("replication_controller_id", "rc-1")),
            new Labeled(LabelType.POD, "node-b/web", Map.of("replication_controller_id", "rc-1")));
        when(applicator.getMatches(any(LabelSelector.class), eq(LabelType.POD))).thenReturn(owned);

        // When
        store.delete("rc-1");

        // Then
        verify(podStore).deletePod(PodTree.INTENT, "node-a", "web");
        verify(podStore).deletePod(PodTree.INTENT, "node-b", "web");
        verify(applicator).removeAllLabels(LabelType.POD, "node-a/web");
        verify(applicator).removeAllLabels(LabelType.POD, "node-b/web");
    }

    @Test
    void testDelete_ReleaseFailureStillReleasesOtherPods() throws Exception {
        // Given
        KeyValue kv = stored(record("rc-1", 0), 9L);
        when(etcd.get("replication_controllers/rc-1")).thenReturn(Optional.of(kv));
        List<Labeled> owned = List.of(
            new Labeled(LabelType.POD, "node-a/web", Map.of("replication_controller_id", "rc-1")),
            new Labeled(LabelType.POD, "node-b/web", Map.of("replication_controller_id", "rc-1")));
        when(applicator.getMatches(any(LabelSelector.class), eq(LabelType.POD))).thenReturn(owned);
        doThrow(new StoreException("etcd unavailable")).when(podStore).deletePod(PodTree.INTENT, "node-a", "web");

        // When / Then
        assertThatThrownBy(() -> store.delete("rc-1"))
            .isInstanceOf(StoreException.class)
            .hasMessage("etcd unavailable");
        verify(applicator).removeAllLabels(LabelType.POD, "node-b/web");
        verify(etcd).deleteAtRevision("replication_controllers/rc-1", 9L);
    }

    @Test
    void testDelete_Missing() throws Exception {
        when(etcd.get("replication_controllers/rc-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.delete("rc-1")).isInstanceOf(NotFoundException.class);
    }

    // =================================================================
    // WATCHES
    // =================================================================

    @Test
    void testWatchTargetsRecordKeyAndPrefix() {
        Runnable onChange = () -> { };
        when(etcd.watch("replication_controllers/rc-1", false, onChange)).thenReturn(watchHandle);
        when(etcd.watch("replication_controllers", true, onChange)).thenReturn(watchHandle);

        assertThat(store.watch("rc-1", onChange)).isSameAs(watchHandle);
        assertThat(store.watchAll(onChange)).isSameAs(watchHandle);
    }
}
