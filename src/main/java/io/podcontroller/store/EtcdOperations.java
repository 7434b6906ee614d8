package io.podcontroller.store;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import io.etcd.jetcd.options.WatchOption;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static io.podcontroller.config.Constants.ETCD_OPERATION_TIMEOUT_SECONDS;
import static io.podcontroller.config.Constants.PATH_DELIMITER;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Thin helpers over the jetcd KV and Watch clients shared by the etcd backed stores.
 * Every call is bounded by the etcd operation timeout.
 */
@Slf4j
public class EtcdOperations {

    private final KV kvClient;
    private final Watch watchClient;

    public EtcdOperations(KV kvClient, Watch watchClient) {
        this.kvClient = kvClient;
        this.watchClient = watchClient;
    }

    /**
     * Executes etcd get operation for a single key
     */
    public Optional<KeyValue> get(String key) throws Exception {
        GetResponse response = kvClient.get(bytes(key)).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (response.getKvs().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(response.getKvs().get(0));
    }

    /**
     * Executes etcd prefix query to retrieve all keys below the given path
     */
    public List<KeyValue> getPrefix(String prefix) throws Exception {
        // Add trailing slash for etcd prefix queries to ensure precise matching
        ByteSequence prefixBytes = bytes(prefix + PATH_DELIMITER);
        GetResponse response = kvClient.get(
            prefixBytes,
            GetOption.newBuilder().withPrefix(prefixBytes).build()
        ).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        return response.getKvs();
    }

    /**
     * Writes the value only if the key does not exist yet.
     *
     * @return true if the key was created
     */
    public boolean putIfAbsent(String key, byte[] value) throws Exception {
        ByteSequence keyBytes = bytes(key);
        TxnResponse txnResponse = kvClient.txn()
            .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.version(0)))
            .Then(Op.put(keyBytes, ByteSequence.from(value), PutOption.DEFAULT))
            .commit()
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        return txnResponse.isSucceeded();
    }

    /**
     * Compare-And-Swap put guarded by the mod revision observed when the value was read.
     * A revision of 0 means the key must not exist.
     *
     * @throws StaleRevisionException if another writer got there first
     */
    public void putAtRevision(String key, byte[] value, long expectedModRevision) throws Exception {
        ByteSequence keyBytes = bytes(key);
        TxnResponse txnResponse = kvClient.txn()
            .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(expectedModRevision)))
            .Then(Op.put(keyBytes, ByteSequence.from(value), PutOption.DEFAULT))
            .commit()
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (!txnResponse.isSucceeded()) {
            throw new StaleRevisionException(key);
        }
    }

    /**
     * Compare-And-Swap delete guarded by the mod revision observed when the value was read.
     *
     * @throws StaleRevisionException if the key changed in the meantime
     */
    public void deleteAtRevision(String key, long expectedModRevision) throws Exception {
        ByteSequence keyBytes = bytes(key);
        TxnResponse txnResponse = kvClient.txn()
            .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(expectedModRevision)))
            .Then(Op.delete(keyBytes, DeleteOption.DEFAULT))
            .commit()
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (!txnResponse.isSucceeded()) {
            throw new StaleRevisionException(key);
        }
    }

    /**
     * Executes etcd delete operation for a key
     *
     * @return number of deleted keys
     */
    public long delete(String key) throws Exception {
        return kvClient.delete(bytes(key)).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS).getDeleted();
    }

    /**
     * Watch one key, or every key below a path when {@code prefix} is set.
     */
    public WatchHandle watch(String key, boolean prefix, Runnable onChange) {
        WatchOption option = prefix
            ? WatchOption.newBuilder().withPrefix(bytes(key + PATH_DELIMITER)).build()
            : WatchOption.DEFAULT;
        ByteSequence watchKey = prefix ? bytes(key + PATH_DELIMITER) : bytes(key);
        Watch.Watcher watcher = watchClient.watch(watchKey, option, watchResponse -> {
            log.debug("Change notification for {} ({} events)", key, watchResponse.getEvents().size());
            onChange.run();
        });
        return () -> {
            try {
                watcher.close();
            } catch (Exception e) {
                log.warn("Error closing watch on {}: {}", key, e.getMessage());
            }
        };
    }

    public static ByteSequence bytes(String value) {
        return ByteSequence.from(value, UTF_8);
    }

    public static String string(ByteSequence value) {
        return value.toString(UTF_8);
    }
}
