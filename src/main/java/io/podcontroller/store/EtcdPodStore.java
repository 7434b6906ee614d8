package io.podcontroller.store;

import io.etcd.jetcd.KeyValue;
import io.podcontroller.models.PodManifest;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * etcd-based implementation of PodStore.
 */
@Slf4j
public class EtcdPodStore implements PodStore {

    private final EtcdOperations etcd;
    private final PodPathScheme paths;
    private final RetryPolicy retryPolicy;

    public EtcdPodStore(EtcdOperations etcd, RetryPolicy retryPolicy) {
        this.etcd = etcd;
        this.paths = PodPathScheme.getInstance();
        this.retryPolicy = retryPolicy;
    }

    @Override
    public void setPod(PodTree tree, String nodeName, PodManifest manifest) throws StoreException {
        String key = paths.podPath(tree, nodeName, manifest.getId());
        byte[] json = manifest.toCanonicalJson();
        log.debug("Writing pod {} at {}", manifest.getId(), key);

        retryPolicy.run("write pod " + key, () -> {
            // Skip identical content; otherwise write only if the key is still at the revision read
            Optional<KeyValue> current = etcd.get(key);
            if (current.isPresent() && Arrays.equals(current.get().getValue().getBytes(), json)) {
                return;
            }
            long revision = current.map(KeyValue::getModRevision).orElse(0L);
            etcd.putAtRevision(key, json, revision);
        });
    }

    @Override
    public Optional<PodManifest> getPod(PodTree tree, String nodeName, String podId) throws StoreException {
        String key = paths.podPath(tree, nodeName, podId);
        return retryPolicy.call("read pod " + key, () -> {
            Optional<KeyValue> kv = etcd.get(key);
            if (kv.isEmpty()) {
                return Optional.<PodManifest>empty();
            }
            return Optional.of(PodManifest.fromJson(kv.get().getValue().getBytes()));
        });
    }

    @Override
    public List<PodManifest> listPods(PodTree tree, String nodeName) throws StoreException {
        String prefix = paths.nodePath(tree, nodeName);
        return retryPolicy.call("list pods under " + prefix, () -> {
            List<PodManifest> pods = new ArrayList<>();
            for (KeyValue kv : etcd.getPrefix(prefix)) {
                try {
                    pods.add(PodManifest.fromJson(kv.getValue().getBytes()));
                } catch (Exception parseException) {
                    log.warn("Failed to parse pod manifest at key {}: {}",
                        EtcdOperations.string(kv.getKey()), parseException.getMessage());
                }
            }
            return pods;
        });
    }

    @Override
    public void deletePod(PodTree tree, String nodeName, String podId) throws StoreException {
        String key = paths.podPath(tree, nodeName, podId);
        retryPolicy.run("delete pod " + key, () -> {
            long deleted = etcd.delete(key);
            log.debug("Deleted {} key(s) at {}", deleted, key);
        });
    }
}
