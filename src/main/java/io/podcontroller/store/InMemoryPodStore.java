package io.podcontroller.store;

import io.podcontroller.models.PodManifest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static io.podcontroller.config.Constants.PATH_DELIMITER;

/**
 * In-memory PodStore for tests and dry runs. Keys follow {@link PodPathScheme}.
 */
public class InMemoryPodStore implements PodStore {

    private final PodPathScheme paths = PodPathScheme.getInstance();
    private final Map<String, PodManifest> pods = new ConcurrentHashMap<>();

    @Override
    public void setPod(PodTree tree, String nodeName, PodManifest manifest) throws StoreException {
        pods.put(paths.podPath(tree, nodeName, manifest.getId()), manifest);
    }

    @Override
    public Optional<PodManifest> getPod(PodTree tree, String nodeName, String podId) throws StoreException {
        return Optional.ofNullable(pods.get(paths.podPath(tree, nodeName, podId)));
    }

    @Override
    public List<PodManifest> listPods(PodTree tree, String nodeName) throws StoreException {
        String prefix = paths.nodePath(tree, nodeName) + PATH_DELIMITER;
        List<PodManifest> result = new ArrayList<>();
        pods.forEach((key, manifest) -> {
            if (key.startsWith(prefix)) {
                result.add(manifest);
            }
        });
        return result;
    }

    @Override
    public void deletePod(PodTree tree, String nodeName, String podId) throws StoreException {
        pods.remove(paths.podPath(tree, nodeName, podId));
    }
}
