package grid;

import model.Identified;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a flat batch of frames into families that share a {@link ClusterKey}.
 * Only identifiers ending in a four-character component take part, and only
 * families of exactly {@code clusterLength} members are returned. Everything else
 * is dropped, never raised; {@link #clusterWithReport} says what was dropped.
 */
public final class FrameClusterer {

    private static final Logger logger = LoggerFactory.getLogger(FrameClusterer.class);

    public static final int DEFAULT_CLUSTER_LENGTH = GridAssembler.CLUSTER_SIZE;

    private final int clusterLength;

    public FrameClusterer() {
        this(DEFAULT_CLUSTER_LENGTH);
    }

    public FrameClusterer(int clusterLength) {
        if (clusterLength < 1)
            throw new IllegalArgumentException("clusterLength must be >= 1, got " + clusterLength);
        this.clusterLength = clusterLength;
    }

    public int clusterLength() {
        return clusterLength;
    }

    public <T extends Identified> List<Cluster<T>> cluster(List<? extends T> items) {
        return this.<T>clusterWithReport(items).clusters();
    }

    public <T extends Identified> ClusteringResult<T> clusterWithReport(List<? extends T> items) {
        Map<ClusterKey, List<T>> groups = new LinkedHashMap<>();
        List<String> excluded = new ArrayList<>();

        for (T item : items) {
            String id = item.identifier();
            if (!ClusterKey.isTileIdentifier(id)) {
                excluded.add(id);
                continue;
            }
            groups.computeIfAbsent(ClusterKey.of(id), k -> new ArrayList<>()).add(item);
        }

        List<Cluster<T>> clusters = new ArrayList<>();
        Map<ClusterKey, Integer> dropped = new LinkedHashMap<>();
        for (Map.Entry<ClusterKey, List<T>> e : groups.entrySet()) {
            if (e.getValue().size() == clusterLength)
                clusters.add(new Cluster<>(e.getKey(), e.getValue()));
            else
                dropped.put(e.getKey(), e.getValue().size());
        }

        logger.debug("Clustered {} frames: {} clusters, {} excluded identifiers, {} incomplete groups",
                items.size(), clusters.size(), excluded.size(), dropped.size());
        return new ClusteringResult<>(clusters, excluded, dropped);
    }
}
