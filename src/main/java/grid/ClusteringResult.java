package grid;

import model.Identified;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Clusters plus what was left out of them.
 *
 * @param clusters            complete families, in first-seen key order
 * @param excludedIdentifiers identifiers whose trailing component is not four characters
 * @param droppedGroups       member count of every family whose size did not match
 */
public record ClusteringResult<T extends Identified>(List<Cluster<T>> clusters,
        List<String> excludedIdentifiers,
        Map<ClusterKey, Integer> droppedGroups) {

    public ClusteringResult {
        clusters = List.copyOf(clusters);
        excludedIdentifiers = List.copyOf(excludedIdentifiers);
        droppedGroups = Collections.unmodifiableMap(new LinkedHashMap<>(droppedGroups));
    }

    public boolean isClean() {
        return excludedIdentifiers.isEmpty() && droppedGroups.isEmpty();
    }
}
