package grid;

import model.Identified;

import java.util.List;
import java.util.Objects;

/** One family of frames sharing a {@link ClusterKey}, in first-seen order. */
public record Cluster<T extends Identified>(ClusterKey key, List<T> members) {

    public Cluster {
        Objects.requireNonNull(key, "key");
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
