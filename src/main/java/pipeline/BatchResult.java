package pipeline;

import grid.ClusterKey;
import grid.ClusteringResult;
import model.DemosaicedFrame;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one {@link PipelineOrchestrator#run} produced.
 *
 * @param failedFamilies complete clusters that could not be stitched, with the reason
 */
public record BatchResult(List<DemosaicedFrame> frames,
        ClusteringResult<DemosaicedFrame> clustering,
        List<StitchResult> composites,
        Map<ClusterKey, String> failedFamilies) {

    public BatchResult {
        frames = List.copyOf(frames);
        composites = List.copyOf(composites);
        failedFamilies = Collections.unmodifiableMap(new LinkedHashMap<>(failedFamilies));
    }

    public boolean hasFailures() {
        return !failedFamilies.isEmpty();
    }
}
