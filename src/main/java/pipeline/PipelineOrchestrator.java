package pipeline;

import grid.Cluster;
import grid.ClusterKey;
import grid.ClusteringResult;
import grid.FrameClusterer;
import grid.GridAssembler;
import hw.BatteryMonitor;
import hw.PowerState;
import hw.WorkerPolicy;
import model.ColorImage;
import model.DemosaicedFrame;
import model.RawFrame;
import stages.Demosaicer;
import util.Timing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.function.Supplier;

/**
 * Runs demosaic → cluster → assemble over a batch of raw frames.
 * Frames and clusters are independent, so each one is a separate task on a pool sized
 * by {@link WorkerPolicy}; a scaler thread re-reads the power state while a stage runs.
 */
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final long SCALER_PERIOD_MS = 5000;

    private final Demosaicer cpuDemosaicer;
    private final Demosaicer gpuDemosaicer; // null when the chosen algorithm has no GPU path
    private final boolean userWantsGPU;
    private final FrameClusterer clusterer;
    private final GridAssembler assembler = new GridAssembler();
    private final WorkerPolicy policy;
    private final Supplier<PowerState> power;

    // live GPU permission based on power policy (updated by scaler thread)
    private volatile boolean gpuAllowed;

    public PipelineOrchestrator(Demosaicer cpuDemosaicer, Demosaicer gpuDemosaicer, boolean useGPU,
            int clusterLength) {
        this(cpuDemosaicer, gpuDemosaicer, useGPU, clusterLength, new WorkerPolicy(), new BatteryMonitor());
    }

    public PipelineOrchestrator(Demosaicer cpuDemosaicer, Demosaicer gpuDemosaicer, boolean useGPU,
            int clusterLength, WorkerPolicy policy, Supplier<PowerState> power) {
        this.cpuDemosaicer = cpuDemosaicer;
        this.gpuDemosaicer = gpuDemosaicer;
        this.userWantsGPU = useGPU && gpuDemosaicer != null;
        this.clusterer = new FrameClusterer(clusterLength);
        this.policy = policy;
        this.power = power;
        this.gpuAllowed = policy.gpuAllowed(power.get(), userWantsGPU);
    }

    public boolean isGpuAllowed() {
        return gpuAllowed;
    }

    /** Full batch: demosaic every frame, cluster the results, assemble every complete cluster. */
    public BatchResult run(List<RawFrame> frames, boolean layered) throws InterruptedException {
        Timing timing = new Timing(logger);

        List<DemosaicedFrame> demosaiced = demosaicAll(frames);
        double demosaicMs = timing.stop("demosaic");

        ClusteringResult<DemosaicedFrame> clustering = clusterer.clusterWithReport(demosaiced);
        if (!clustering.isClean()) {
            logger.info("Skipped {} frames with non-tile identifiers and {} incomplete families {}",
                    clustering.excludedIdentifiers().size(), clustering.droppedGroups().size(),
                    clustering.droppedGroups());
        }

        Map<ClusterKey, String> failed = new LinkedHashMap<>();
        List<StitchResult> composites = assembleAll(clustering.clusters(), layered, failed);
        double assembleMs = timing.stop("assemble");

        logger.info("Stats: frames={} clusters={} failed={} layered={} gpuAllowed={} demosaic={} ms assemble={} ms",
                frames.size(), clustering.clusters().size(), failed.size(), layered, gpuAllowed,
                Math.round(demosaicMs), Math.round(assembleMs));
        return new BatchResult(demosaiced, clustering, composites, failed);
    }

    /** Demosaics every frame on the pool; output order matches input order. */
    public List<DemosaicedFrame> demosaicAll(List<RawFrame> frames) throws InterruptedException {
        List<Callable<DemosaicedFrame>> tasks = new ArrayList<>(frames.size());
        for (RawFrame f : frames) {
            tasks.add(() -> {
                Demosaicer d = gpuAllowed ? gpuDemosaicer : cpuDemosaicer;
                return new DemosaicedFrame(f.identifier(), d.demosaic(f));
            });
        }
        return runAll(tasks);
    }

    /** Outcome of one family: a composite, or the reason it could not be stitched. */
    private record Assembly(ClusterKey key, StitchResult result, String error) {
    }

    /**
     * Assembles every cluster on the pool; output order matches input order.
     *
     * @throws IllegalArgumentException for the first cluster that cannot be stitched
     */
    public List<StitchResult> assembleAll(List<Cluster<DemosaicedFrame>> clusters, boolean layered)
            throws InterruptedException {
        Map<ClusterKey, String> failed = new LinkedHashMap<>();
        List<StitchResult> out = assembleAll(clusters, layered, failed);
        if (!failed.isEmpty()) {
            Map.Entry<ClusterKey, String> first = failed.entrySet().iterator().next();
            throw new IllegalArgumentException("Family '" + first.getKey().value() + "': " + first.getValue());
        }
        return out;
    }

    /**
     * Assembles every cluster on the pool. A cluster that cannot be stitched (for example a
     * non-numeric tile order) is skipped and its key and reason are put into {@code failed};
     * the other families are still returned, in input order.
     */
    public List<StitchResult> assembleAll(List<Cluster<DemosaicedFrame>> clusters, boolean layered,
            Map<ClusterKey, String> failed) throws InterruptedException {
        List<Callable<Assembly>> tasks = new ArrayList<>(clusters.size());
        for (Cluster<DemosaicedFrame> c : clusters) {
            tasks.add(() -> {
                try {
                    List<ColorImage> images = layered
                            ? assembler.assembleLayers(c)
                            : List.of(assembler.assembleGrid(c));
                    return new Assembly(c.key(), new StitchResult(c.key(), layered, images), null);
                } catch (IllegalArgumentException e) {
                    return new Assembly(c.key(), null, e.getMessage());
                }
            });
        }

        List<StitchResult> out = new ArrayList<>(clusters.size());
        for (Assembly a : runAll(tasks)) {
            if (a.result() != null) {
                out.add(a.result());
            } else {
                logger.warn("Family '{}' not assembled: {}", a.key().value(), a.error());
                failed.put(a.key(), a.error());
            }
        }
        return out;
    }

    private <T> List<T> runAll(List<Callable<T>> tasks) throws InterruptedException {
        if (tasks.isEmpty())
            return List.of();

        PowerState start = power.get();
        int threads = Math.min(policy.threads(start), tasks.size());
        int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
        ArrayBlockingQueue<Runnable> queue = new ArrayBlockingQueue<>(Math.max(2, cores));
        ThreadPoolExecutor exec = new ThreadPoolExecutor(
                threads, threads, 60, TimeUnit.SECONDS, queue,
                new ThreadPoolExecutor.CallerRunsPolicy());
        logger.debug("Pool: threads={} tasks={} (onAC={}, bat={}%)",
                threads, tasks.size(), start.onAC(), start.batteryPercent());

        Thread scaler = startScaler(exec);
        try {
            List<Future<T>> futures = new ArrayList<>(tasks.size());
            for (Callable<T> t : tasks)
                futures.add(exec.submit(t));

            List<T> out = new ArrayList<>(futures.size());
            for (Future<T> f : futures)
                out.add(await(f));
            return out;
        } finally {
            scaler.interrupt();
            exec.shutdownNow();
            exec.awaitTermination(30, TimeUnit.SECONDS);
        }
    }

    private static <T> T await(Future<T> f) throws InterruptedException {
        try {
            return f.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            if (cause instanceof Error)
                throw (Error) cause;
            throw new IllegalStateException("Stage task failed", cause);
        }
    }

    // Live scaler thread: updates threads AND gpuAllowed based on live battery/AC
    private Thread startScaler(ThreadPoolExecutor exec) {
        Thread scaler = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    Thread.sleep(SCALER_PERIOD_MS);
                    PowerState now = power.get();
                    int target = policy.threads(now);
                    if (target != exec.getCorePoolSize()) {
                        if (target > exec.getMaximumPoolSize()) {
                            exec.setMaximumPoolSize(target);
                            exec.setCorePoolSize(target);
                        } else {
                            exec.setCorePoolSize(target);
                            exec.setMaximumPoolSize(target);
                        }
                        logger.info("Scaler: target threads = {}", target);
                    }
                    boolean newGpuAllowed = policy.gpuAllowed(now, userWantsGPU);
                    if (newGpuAllowed != gpuAllowed) {
                        gpuAllowed = newGpuAllowed;
                        logger.info("Scaler: GPU allowed = {} (onAC={}, bat={}%)",
                                gpuAllowed, now.onAC(), now.batteryPercent());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "battery-scaler");
        scaler.setDaemon(true);
        scaler.start();
        return scaler;
    }
}
