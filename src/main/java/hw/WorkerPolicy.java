package hw;

/**
 * Sizes the stage worker pool and gates the GPU path from the power state.
 * Plugged in or well charged: oversubscribe; half charged: one worker per core;
 * low battery: half the cores.
 */
public final class WorkerPolicy {

    /** The GPU path needs more battery than this, plugged in or not. */
    public static final int BATTERY_GPU_MIN = 30;

    private final int cores;

    public WorkerPolicy() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public WorkerPolicy(int cores) {
        this.cores = Math.max(1, cores);
    }

    public int threads(PowerState power) {
        if (power.onAC() || power.batteryPercent() >= 80)
            return Math.min(cores * 2, cores + 4);
        if (power.batteryPercent() >= 40)
            return cores;
        return Math.max(1, cores / 2);
    }

    public boolean gpuAllowed(PowerState power, boolean userWantsGPU) {
        if (!userWantsGPU)
            return false;
        return power.batteryPercent() > BATTERY_GPU_MIN;
    }
}
