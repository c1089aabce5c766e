package hw;

/** Snapshot of the machine's power supply. */
public record PowerState(boolean onAC, int batteryPercent) {

    public PowerState {
        batteryPercent = clampPercent(batteryPercent);
    }

    static int clampPercent(int v) {
        return Math.max(0, Math.min(100, v));
    }
}
