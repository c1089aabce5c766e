package hw;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import oshi.SystemInfo;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.hardware.PowerSource;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link PowerState} source for {@link WorkerPolicy}, read from OSHI's power sources.
 * <p>
 * One query per reading: plugged in if any source is on line, charge is the mean of the
 * sources that report one. No sources (desktops) or a failing query read as
 * {@link #MAINS}. The {@code forceOnAC} and {@code forceBatteryLevel} properties replace
 * the matching half of the reading; the hardware is not queried when both are set.
 */
public final class BatteryMonitor implements Supplier<PowerState> {

    private static final Logger logger = LoggerFactory.getLogger(BatteryMonitor.class);

    public static final String FORCE_ON_AC = "forceOnAC";
    public static final String FORCE_BATTERY_LEVEL = "forceBatteryLevel";

    /** What a machine without a battery reads as. */
    public static final PowerState MAINS = new PowerState(true, 100);

    // created on first use, so a missing native OSHI backend surfaces as a failed query
    private static final class Hal {
        static final HardwareAbstractionLayer INSTANCE = new SystemInfo().getHardware();
    }

    private final Function<String, String> properties;

    public BatteryMonitor() {
        this(System::getProperty);
    }

    BatteryMonitor(Function<String, String> properties) {
        this.properties = properties;
    }

    @Override
    public PowerState get() {
        Boolean forcedAC = parseOnAC(properties.apply(FORCE_ON_AC));
        Integer forcedLevel = parseLevel(properties.apply(FORCE_BATTERY_LEVEL));
        if (forcedAC != null && forcedLevel != null)
            return new PowerState(forcedAC, forcedLevel);

        PowerState measured = measure();
        return new PowerState(
                forcedAC != null ? forcedAC : measured.onAC(),
                forcedLevel != null ? forcedLevel : measured.batteryPercent());
    }

    private static PowerState measure() {
        try {
            return summarize(Hal.INSTANCE.getPowerSources());
        } catch (RuntimeException | LinkageError e) {
            logger.debug("Power source query failed, assuming mains power: {}", e.toString());
            return MAINS;
        }
    }

    static PowerState summarize(List<PowerSource> sources) {
        if (sources.isEmpty())
            return MAINS;
        boolean online = false;
        double sum = 0;
        int n = 0;
        for (PowerSource p : sources) {
            online |= p.isPowerOnLine();
            double pct = p.getRemainingCapacityPercent();
            if (!Double.isNaN(pct)) {
                sum += pct;
                n++;
            }
        }
        int level = n == 0 ? 100 : (int) Math.round(sum / n * 100.0);
        return new PowerState(online, level);
    }

    static Boolean parseOnAC(String value) {
        return value == null ? null : Boolean.parseBoolean(value.trim());
    }

    static Integer parseLevel(String value) {
        if (value == null)
            return null;
        try {
            return PowerState.clampPercent(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}='{}': not an integer", FORCE_BATTERY_LEVEL, value);
            return null;
        }
    }
}
