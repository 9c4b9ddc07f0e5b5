package win.ixuni.stratum.core.model;

/**
 * Policy schedule mode
 */
public enum ScheduleMode {

    /**
     * Executed only on explicit request
     */
    MANUAL,

    /**
     * Reserved, not accepted yet
     */
    PERIODIC;

    public static ScheduleMode parse(String raw) {
        return EnumParsing.parse(ScheduleMode.class, "schedule mode", raw);
    }
}
