package win.ixuni.stratum.core.model;

import lombok.Getter;

/**
 * Priority levels, shared by routing rules and migration tasks
 * <p>
 * Higher value = evaluated (rules) or drained (tasks) first.
 */
@Getter
public enum Priority {

    LOW(0),
    NORMAL(1),
    HIGH(2),
    CRITICAL(3);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    /**
     * Parse a priority from its name ("high") or numeric value ("2")
     */
    public static Priority parse(String raw) {
        if (raw != null) {
            // 按字面匹配数值
            String trimmed = raw.trim();
            for (Priority p : values()) {
                if (Integer.toString(p.value).equals(trimmed)) {
                    return p;
                }
            }
        }
        return EnumParsing.parse(Priority.class, "priority", raw);
    }
}
