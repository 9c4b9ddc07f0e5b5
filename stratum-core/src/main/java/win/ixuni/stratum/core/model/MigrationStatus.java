package win.ixuni.stratum.core.model;

/**
 * Migration task status
 * <p>
 * queued → in_progress → {completed, failed}; queued | in_progress → cancelled.
 * Every status except queued and in_progress is terminal.
 */
public enum MigrationStatus {

    QUEUED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != QUEUED && this != IN_PROGRESS;
    }

    public static MigrationStatus parse(String raw) {
        return EnumParsing.parse(MigrationStatus.class, "migration status", raw);
    }
}
