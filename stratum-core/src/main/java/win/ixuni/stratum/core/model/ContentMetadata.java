package win.ixuni.stratum.core.model;

/**
 * Well-known metadata keys
 */
public final class ContentMetadata {

    public static final String CONTENT_TYPE = "content_type";

    public static final String FILENAME = "filename";

    public static final String SIZE = "size";

    /**
     * Comma-separated tags
     */
    public static final String TAGS = "tags";

    /**
     * Caller-chosen content id; backends derive one from the content when absent
     */
    public static final String CONTENT_ID = "content_id";

    public static final String MIGRATED_FROM = "migrated_from";

    public static final String MIGRATION_TASK = "migration_task";

    public static final String MIGRATION_TIME = "migration_time";

    private ContentMetadata() {
    }
}
