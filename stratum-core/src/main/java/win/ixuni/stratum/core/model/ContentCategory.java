package win.ixuni.stratum.core.model;

/**
 * Content categories used for rule matching
 */
public enum ContentCategory {

    IMAGE,
    VIDEO,
    AUDIO,
    DOCUMENT,
    ARCHIVE,
    /**
     * Default for anything unrecognized
     */
    BINARY;

    public static ContentCategory parse(String raw) {
        return EnumParsing.parse(ContentCategory.class, "content category", raw);
    }
}
