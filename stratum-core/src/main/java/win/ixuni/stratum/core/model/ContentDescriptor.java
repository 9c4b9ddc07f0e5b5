package win.ixuni.stratum.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Classification of a piece of content, computed once per routing call
 */
@Value
@Builder
public class ContentDescriptor {

    long sizeBytes;

    ContentCategory category;

    /**
     * Supplied or guessed MIME type, null when unknown
     */
    String mimeType;

    String filename;

    /**
     * Caller-supplied metadata
     */
    @Builder.Default
    Map<String, String> metadata = Map.of();

    /**
     * SHA-256 of the content, null when no bytes were analyzed
     */
    String contentHash;
}
