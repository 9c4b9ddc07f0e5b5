package win.ixuni.stratum.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Content descriptor as listed by a backend store
 */
@Value
@Builder
public class ContentItem {

    String id;

    long sizeBytes;

    String contentType;

    Instant createdAt;

    @Builder.Default
    Map<String, String> metadata = Map.of();

    /**
     * Original filename, when the content was stored with one
     */
    public String getFilename() {
        return metadata.get(ContentMetadata.FILENAME);
    }

    /**
     * Tags from the comma-separated {@code tags} metadata entry
     */
    public List<String> getTags() {
        String raw = metadata.get(ContentMetadata.TAGS);
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toList());
    }
}
