package win.ixuni.stratum.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Filter passed to {@code BackendStore.list}
 * <p>
 * Every set field must match; an empty filter matches everything.
 * The age criterion needs a reference time, so only {@link #matches(ContentItem, Instant)} applies it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ContentFilter {

    /**
     * Content type prefix, e.g. "image" or "image/png"
     */
    String type;

    /**
     * Content type prefixes, any of which may match
     */
    @Builder.Default
    List<String> contentTypes = List.of();

    /**
     * Id or filename prefix
     */
    String prefix;

    Long minSizeBytes;

    Long maxSizeBytes;

    /**
     * Minimum age in days, measured from the item's creation time
     */
    Integer minAgeDays;

    /**
     * Tags, any of which may match the item's comma-separated {@code tags} metadata entry
     */
    @Builder.Default
    List<String> tags = List.of();

    /**
     * Metadata entries that must be present with exactly these values
     */
    @Builder.Default
    Map<String, String> custom = Map.of();

    public static ContentFilter all() {
        return ContentFilter.builder().build();
    }

    /**
     * Match every criterion except the age
     */
    public boolean matches(ContentItem item) {
        if (type != null && !type.isBlank() && !hasTypePrefix(item, type)) {
            return false;
        }
        if (contentTypes != null && !contentTypes.isEmpty()
                && contentTypes.stream().noneMatch(t -> hasTypePrefix(item, t))) {
            return false;
        }
        if (prefix != null && !prefix.isEmpty()) {
            String filename = item.getFilename();
            boolean idMatch = item.getId() != null && item.getId().startsWith(prefix);
            boolean nameMatch = filename != null && filename.startsWith(prefix);
            if (!idMatch && !nameMatch) {
                return false;
            }
        }
        if (minSizeBytes != null && item.getSizeBytes() < minSizeBytes) {
            return false;
        }
        if (maxSizeBytes != null && item.getSizeBytes() > maxSizeBytes) {
            return false;
        }
        if (custom != null) {
            for (Map.Entry<String, String> entry : custom.entrySet()) {
                if (!entry.getValue().equals(item.getMetadata().get(entry.getKey()))) {
                    return false;
                }
            }
        }
        if (tags != null && !tags.isEmpty()) {
            List<String> itemTags = item.getTags();
            if (tags.stream().noneMatch(itemTags::contains)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Match every criterion, the age measured against {@code now}
     * <p>
     * Items without a creation time never satisfy an age criterion.
     */
    public boolean matches(ContentItem item, Instant now) {
        if (!matches(item)) {
            return false;
        }
        if (minAgeDays != null && minAgeDays > 0) {
            Instant createdAt = item.getCreatedAt();
            return createdAt != null && !createdAt.isAfter(now.minus(Duration.ofDays(minAgeDays)));
        }
        return true;
    }

    private static boolean hasTypePrefix(ContentItem item, String prefix) {
        String contentType = item.getContentType();
        return contentType != null
                && contentType.toLowerCase(Locale.ROOT).startsWith(prefix.trim().toLowerCase(Locale.ROOT));
    }
}
