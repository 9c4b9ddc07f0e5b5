package win.ixuni.stratum.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContentFilterTest {

    private static ContentItem item(String id, long size, String contentType, Map<String, String> metadata) {
        return ContentItem.builder()
                .id(id)
                .sizeBytes(size)
                .contentType(contentType)
                .metadata(metadata)
                .build();
    }

    @Test
    @DisplayName("Empty filter matches everything")
    void testEmptyFilter() {
        assertTrue(ContentFilter.all().matches(item("a", 0, null, Map.of())));
    }

    @Test
    @DisplayName("Prefix matches id or filename")
    void testPrefix() {
        ContentFilter filter = ContentFilter.builder().prefix("p_").build();

        assertTrue(filter.matches(item("p_i3", 1, null, Map.of())));
        assertTrue(filter.matches(item("abc", 1, null, Map.of(ContentMetadata.FILENAME, "p_report.pdf"))));
        assertFalse(filter.matches(item("i1", 1, null, Map.of(ContentMetadata.FILENAME, "report.pdf"))));
    }

    @Test
    @DisplayName("Type, size bounds and custom metadata must all match")
    void testCombinedCriteria() {
        ContentFilter filter = ContentFilter.builder()
                .type("image")
                .minSizeBytes(10L)
                .maxSizeBytes(100L)
                .custom(Map.of("tier", "hot"))
                .build();

        assertTrue(filter.matches(item("a", 10, "image/png", Map.of("tier", "hot"))));
        assertTrue(filter.matches(item("b", 100, "IMAGE/JPEG", Map.of("tier", "hot"))));
        assertFalse(filter.matches(item("c", 101, "image/png", Map.of("tier", "hot"))));
        assertFalse(filter.matches(item("d", 50, "video/mp4", Map.of("tier", "hot"))));
        assertFalse(filter.matches(item("e", 50, "image/png", Map.of("tier", "cold"))));
        assertFalse(filter.matches(item("f", 50, null, Map.of("tier", "hot"))));
    }

    @Test
    @DisplayName("Any listed content type or tag is enough")
    void testContentTypesAndTags() {
        ContentFilter types = ContentFilter.builder().contentTypes(List.of("image/", "video/")).build();
        ContentFilter tags = ContentFilter.builder().tags(List.of("archive", "legal")).build();

        assertTrue(types.matches(item("a", 1, "video/mp4", Map.of())));
        assertFalse(types.matches(item("b", 1, "text/plain", Map.of())));
        assertFalse(types.matches(item("c", 1, null, Map.of())));

        assertTrue(tags.matches(item("d", 1, null, Map.of(ContentMetadata.TAGS, "draft, legal"))));
        assertFalse(tags.matches(item("e", 1, null, Map.of(ContentMetadata.TAGS, "draft,legalese"))));
        assertFalse(tags.matches(item("f", 1, null, Map.of())));
    }

    @Test
    @DisplayName("年龄条件只在给定参考时间时生效")
    void testMinimumAge() {
        Instant now = Instant.parse("2024-05-10T00:00:00Z");
        ContentFilter filter = ContentFilter.builder().minAgeDays(7).build();
        ContentItem week = ContentItem.builder().id("w").createdAt(now.minus(Duration.ofDays(7))).build();
        ContentItem fresh = ContentItem.builder().id("f").createdAt(now.minus(Duration.ofDays(6))).build();
        ContentItem unknown = ContentItem.builder().id("u").build();

        assertTrue(filter.matches(week, now));
        assertFalse(filter.matches(fresh, now));
        assertFalse(filter.matches(unknown, now));
        assertTrue(filter.matches(fresh));
    }
}
