package win.ixuni.stratum.backend.local;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Sidecar metadata file structure
 * <p>
 * The filesystem has no native metadata storage, so every content file gets a JSON sidecar:
 *
 * <pre>
 *   basePath/
 *     stratum/
 *       data/          ← 实际内容数据
 *         contentId
 *       meta/          ← 元数据（sidecar 文件）
 *         contentId.stratum.meta
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SidecarMetadata {

    public static final String STRATUM_ROOT = "stratum";

    public static final String DATA_DIR = "data";

    public static final String META_DIR = "meta";

    public static final String SIDECAR_SUFFIX = ".stratum.meta";

    private String contentType;

    /**
     * Metadata supplied when the content was added
     */
    private Map<String, String> metadata;

    private Long size;

    /**
     * Creation time (epoch milliseconds)
     */
    private Long createdAt;

    @JsonIgnore
    public Instant getCreatedAtInstant() {
        return createdAt != null ? Instant.ofEpochMilli(createdAt) : null;
    }
}
