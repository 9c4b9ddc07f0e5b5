package win.ixuni.stratum.server.routing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.stratum.core.model.ContentCategory;
import win.ixuni.stratum.core.model.ContentDescriptor;
import win.ixuni.stratum.core.model.ContentMetadata;
import win.ixuni.stratum.core.util.ContentHashes;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Content analyzer
 * <p>
 * Classifies content from its metadata (and bytes, when available) for rule matching. Never fails:
 * anything it cannot classify is {@link ContentCategory#BINARY}.
 */
@Slf4j
@Component
public class ContentAnalyzer {

    private static final Map<String, String> MIME_BY_EXTENSION = Map.ofEntries(
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("png", "image/png"),
            Map.entry("gif", "image/gif"),
            Map.entry("webp", "image/webp"),
            Map.entry("bmp", "image/bmp"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("mov", "video/quicktime"),
            Map.entry("avi", "video/x-msvideo"),
            Map.entry("mkv", "video/x-matroska"),
            Map.entry("webm", "video/webm"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("wav", "audio/wav"),
            Map.entry("flac", "audio/flac"),
            Map.entry("ogg", "audio/ogg"),
            Map.entry("pdf", "application/pdf"),
            Map.entry("doc", "application/msword"),
            Map.entry("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
            Map.entry("xls", "application/vnd.ms-excel"),
            Map.entry("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
            Map.entry("ppt", "application/vnd.ms-powerpoint"),
            Map.entry("pptx", "application/vnd.openxmlformats-officedocument.presentationml.presentation"),
            Map.entry("txt", "text/plain"),
            Map.entry("csv", "text/csv"),
            Map.entry("md", "text/markdown"),
            Map.entry("html", "text/html"),
            Map.entry("xml", "text/xml"),
            Map.entry("json", "application/json"),
            Map.entry("zip", "application/zip"),
            Map.entry("tar", "application/x-tar"),
            Map.entry("gz", "application/gzip"),
            Map.entry("tgz", "application/gzip"),
            Map.entry("7z", "application/x-7z-compressed"),
            Map.entry("rar", "application/vnd.rar"));

    /**
     * Archive subtypes under application/
     */
    private static final Set<String> ARCHIVE_SUBTYPES = Set.of(
            "zip", "x-zip-compressed", "x-tar", "gzip", "x-gzip", "x-bzip2", "x-xz",
            "x-7z-compressed", "vnd.rar", "x-rar-compressed");

    /**
     * Analyze content
     *
     * @param content  content bytes, may be null or a sample
     * @param metadata caller metadata ({@code content_type}, {@code filename}, {@code size}, ...)
     * @return content descriptor
     */
    public ContentDescriptor analyze(byte[] content, Map<String, String> metadata) {
        Map<String, String> meta = metadata != null ? metadata : Map.of();
        String filename = meta.get(ContentMetadata.FILENAME);

        String mimeType = meta.get(ContentMetadata.CONTENT_TYPE);
        if (mimeType == null || mimeType.isBlank()) {
            mimeType = guessMimeType(filename);
        }

        ContentDescriptor descriptor = ContentDescriptor.builder()
                .sizeBytes(resolveSize(content, meta))
                .category(categorize(mimeType))
                .mimeType(mimeType)
                .filename(filename)
                .metadata(meta)
                .contentHash(content != null ? ContentHashes.sha256Hex(content) : null)
                .build();
        log.debug("Analyzed content: category={}, mime={}, size={}",
                descriptor.getCategory(), mimeType, descriptor.getSizeBytes());
        return descriptor;
    }

    /**
     * Map a MIME type to a content category
     */
    public static ContentCategory categorize(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return ContentCategory.BINARY;
        }
        String mime = mimeType.toLowerCase(Locale.ROOT).trim();
        int params = mime.indexOf(';');
        if (params >= 0) {
            mime = mime.substring(0, params).trim();
        }
        if (mime.startsWith("image/")) {
            return ContentCategory.IMAGE;
        }
        if (mime.startsWith("video/")) {
            return ContentCategory.VIDEO;
        }
        if (mime.startsWith("audio/")) {
            return ContentCategory.AUDIO;
        }
        if (mime.startsWith("text/") || mime.equals("application/json") || mime.equals("application/pdf")
                || mime.contains("msword") || mime.contains("officedocument")
                || mime.contains("ms-excel") || mime.contains("ms-powerpoint")) {
            return ContentCategory.DOCUMENT;
        }
        if (mime.startsWith("application/") && ARCHIVE_SUBTYPES.contains(mime.substring("application/".length()))) {
            return ContentCategory.ARCHIVE;
        }
        return ContentCategory.BINARY;
    }

    static String guessMimeType(String filename) {
        if (filename == null) {
            return null;
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return null;
        }
        return MIME_BY_EXTENSION.get(filename.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static long resolveSize(byte[] content, Map<String, String> metadata) {
        String declared = metadata.get(ContentMetadata.SIZE);
        if (declared != null) {
            try {
                long size = Long.parseLong(declared.trim());
                if (size >= 0) {
                    return size;
                }
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric size metadata '{}'", declared);
            }
        }
        return content != null ? content.length : 0;
    }
}
