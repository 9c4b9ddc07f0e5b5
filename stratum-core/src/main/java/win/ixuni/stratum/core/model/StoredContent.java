package win.ixuni.stratum.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Content fetched from a backend store, bytes plus metadata
 */
@Value
@Builder
public class StoredContent {

    String id;

    byte[] data;

    String contentType;

    @Builder.Default
    Map<String, String> metadata = Map.of();
}
