package win.ixuni.stratum.server.routing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.core.model.GeoLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Region catalog
 * <p>
 * Resolves the region id reported in backend metrics to coordinates. Configured regions are merged over
 * the built-in table.
 */
@Slf4j
@Component
public class RegionCatalog {

    private static final Map<String, GeoLocation> DEFAULT_REGIONS;

    static {
        Map<String, GeoLocation> regions = new LinkedHashMap<>();
        regions.put("us-east-1", GeoLocation.of(38.13, -78.45));
        regions.put("us-east-2", GeoLocation.of(40.42, -83.78));
        regions.put("us-west-1", GeoLocation.of(37.78, -122.42));
        regions.put("us-west-2", GeoLocation.of(45.84, -119.68));
        regions.put("eu-west-1", GeoLocation.of(53.34, -6.27));
        regions.put("eu-central-1", GeoLocation.of(50.11, 8.68));
        regions.put("ap-northeast-1", GeoLocation.of(35.69, 139.69));
        regions.put("ap-southeast-1", GeoLocation.of(1.35, 103.82));
        regions.put("ap-southeast-2", GeoLocation.of(-33.87, 151.21));
        regions.put("sa-east-1", GeoLocation.of(-23.55, -46.63));
        DEFAULT_REGIONS = Collections.unmodifiableMap(regions);
    }

    private final Map<String, GeoLocation> regions;

    public RegionCatalog(StratumProperties properties) {
        Map<String, GeoLocation> merged = new LinkedHashMap<>(DEFAULT_REGIONS);
        properties.getRegions().forEach((id, def) -> {
            GeoLocation location = GeoLocation.of(def.getLatitude(), def.getLongitude());
            if (!location.isValid()) {
                log.warn("Ignoring region '{}' with out-of-range coordinates {}", id, location);
                return;
            }
            merged.put(id, location);
        });
        this.regions = Collections.unmodifiableMap(merged);
    }

    public Optional<GeoLocation> locate(String region) {
        return region != null ? Optional.ofNullable(regions.get(region)) : Optional.empty();
    }

    public Map<String, GeoLocation> getRegions() {
        return regions;
    }
}
