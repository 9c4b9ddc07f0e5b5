package win.ixuni.stratum.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Geographic coordinates in decimal degrees
 */
@Value
@Builder
@Jacksonized
public class GeoLocation {

    double latitude;

    double longitude;

    public static GeoLocation of(double latitude, double longitude) {
        return new GeoLocation(latitude, longitude);
    }

    public boolean isValid() {
        return latitude >= -90 && latitude <= 90 && longitude >= -180 && longitude <= 180;
    }
}
