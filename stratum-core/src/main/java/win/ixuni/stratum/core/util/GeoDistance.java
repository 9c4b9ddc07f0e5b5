package win.ixuni.stratum.core.util;

import win.ixuni.stratum.core.model.GeoLocation;

/**
 * Great-circle distance on a spherical earth
 */
public final class GeoDistance {

    /**
     * Mean earth radius in kilometers
     */
    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {
    }

    /**
     * Haversine distance in kilometers
     */
    public static double haversineKm(GeoLocation from, GeoLocation to) {
        double lat1 = Math.toRadians(from.getLatitude());
        double lat2 = Math.toRadians(to.getLatitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(to.getLongitude() - from.getLongitude());

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }
}
