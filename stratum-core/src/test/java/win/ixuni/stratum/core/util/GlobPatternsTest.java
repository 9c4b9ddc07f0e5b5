package win.ixuni.stratum.core.util;

import org.junit.jupiter.api.Test;
import win.ixuni.stratum.core.model.GeoLocation;

import static org.junit.jupiter.api.Assertions.*;

class GlobPatternsTest {

    @Test
    void testWildcards() {
        assertTrue(GlobPatterns.matches("*.jpg", "photo.jpg"));
        assertFalse(GlobPatterns.matches("*.jpg", "photo.jpeg"));
        assertTrue(GlobPatterns.matches("img_??.png", "img_01.png"));
        assertFalse(GlobPatterns.matches("img_??.png", "img_001.png"));
    }

    @Test
    void testRegexCharactersAreLiteral() {
        assertTrue(GlobPatterns.matches("report(1).*", "report(1).pdf"));
        assertFalse(GlobPatterns.matches("a+b*", "aab"));
    }

    @Test
    void testSubstringWithoutWildcard() {
        assertTrue(GlobPatterns.matches("backup", "db-backup-2024.tar"));
        assertFalse(GlobPatterns.matches("backup", "db-2024.tar"));
        assertFalse(GlobPatterns.matches("backup", null));
    }

    @Test
    void testHaversine() {
        GeoLocation london = GeoLocation.of(51.5074, -0.1278);
        GeoLocation paris = GeoLocation.of(48.8566, 2.3522);

        double km = GeoDistance.haversineKm(london, paris);
        assertEquals(343.5, km, 2.0);
        assertEquals(0.0, GeoDistance.haversineKm(paris, paris), 1e-9);
    }
}
