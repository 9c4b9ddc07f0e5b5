package win.ixuni.stratum.server.routing;

import org.junit.jupiter.api.Test;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.core.model.GeoLocation;

import static org.junit.jupiter.api.Assertions.*;

class RegionCatalogTest {

    private static StratumProperties.RegionDefinition region(double latitude, double longitude) {
        StratumProperties.RegionDefinition definition = new StratumProperties.RegionDefinition();
        definition.setLatitude(latitude);
        definition.setLongitude(longitude);
        return definition;
    }

    @Test
    void testBuiltInRegions() {
        RegionCatalog catalog = new RegionCatalog(new StratumProperties());

        assertEquals(10, catalog.getRegions().size());
        assertTrue(catalog.locate("eu-west-1").isPresent());
        assertTrue(catalog.locate("moon-1").isEmpty());
        assertTrue(catalog.locate(null).isEmpty());
    }

    @Test
    void testConfiguredRegionsOverrideAndExtend() {
        StratumProperties properties = new StratumProperties();
        properties.getRegions().put("eu-west-1", region(51.5, -0.12));
        properties.getRegions().put("on-prem", region(48.85, 2.35));
        properties.getRegions().put("broken", region(120.0, 0.0));

        RegionCatalog catalog = new RegionCatalog(properties);

        assertEquals(GeoLocation.of(51.5, -0.12), catalog.locate("eu-west-1").orElseThrow());
        assertEquals(GeoLocation.of(48.85, 2.35), catalog.locate("on-prem").orElseThrow());
        assertTrue(catalog.locate("broken").isEmpty());
        assertEquals(11, catalog.getRegions().size());
    }
}
