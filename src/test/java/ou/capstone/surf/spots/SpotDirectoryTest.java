package ou.capstone.surf.spots;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ou.capstone.surf.geo.Coordinate;

public class SpotDirectoryTest {

    @Test
    void loadsBundledSpotsAndFindsKnownIds() {
        SpotDirectory dir = SpotDirectory.loadDefault();

        assertEquals(10, dir.size());
        assertEquals("half-moon-bay", dir.all().get(0).id(), "file order is kept");
        assertTrue(dir.findById("Ocean-Beach-SF").isPresent(), "lookup ignores case");
        assertTrue(dir.findById("pipeline").isEmpty());

        LocationProfile bolinas = dir.findById("bolinas").orElseThrow();
        assertEquals(TidePreference.ANY, bolinas.bestTide());
        assertEquals(List.of(250.0, 270.0, 290.0), bolinas.optimalSwellDirections());
        assertEquals(45.0, bolinas.offshoreWindDirection(), 1e-9);
        assertEquals("9415020", bolinas.tideStation());
        assertEquals("Marin", bolinas.region());
        assertTrue(bolinas.hazards().contains("Rocky bottom"));
    }

    @Test
    void badTableEntriesAreConfigurationErrors() throws Exception {
        final ObjectMapper mapper = new ObjectMapper();
        final String spot = "{\"id\": \"x\", \"coordinates\": {\"lat\": %s, \"lng\": -122.5},"
                + " \"optimalSwellDirections\": [270], \"offshoreWindDirection\": 90, \"bestTide\": \"%s\"}";

        final JsonNode good = mapper.readTree(String.format(spot, "37.7", "low"));
        assertEquals(TidePreference.LOW, SpotDirectory.parseSpot(good).bestTide());

        final JsonNode badTide = mapper.readTree(String.format(spot, "37.7", "sideways"));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> SpotDirectory.parseSpot(badTide));
        assertTrue(e.getMessage().contains("spot x"));

        final JsonNode badLat = mapper.readTree(String.format(spot, "137.7", "low"));
        assertThrows(IllegalStateException.class, () -> SpotDirectory.parseSpot(badLat));
    }

    @Test
    void rejectsDuplicateIds() {
        LocationProfile a = LocationProfile.of("dup", new Coordinate(37.0, -122.0), List.of(270.0), 90.0, TidePreference.MID);
        LocationProfile b = LocationProfile.of("dup", new Coordinate(38.0, -123.0), List.of(280.0), 45.0, TidePreference.LOW);

        assertThrows(IllegalArgumentException.class, () -> new SpotDirectory(List.of(a, b)));
    }

    @Test
    void locationRequiresSwellBearingsInRange() {
        Coordinate c = new Coordinate(37.0, -122.0);
        assertThrows(IllegalArgumentException.class,
                () -> LocationProfile.of("x", c, List.of(), 90.0, TidePreference.MID));
        assertThrows(IllegalArgumentException.class,
                () -> LocationProfile.of("x", c, List.of(400.0), 90.0, TidePreference.MID));
        assertThrows(IllegalArgumentException.class,
                () -> LocationProfile.of("x", c, List.of(270.0), -5.0, TidePreference.MID));
    }
}
