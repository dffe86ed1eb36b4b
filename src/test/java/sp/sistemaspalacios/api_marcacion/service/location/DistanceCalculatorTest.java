package sp.sistemaspalacios.api_marcacion.service.location;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.api_marcacion.dto.location.Coordinate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Distance Calculator Tests")
class DistanceCalculatorTest {

    private static final double EARTH_RADIUS = DistanceCalculator.EARTH_RADIUS_METERS;

    private final DistanceCalculator calculator = new DistanceCalculator();

    @Test
    void should_ReturnZero_When_CoordinatesAreIdentical() {
        Coordinate lima = Coordinate.of(-12.0464, -77.0428);

        assertEquals(0.0, calculator.distanceMeters(lima, lima), 0.0);
    }

    @Test
    void should_MatchArcLength_When_OneDegreeAlongMeridian() {
        double expected = EARTH_RADIUS * Math.PI / 180.0; // 111 194.93 m

        double distance = calculator.distanceMeters(Coordinate.of(0.0, 0.0), Coordinate.of(1.0, 0.0));

        assertEquals(expected, distance, 1.0);
    }

    @Test
    void should_MatchQuarterCircumference_When_NinetyDegreesAlongEquator() {
        double distance = calculator.distanceMeters(Coordinate.of(0.0, 0.0), Coordinate.of(0.0, 90.0));

        assertEquals(EARTH_RADIUS * Math.PI / 2.0, distance, 1.0);
    }

    @Test
    void should_ReturnHalfCircumference_When_PointsAreAntipodal() {
        double distance = calculator.distanceMeters(Coordinate.of(0.0, 0.0), Coordinate.of(0.0, 180.0));

        assertFalse(Double.isNaN(distance));
        assertEquals(EARTH_RADIUS * Math.PI, distance, 1.0);
    }

    @Test
    void should_BeSymmetric() {
        Coordinate lima = Coordinate.of(-12.0464, -77.0428);
        Coordinate cusco = Coordinate.of(-13.5320, -71.9675);

        assertEquals(calculator.distanceMeters(lima, cusco), calculator.distanceMeters(cusco, lima), 1e-6);
    }
}
