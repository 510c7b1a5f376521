package canopy.core.port.out;

import java.time.LocalDate;

import io.smallrye.mutiny.Uni;

import canopy.core.model.estimate.GeoPoint;
import canopy.core.model.selection.WeatherCondition;

/**
 * Port interface for current weather at a location.
 */
public interface WeatherLookup {

    /**
     * Look up the weather condition.
     *
     * @param location the location
     * @param date     the date of interest
     * @return the condition, {@link WeatherCondition#UNKNOWN} when it cannot be determined
     */
    Uni<WeatherCondition> lookup(GeoPoint location, LocalDate date);
}
