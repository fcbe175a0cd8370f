package com.eidos.core.elevation;

import java.util.Map;
import java.util.Optional;

/**
 * One step of the elevation pipeline. Returns the improved text, or empty when the
 * transform does not apply. Implementations are pure.
 */
@FunctionalInterface
public interface ElevationTransform {

    Optional<String> apply(String text, Map<String, ?> context);
}
