package com.eidos.core.elevation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the elevation pipeline over a running result: each transform sees the output of
 * the previous one, and a transform that does not apply leaves the text as it was.
 */
@Component
public class Elevator {

    private final List<ElevationTransform> transforms;

    public Elevator() {
        this(ElevationTransforms.pipeline());
    }

    public Elevator(List<ElevationTransform> transforms) {
        this.transforms = List.copyOf(transforms);
    }

    /** The elevated text, or {@code text} itself when no transform applies. */
    public String elevate(String text, Map<String, ?> context) {
        if (text == null) return "";
        String result = text;
        for (ElevationTransform transform : transforms) {
            Optional<String> elevated = transform.apply(result, context == null ? Map.of() : context);
            if (elevated.isPresent()) {
                result = elevated.get();
            }
        }
        return result;
    }
}
