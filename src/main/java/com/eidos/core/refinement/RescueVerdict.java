package com.eidos.core.refinement;

/**
 * JSON answer expected from the archive rescue area.
 */
public record RescueVerdict(boolean rescue, String reason, String rewrite) {
}
