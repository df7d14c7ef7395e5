package com.makeithappen.backend.daily.generator;

import com.makeithappen.backend.goals.model.FocusArea;

import java.util.List;
import java.util.function.BiFunction;

/**
 * Deterministic next action used whenever text generation is off or unusable.
 * Rotates by day index so consecutive days read differently.
 */
public final class FallbackActions {

    /** Last resort when even a generation job itself blows up. */
    public static final String SAFE_DEFAULT = "Take one small step today.";

    private static final String GENERIC_BASE = "Move this forward with a small concrete step.";

    // (name, base) -> text
    private static final List<BiFunction<String, String, String>> VARIANTS = List.of(
            (name, base) -> "Do a 15–30 min micro-step toward: " + base,
            (name, base) -> "Make it real: produce a tiny deliverable toward: " + base,
            (name, base) -> "Remove one blocker for: " + base + " (list 3 sub-steps, then do the first)",
            (name, base) -> "Ship something small today for: " + base,
            (name, base) -> "Review + adjust: what did you learn about " + name + "? Then choose the next tiny step."
    );

    private FallbackActions() {}

    public static String nextAction(FocusArea area, int dayIndex) {
        String name = area.name();
        String base = !area.weeklyFocus().isBlank() ? area.weeklyFocus()
                : !area.monthlyDirection().isBlank() ? area.monthlyDirection()
                : GENERIC_BASE;

        int i = Math.floorMod(dayIndex, VARIANTS.size());
        return VARIANTS.get(i).apply(name, base);
    }

    public static int variantCount() {
        return VARIANTS.size();
    }
}
