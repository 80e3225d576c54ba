package org.skirmish.runtime.model;

import java.util.List;

/**
 * Cosmetic identity of a faction. Carries no rules.
 */
public record FactionTheme(String name, String description, String colorScheme, List<String> architecturalStyle) {

    public FactionTheme {
        architecturalStyle = architecturalStyle == null ? List.of() : List.copyOf(architecturalStyle);
    }

    public static FactionTheme of(String name) {
        return new FactionTheme(name, "", "", List.of());
    }
}
