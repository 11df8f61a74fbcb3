package com.finforecast.projection;

import java.util.Locale;

public enum Scenario {
    BEAR("bear", 0.02, 12.0),
    BASE("base", 0.05, 15.0),
    BULL("bull", 0.09, 20.0);

    public final String key;
    public final double defaultGrowth;
    public final double defaultPeMultiple;

    Scenario(String key, double defaultGrowth, double defaultPeMultiple) {
        this.key = key;
        this.defaultGrowth = defaultGrowth;
        this.defaultPeMultiple = defaultPeMultiple;
    }

    /**
     * Case-insensitive lookup; {@code null} for an unknown name.
     */
    public static Scenario fromName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Scenario scenario : values()) {
            if (scenario.key.equals(normalized)) {
                return scenario;
            }
        }
        return null;
    }
}
