package com.mmlplay.parser;

/** Note separation style selected by {@code MS}, {@code MN} and {@code ML}. */
public enum Articulation {
    STACCATO(3.0 / 4.0),
    NORMAL(7.0 / 8.0),
    LEGATO(1.0);

    private final double modifier;

    Articulation(double modifier) {
        this.modifier = modifier;
    }

    /** Fraction of the nominal note duration that is actually sounded. */
    public double getModifier() {
        return modifier;
    }
}
