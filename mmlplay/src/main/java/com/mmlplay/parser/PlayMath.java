package com.mmlplay.parser;

/**
 * Pitch and duration formulas. Equal temperament anchored at pitch index 49
 * (concert A, 440 Hz). Rounding is {@link Math#round(double)} applied once on
 * the final value.
 */
public final class PlayMath {

    /** Pitch index used for rests. */
    public static final int PAUSE = 0;
    /** Lowest pitch index that produces a tone; anything below is silent. */
    public static final int LOWEST_AUDIBLE = 6;
    public static final int CONCERT_A_INDEX = 49;
    public static final double CONCERT_A_HZ = 440.0;

    private PlayMath() {
    }

    public static boolean isAudible(int pitchIndex) {
        return pitchIndex >= LOWEST_AUDIBLE;
    }

    public static int frequencyHz(int pitchIndex) {
        return (int) Math.round(Math.pow(2.0, (pitchIndex - (double) CONCERT_A_INDEX) / 12.0) * CONCERT_A_HZ);
    }

    /**
     * @param tempo         quarter notes per minute
     * @param noteLength    denominator of a whole note (4 = quarter)
     * @param dotMultiplier 1.0, 1.5 or 1.75
     * @param articulation  separation style
     * @return duration in milliseconds
     */
    public static int durationMs(int tempo, int noteLength, double dotMultiplier, Articulation articulation) {
        double value = (60.0 / tempo) * 1000.0; // ms per quarter note
        value *= 4.0 / noteLength;
        value *= dotMultiplier;
        value *= articulation.getModifier();
        return (int) Math.round(value);
    }

    /** Multiplier for 0, 1 or 2 trailing dots. */
    public static double dotMultiplier(int dotCount) {
        switch (dotCount) {
            case 0:
                return 1.0;
            case 1:
                return 1.5;
            case 2:
                return 1.75;
            default:
                throw new IllegalArgumentException("dotCount must be 0..2: " + dotCount);
        }
    }
}
