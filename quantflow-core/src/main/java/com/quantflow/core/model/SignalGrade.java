package com.quantflow.core.model;

/**
 * Coarse grading of signal strength.
 * STRONG at 0.6 and above, NORMAL from 0.3, WEAK below.
 */
public enum SignalGrade {
    STRONG,
    NORMAL,
    WEAK;

    public static SignalGrade of(double strength) {
        if (strength >= 0.6) {
            return STRONG;
        }
        if (strength >= 0.3) {
            return NORMAL;
        }
        return WEAK;
    }
}
