package com.spicenet.core.netlist;

import java.util.Locale;
import java.util.Objects;

/**
 * Device model types understood by the simulator.
 */
public enum ModelType {
    /** Semiconductor resistor model */
    R,
    /** Semiconductor capacitor model */
    C,
    /** Inductor model */
    L,
    /** Voltage controlled switch */
    SW,
    /** Current controlled switch */
    CSW,
    /** Uniform distributed RC model */
    URC,
    /** Lossy transmission line model */
    LTRA,
    /** Diode model */
    D,
    /** NPN BJT model */
    NPN,
    /** PNP BJT model */
    PNP,
    /** N-channel JFET model */
    NJF,
    /** P-channel JFET model */
    PJF,
    /** N-channel MOSFET model */
    NMOS,
    /** P-channel MOSFET model */
    PMOS,
    /** N-channel MESFET model */
    NMF,
    /** P-channel MESFET model */
    PMF;

    /**
     * @param code model type code, any case
     * @return the matching type
     * @throws IllegalArgumentException if the code is unknown
     */
    public static ModelType fromCode(String code) {
        Objects.requireNonNull(code, "code must not be null");
        try {
            return valueOf(code.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown model type: " + code, e);
        }
    }
}
