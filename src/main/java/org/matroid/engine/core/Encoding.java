package org.matroid.engine.core;

/**
 * Defining data a matroid is stored as.
 */
public enum Encoding {
    /** Circuits keyed by size. */
    CIRCUITS,
    /** Flats keyed by rank. */
    FLATS,
    /** Inclusion poset of flats; keys come from the poset rank. */
    LATTICE_OF_FLATS;

    /**
     * True for encodings whose defining sets are flats.
     */
    public boolean isFlatBased() {
        return this == FLATS || this == LATTICE_OF_FLATS;
    }
}
