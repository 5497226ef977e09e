package com.legal.extraction.merge;

/**
 * Decides between two existing records that an unparsable candidate matches equally well.
 */
public enum TieBreakPolicy {
    /** The record with more provenance entries wins. */
    MORE_EVIDENCE,
    /** The record with the higher aggregated confidence wins. */
    HIGHER_CONFIDENCE
}
