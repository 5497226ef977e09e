package com.legal.extraction.extract;

/**
 * States of the citation scanner. A citation is emitted on leaving
 * {@link #SAW_NUMBER}, {@link #SAW_YEAR} or {@link #CLOSING}.
 */
enum ScanState {
    IDLE,
    SAW_TYPE_KEYWORD,
    SAW_NUMBER,
    SAW_YEAR,
    CLOSING
}
