package com.legal.extraction.core.model;

/**
 * The two kinds of observation the extractors produce.
 */
public enum CandidateKind {
    CITATION,
    DEFINITION
}
