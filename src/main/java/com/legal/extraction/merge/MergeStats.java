package com.legal.extraction.merge;

/**
 * Counters for one merge call.
 *
 * @param received     candidates passed in
 * @param created      new records
 * @param merged       candidates appended to an already existing record (exact or approximate)
 * @param fuzzyMatched candidates attached through approximate matching
 * @param skipped      candidates already present in the record set
 * @param dropped      malformed candidates
 * @param conflicts    definition bodies that disagreed with the record's current body
 */
public record MergeStats(int received, int created, int merged, int fuzzyMatched, int skipped,
                         int dropped, int conflicts) {
}
