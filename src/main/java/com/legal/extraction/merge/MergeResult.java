package com.legal.extraction.merge;

import com.legal.extraction.core.model.MergedRecord;

import java.util.List;

/**
 * Output of {@link ResultMerger#merge}: every record of the document in creation order,
 * plus what happened to the input candidates.
 */
public record MergeResult(List<MergedRecord> records, MergeStats stats, List<DroppedCandidate> dropped) {

    public MergeResult {
        records = List.copyOf(records);
        dropped = List.copyOf(dropped);
    }

    public record DroppedCandidate(String candidateId, String reason) {
    }
}
