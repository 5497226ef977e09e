package com.legal.extraction.extract;

import com.legal.extraction.core.model.Candidate;

import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Finite, lazily computed sequence of candidates. Every call to {@link #iterator()} starts
 * a fresh scan, so the sequence can be consumed any number of times with identical results.
 */
public final class CandidateSequence implements Iterable<Candidate> {

    private final Supplier<Iterator<Candidate>> source;

    CandidateSequence(Supplier<Iterator<Candidate>> source) {
        this.source = source;
    }

    public static CandidateSequence empty() {
        return new CandidateSequence(() -> List.<Candidate>of().iterator());
    }

    @Override
    public Iterator<Candidate> iterator() {
        return source.get();
    }

    public Stream<Candidate> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public List<Candidate> toList() {
        return stream().toList();
    }
}
