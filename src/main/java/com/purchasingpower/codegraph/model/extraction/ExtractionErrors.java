package com.purchasingpower.codegraph.model.extraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Thread-safe sink for soft errors. One instance per run, passed to the
 * components that can fail softly and merged by the pipeline.
 */
public class ExtractionErrors {

    private final ConcurrentLinkedQueue<ParseError> errors = new ConcurrentLinkedQueue<>();

    public void record(String path, String message) {
        errors.add(new ParseError(path, message));
    }

    public void record(ParseError error) {
        errors.add(error);
    }

    public ExtractionErrors merge(ExtractionErrors other) {
        errors.addAll(other.errors);
        return this;
    }

    public int size() {
        return errors.size();
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    /**
     * Snapshot ordered by path so reports are stable across runs.
     */
    public List<ParseError> asList() {
        List<ParseError> snapshot = new ArrayList<>(errors);
        snapshot.sort(Comparator.comparing(ParseError::path).thenComparing(ParseError::message));
        return snapshot;
    }
}
