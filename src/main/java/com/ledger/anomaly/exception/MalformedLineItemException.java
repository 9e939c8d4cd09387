package com.ledger.anomaly.exception;

import java.util.List;

/**
 * Raised when fetched line items lack fields the detectors depend on.
 */
public class MalformedLineItemException extends RuntimeException {

    private final List<String> problems;

    public MalformedLineItemException(List<String> problems) {
        super("Malformed line items (" + problems.size() + "): " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
