package com.ledger.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * A non-fatal problem encountered during a run, e.g. a pattern rule that failed
 * for one account while the others completed.
 */
@Value
@Builder
public class DetectionDiagnostic {

    String source;
    String glAccount;
    String message;
}
