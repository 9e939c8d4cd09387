package com.ledger.anomaly.datasource;

import com.ledger.anomaly.model.GLFilter;
import com.ledger.anomaly.model.LineItem;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Supplies posted line items from the source accounting system. This is the only I/O
 * boundary of a detection run; the full matching set is returned in one call.
 */
public interface GLDataSource {

    CompletableFuture<List<LineItem>> getGLLineItems(GLFilter filter);
}
