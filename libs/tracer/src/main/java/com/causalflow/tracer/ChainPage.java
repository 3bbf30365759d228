package com.causalflow.tracer;

import com.causalflow.tracemodel.TraceChain;
import java.util.List;

/**
 * One page of stored chains, newest first.
 *
 * @param chains      chains on this page
 * @param page        zero-based page index
 * @param size        requested page size
 * @param totalChains chains stored at the time of the query
 */
public record ChainPage(List<TraceChain> chains, int page, int size, int totalChains) {

    public ChainPage {
        chains = List.copyOf(chains);
    }

    /** Number of pages needed for {@code totalChains}. */
    public int totalPages() {
        return (totalChains + size - 1) / size;
    }

    public boolean hasNext() {
        return page + 1 < totalPages();
    }
}
