package org.netpreserve.archivescope.fetch;

import java.util.List;
import java.util.Map;

/**
 * Outcome of fetching several URLs. A URL that wasn't captured counts as failed.
 *
 * @param total      URLs requested
 * @param successful URLs fetched
 * @param failed     URLs that couldn't be fetched
 * @param pages      fetched pages keyed by URL in request order
 * @param failures   URLs that couldn't be fetched, in request order
 */
public record BatchFetchResult(int total, int successful, int failed, Map<String, FetchedPage> pages,
                               List<String> failures) {
}
