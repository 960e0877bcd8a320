package org.netpreserve.archivescope.analysis;

import org.netpreserve.archivescope.fetch.FetchedPage;

import java.util.List;

/**
 * Extracts links from a page that stay on the page's own host.
 */
public interface LinkExtractor {
    /**
     * @return absolute URLs without fragments, each at most once, in document order
     */
    List<String> internalLinks(FetchedPage page);
}
