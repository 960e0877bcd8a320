package org.netpreserve.archivescope.analysis;

import org.netpreserve.archivescope.fetch.FetchedPage;

public interface TextExtractor {
    /**
     * @return the page's visible text with whitespace collapsed
     */
    String text(FetchedPage page);
}
