package org.netpreserve.archivescope.analysis;

import org.netpreserve.archivescope.fetch.FetchedPage;

import java.util.List;

/**
 * Identifies the software a page was built with. Implementations must be side-effect-free
 * and safe to call from several threads.
 */
public interface TechnologyDetector {
    /**
     * @return detected technologies, each at most once
     */
    List<Technology> detect(FetchedPage page);
}
