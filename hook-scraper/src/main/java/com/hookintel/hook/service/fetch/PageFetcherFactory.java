package com.hookintel.hook.service.fetch;

/**
 * Opens a new fetcher session.
 */
@FunctionalInterface
public interface PageFetcherFactory {

    /**
     * @throws FetchException when no session can be opened (browser missing, driver crash)
     */
    PageFetcher open();
}
