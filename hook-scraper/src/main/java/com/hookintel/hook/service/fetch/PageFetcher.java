package com.hookintel.hook.service.fetch;

import com.hookintel.hook.model.RawPost;

import java.util.List;

/**
 * One browser session able to read a profile's posts. Each scrape worker owns one
 * fetcher for its lifetime and closes it when done.
 */
public interface PageFetcher extends AutoCloseable {

    /**
     * @param profileId normalised handle
     * @param limit     maximum number of posts to return
     * @return posts in the order the profile page lists them
     * @throws FetchException on navigation or network failure
     */
    List<RawPost> fetchPosts(String profileId, int limit);

    @Override
    void close();
}
