package com.questrail.empire.directory;

import java.io.IOException;

/**
 * Downloads a server list document.
 */
@FunctionalInterface
public interface ServerListFetcher
{
    /**
     * @return the response body
     * @throws IOException on network failure, timeout or a non-2xx status
     */
    String fetch(String url) throws IOException;
}
