package com.questrail.empire.protocol.gge.correlation;

import com.questrail.empire.protocol.gge.model.GgeResponse;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * PendingRequests
 * =============================================================================
 * Per-connection list of outstanding correlated calls.
 *
 * <h2>Matching</h2>
 * <ul>
 *   <li>First registered, first tried.</li>
 *   <li>A frame completes at most one request; removal happens under the same
 *       lock as the match so two frames can never fulfil one request and one
 *       frame can never fulfil two.</li>
 *   <li>A frame nobody waits for is dropped. Nothing is buffered for later
 *       registrations.</li>
 * </ul>
 *
 * <p>The list is tiny in practice (a handful of waits per connection), so a
 * linear scan is all it needs.</p>
 */
public final class PendingRequests
{
    private final List<PendingRequest<?>> requests = new ArrayList<>();

    public synchronized void register(PendingRequest<?> request) {
        requests.add(Objects.requireNonNull(request, "request"));
    }

    /**
     * Offer an inbound frame to the registered requests.
     *
     * @return {@code true} if a request took it
     */
    public boolean offer(GgeResponse response) {
        Objects.requireNonNull(response, "response");

        PendingRequest<?> matched = null;
        synchronized (this) {
            Iterator<PendingRequest<?>> it = requests.iterator();
            while (it.hasNext()) {
                PendingRequest<?> candidate = it.next();
                if (candidate.accepts(response)) {
                    it.remove();
                    matched = candidate;
                    break;
                }
            }
        }

        if (matched == null) {
            return false;
        }
        // Waiter wake-up happens outside the list lock.
        matched.complete(response);
        return true;
    }

    /**
     * Remove a request that timed out.
     *
     * @return {@code true} if it was still registered
     */
    public synchronized boolean remove(PendingRequest<?> request) {
        return requests.remove(request);
    }

    public synchronized int size() {
        return requests.size();
    }

    public synchronized void clear() {
        requests.clear();
    }
}
