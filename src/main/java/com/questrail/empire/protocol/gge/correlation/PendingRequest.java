package com.questrail.empire.protocol.gge.correlation;

import com.questrail.empire.protocol.gge.internal.sync.WaitableFlag;
import com.questrail.empire.protocol.gge.model.DelimitedResponse;
import com.questrail.empire.protocol.gge.model.GgeResponse;
import com.questrail.empire.protocol.gge.model.XmlResponse;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * PendingRequest
 * =============================================================================
 * One outstanding correlated call.
 *
 * <p>A pending request only ever looks at frames of its own kind. Completion is
 * written once by {@link PendingRequests#offer(GgeResponse)} and then signalled
 * through the {@link WaitableFlag} the caller is blocked on.</p>
 *
 * @param <R> the response kind this request waits for
 */
public final class PendingRequest<R extends GgeResponse>
{
    private final Class<R> responseType;
    private final Predicate<R> predicate;
    private final String description;
    private final WaitableFlag done = new WaitableFlag();

    private volatile R response;

    private PendingRequest(Class<R> responseType, Predicate<R> predicate, String description) {
        this.responseType = Objects.requireNonNull(responseType, "responseType");
        this.predicate = Objects.requireNonNull(predicate, "predicate");
        this.description = Objects.requireNonNull(description, "description");
    }

    /**
     * Wait for a delimited frame with the given command whose payload satisfies
     * {@code spec}.
     */
    public static PendingRequest<DelimitedResponse> delimited(String command, MatchSpec spec) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(spec, "spec");
        return new PendingRequest<>(
                DelimitedResponse.class,
                r -> r.command().equals(command) && spec.matches(r.payload()),
                "%" + command + " " + spec);
    }

    /**
     * Wait for an XML frame with exactly this tag, action and room.
     */
    public static PendingRequest<XmlResponse> xml(String tag, String action, String room) {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(room, "room");
        return new PendingRequest<>(
                XmlResponse.class,
                r -> r.tag().equals(tag) && r.action().equals(action) && r.room().equals(room),
                "<" + tag + " action=" + action + " r=" + room + ">");
    }

    boolean accepts(GgeResponse candidate) {
        return responseType.isInstance(candidate) && predicate.test(responseType.cast(candidate));
    }

    void complete(GgeResponse matched) {
        this.response = responseType.cast(matched);
        done.set();
    }

    public WaitableFlag done() {
        return done;
    }

    /**
     * @return the matched response, or {@code null} while still pending
     */
    public R response() {
        return response;
    }

    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return "PendingRequest[" + description + "]";
    }
}
