package com.questrail.dtnclient.client;

import com.questrail.dtnclient.observability.DtnClientObservabilitySink;
import com.questrail.dtnclient.observability.DtnErrorEvent;
import com.questrail.dtnclient.observability.DtnReplyEvent;
import com.questrail.dtnclient.observability.DtnRequestEvent;
import com.questrail.dtnclient.protocol.codec.MessageCodec;
import com.questrail.dtnclient.protocol.model.DtnMessage;
import com.questrail.dtnclient.protocol.model.DtnResponse;
import com.questrail.dtnclient.transport.Connection;
import com.questrail.dtnclient.transport.ConnectionFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;

/**
 * FramedCall
 * =============================================================================
 * One-shot request/reply exchange with dtnd.
 *
 * <h2>Exchange</h2>
 * <pre>
 *   ConnectionFactory.open()
 *        → MessageCodec.encode(request)
 *            → LengthPrefixFraming.writeFrame
 *                → LengthPrefixFraming.readFrame
 *                    → MessageCodec.decode
 *                        → DtnResponse (error field checked)
 * </pre>
 *
 * <p>Each call moves strictly through request-sent, reply-received and done.
 * The connection is opened for the call and closed on every exit path,
 * including decode failures. There is no pipelining, no keep-alive and no
 * retry.</p>
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>{@link com.questrail.dtnclient.transport.DaemonNotFoundException}:
 *       daemon endpoint unreachable</li>
 *   <li>{@link DataException}: framing inconsistency, non-response reply,
 *       or unexpected reply variant</li>
 *   <li>{@link DtndException}: dtnd reported an error</li>
 *   <li>{@link com.questrail.dtnclient.protocol.model.InvalidMessageException}:
 *       reply could not be decoded</li>
 *   <li>{@link IOException}: any other transport failure, including an
 *       expired deadline</li>
 * </ul>
 * All of them are reported to the observability sink and then propagate
 * unchanged.
 */
public final class FramedCall
{
    private final MessageCodec codec;
    private final DtnClientObservabilitySink observability;
    private final Clock clock;

    public FramedCall(MessageCodec codec, DtnClientObservabilitySink observability) {
        this(codec, observability, Clock.systemUTC());
    }

    public FramedCall(MessageCodec codec, DtnClientObservabilitySink observability, Clock clock) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.observability = Objects.requireNonNull(observability, "observability");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Sends {@code message} over a new connection and returns dtnd's reply.
     *
     * @return the decoded reply; its error field is always empty
     * @throws DtndException if the reply carries an error
     */
    public DtnResponse call(ConnectionFactory connectionFactory, DtnMessage message) throws IOException {
        Objects.requireNonNull(connectionFactory, "connectionFactory");
        Objects.requireNonNull(message, "message");

        try (Connection connection = connectionFactory.open()) {
            byte[] request = codec.encode(message);
            observability.onRequestSent(new DtnRequestEvent(clock.instant(), message, request.length));
            LengthPrefixFraming.writeFrame(connection, request);

            byte[] replyBytes = LengthPrefixFraming.readFrame(connection);
            DtnMessage reply = codec.decode(replyBytes);
            observability.onReplyReceived(new DtnReplyEvent(clock.instant(), reply, replyBytes.length));

            if (!(reply instanceof DtnResponse response)) {
                throw new DataException(
                        "Received response is not a response message - message type: " + reply.type());
            }
            if (response.isError()) {
                throw new DtndException(response.error());
            }
            return response;
        }
        catch (IOException | RuntimeException e) {
            observability.onError(new DtnErrorEvent(clock.instant(), describe(message, e), e));
            throw e;
        }
    }

    /**
     * Like {@link #call(ConnectionFactory, DtnMessage)}, additionally requiring
     * the reply to be of the variant the operation expects.
     *
     * @throws DataException if dtnd answered with a different variant
     */
    public <R extends DtnResponse> R call(ConnectionFactory connectionFactory,
                                          DtnMessage message,
                                          Class<R> expected) throws IOException
    {
        Objects.requireNonNull(expected, "expected");
        DtnResponse response = call(connectionFactory, message);
        if (!expected.isInstance(response)) {
            DataException e = new DataException("response should have been "
                    + expected.getSimpleName() + ", was " + response.getClass().getSimpleName());
            observability.onError(new DtnErrorEvent(clock.instant(), describe(message, e), e));
            throw e;
        }
        return expected.cast(response);
    }

    private static String describe(DtnMessage message, Exception e) {
        return message.type() + " call failed: " + e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
