// Copyright (c) Keith D Gregory
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.kdgregory.logstream.follow;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Callable;

import com.kdgregory.logstream.common.LogEvent;
import com.kdgregory.logstream.common.util.CancellationToken;
import com.kdgregory.logstream.common.util.InternalLogger;
import com.kdgregory.logstream.facade.CloudWatchLogsFacade;
import com.kdgregory.logstream.facade.EventBatch;
import com.kdgregory.logstream.facade.RawLogEvent;


/**
 *  Follows a single stream, from the configured start time until it is either
 *  cancelled or has failed too many times. Runs as a state machine:
 *  <pre>
 *      CONNECTING -&gt; POLLING &lt;-&gt; BACKOFF -&gt; STOPPED | FAILED
 *  </pre>
 *  Cancellation moves any non-terminal state to <code>STOPPED</code>.
 *  <p>
 *  All state is confined to the thread that calls {@link #call}, with the exception
 *  of {@link #getState}, which may be called from any thread.
 */
public class StreamWorker
implements Callable<StreamOutcome>
{
    public enum State
    {
        CONNECTING,
        POLLING,
        BACKOFF,
        STOPPED,
        FAILED;


        public boolean isTerminal()
        {
            return (this == STOPPED) || (this == FAILED);
        }
    }


    private String streamName;
    private StreamFollowerConfig config;
    private CloudWatchLogsFacade facade;
    private StreamListener listener;
    private CancellationToken token;
    private InternalLogger logger;
    private Clock clock;

    private StreamCursor cursor;
    private ReconnectState reconnect;
    private RecentEventIds recentIds;

    private volatile State state = State.CONNECTING;
    private Throwable failure;
    private long eventCount;
    private int malformedCount;


    public StreamWorker(String streamName, Instant startTime, StreamFollowerConfig config, CloudWatchLogsFacade facade,
                        StreamListener listener, CancellationToken token, InternalLogger logger, Clock clock)
    {
        this.streamName = streamName;
        this.config = config;
        this.facade = facade;
        this.listener = listener;
        this.token = token;
        this.logger = logger;
        this.clock = clock;

        cursor = new StreamCursor(startTime);
        reconnect = new ReconnectState(config.getMaxReconnects(), config.getReconnectDelay());
        recentIds = new RecentEventIds(config.getRecentIdCapacity());
    }


    public String getStreamName()
    {
        return streamName;
    }


    public State getState()
    {
        return state;
    }


    public long getEventCount()
    {
        return eventCount;
    }


    public int getReconnectAttempts()
    {
        return reconnect.getAttempts();
    }


    public Instant getLastTimestamp()
    {
        return cursor.getLastTimestamp();
    }


    /**
     *  Runs the worker until it reaches a terminal state.
     */
    @Override
    public StreamOutcome call()
    {
        logger.debug("following " + streamName + " from " + cursor.getPollFrom());
        listener.onStreamConnect(streamName);
        state = State.POLLING;

        while (! state.isTerminal())
        {
            if (token.isCancelled())
            {
                state = State.STOPPED;
                break;
            }

            switch (state)
            {
                case POLLING:
                    poll();
                    break;
                case BACKOFF:
                    backoff();
                    break;
                default:
                    throw new IllegalStateException("unexpected state for " + streamName + ": " + state);
            }
        }

        if (malformedCount > 0)
        {
            logger.debug(streamName + ": skipped " + malformedCount + " malformed events");
        }
        logger.debug("stopped following " + streamName + ": " + state);

        return new StreamOutcome(
                streamName,
                (state == State.FAILED) ? StreamOutcome.Status.FAILED : StreamOutcome.Status.STOPPED,
                failure,
                eventCount,
                reconnect.getAttempts(),
                cursor.getLastTimestamp());
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    /**
     *  Retrieves and delivers a single batch. On success the worker remains in
     *  <code>POLLING</code> (possibly after an idle wait); on failure it moves to
     *  <code>BACKOFF</code> or <code>FAILED</code>.
     */
    private void poll()
    {
        EventBatch batch;
        try
        {
            batch = facade.pollEvents(
                        config.getLogGroupName(),
                        streamName,
                        cursor.getPollFrom(),
                        config.getFilterPattern(),
                        cursor.getNextToken(),
                        config.getPollPageSize());
            deliver(batch);
        }
        catch (RuntimeException ex)
        {
            handleFailure(new StreamPollException(streamName, ex));
            return;
        }

        if (! batch.isIdle())
        {
            cursor.setNextToken(batch.getNextToken());
            return;
        }

        if (! token.sleep(config.getIdlePollDelay()))
        {
            state = State.STOPPED;
            return;
        }

        cursor.rewind(clock.instant().minus(config.getIdleLookback()));
    }


    private void deliver(EventBatch batch)
    {
        for (RawLogEvent raw : batch.getEvents())
        {
            if (! raw.isWellFormed())
            {
                malformedCount++;
                continue;
            }

            if (recentIds.contains(raw.getEventId()))
                continue;

            // an ID is recorded only once the listener has accepted the event
            LogEvent event = raw.toLogEvent(streamName);
            listener.onEvent(event, streamName);
            recentIds.add(raw.getEventId());
            eventCount++;
            cursor.advance(event.getTimestamp());
        }
    }


    private void handleFailure(StreamPollException ex)
    {
        int attempts = reconnect.recordFailure();
        cursor.setNextToken(null);

        logger.warn(ex.getMessage() + " (attempt " + attempts + " of " + (reconnect.getMaxAttempts() + 1) + ")");
        listener.onStreamDisconnect(streamName, describe(ex.getCause()));

        if (reconnect.isExhausted())
        {
            StreamFatalException fatal = new StreamFatalException(streamName, attempts, ex.getCause());
            logger.error(fatal.getMessage(), ex.getCause());
            failure = fatal;
            state = State.FAILED;
            listener.onError(fatal, streamName);
            return;
        }

        listener.onReconnect(streamName, attempts);
        state = State.BACKOFF;
    }


    /**
     *  Returns the exception's message, or its class name if it doesn't have one.
     */
    private static String describe(Throwable ex)
    {
        String message = ex.getMessage();
        return ((message != null) && ! message.isEmpty())
             ? message
             : ex.getClass().getName();
    }


    private void backoff()
    {
        if (token.sleep(reconnect.currentDelay()))
            state = State.POLLING;
        else
            state = State.STOPPED;
    }
}
