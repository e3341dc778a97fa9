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

package com.kdgregory.logstream.livetail;

import java.time.Clock;
import java.util.List;

import com.kdgregory.logstream.common.util.CancellationToken;
import com.kdgregory.logstream.common.util.InternalLogger;
import com.kdgregory.logstream.facade.CloudWatchLogsFacade;
import com.kdgregory.logstream.facade.LiveTailStream;
import com.kdgregory.logstream.facade.RawLogEvent;
import com.kdgregory.logstream.facade.SessionChunk;


/**
 *  Runs a live-tail session: opens it, then reads the session's chunks and
 *  dispatches them to a listener until the service stops the session, the
 *  session fails, or the caller cancels.
 *  <p>
 *  Events from all of the session's log groups arrive on a single connection,
 *  in the order that the service sends them. Processing is synchronous, on the
 *  calling thread.
 */
public class LiveTailMultiplexer
{
    private CloudWatchLogsFacade facade;
    private LiveTailConfig config;
    private InternalLogger logger;
    private Clock clock;


    /**
     *  @throws IllegalArgumentException if the configuration is invalid.
     */
    public LiveTailMultiplexer(CloudWatchLogsFacade facade, LiveTailConfig config, InternalLogger logger, Clock clock)
    {
        List<String> errors = config.validate();
        if (! errors.isEmpty())
            throw new IllegalArgumentException("invalid configuration: " + errors);

        this.facade = facade;
        this.config = config;
        this.logger = logger;
        this.clock = clock;
    }


    public LiveTailMultiplexer(CloudWatchLogsFacade facade, LiveTailConfig config, InternalLogger logger)
    {
        this(facade, config, logger, Clock.systemUTC());
    }


    /**
     *  Opens a session and processes it until it ends.
     *
     *  @return The number of events delivered to the listener.
     *
     *  @throws LiveTailException if the session could not be opened. The
     *          listener's <code>onError()</code> has been called, but not
     *          its <code>onClose()</code>.
     */
    public long tail(LiveTailListener listener, CancellationToken token)
    {
        LiveTailStream stream;
        try
        {
            stream = facade.openLiveSession(config.toRequest());
        }
        catch (RuntimeException ex)
        {
            LiveTailException wrapped = new LiveTailException("failed to start live tail session: " + ex.getMessage(), ex);
            logger.error(wrapped.getMessage(), ex);
            listener.onError(wrapped);
            throw wrapped;
        }

        return process(stream, listener, token);
    }


    /**
     *  Processes an open session until it ends. The stream is closed, and the
     *  listener's <code>onClose()</code> called, regardless of how this method
     *  exits.
     *
     *  @return The number of events delivered to the listener.
     *
     *  @throws RuntimeException any exception thrown while reading the stream or
     *          by the listener, after it has been reported to the listener's
     *          <code>onError()</code>.
     */
    public long process(LiveTailStream stream, LiveTailListener listener, CancellationToken token)
    {
        Runnable closer = stream::close;
        token.onCancel(closer);

        LiveTailSession session = null;
        long eventCount = 0;
        int malformedCount = 0;
        try
        {
            while (! token.isCancelled() && stream.hasNext())
            {
                SessionChunk chunk = stream.next();
                switch (chunk.getType())
                {
                    case SESSION_START:
                        session = new LiveTailSession(chunk.getSessionId(), chunk.getLogGroupIdentifiers(), chunk.getFilterPattern(), clock.instant());
                        logger.debug("live tail session started: " + session);
                        if (config.getVerbose())
                            listener.onSessionStart(session);
                        break;
                    case SESSION_UPDATE:
                        for (RawLogEvent raw : chunk.getEvents())
                        {
                            if (raw.isWellFormed())
                            {
                                listener.onEvent(raw.toLogEvent(null));
                                eventCount++;
                            }
                            else
                            {
                                malformedCount++;
                                logger.debug("skipped malformed live tail event from " + raw.getStreamName());
                            }
                        }
                        break;
                    case SESSION_STOP:
                        logger.debug("live tail session stopped: " + chunk.getStopReason());
                        if (config.getVerbose())
                            listener.onSessionStop(session, chunk.getStopReason());
                        return eventCount;
                    default:
                        throw new IllegalStateException("unexpected chunk type: " + chunk.getType());
                }
            }
            return eventCount;
        }
        catch (RuntimeException ex)
        {
            if (token.isCancelled())
            {
                // closing the stream may cause the reader to fail
                logger.debug("live tail session ended by cancellation: " + ex.getMessage());
                return eventCount;
            }

            logger.error("live tail session failed", ex);
            listener.onError(ex);
            throw ex;
        }
        finally
        {
            token.removeOnCancel(closer);
            stream.close();
            if (malformedCount > 0)
                logger.debug("skipped " + malformedCount + " malformed live tail events");
            listener.onClose();
        }
    }
}
