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

package com.kdgregory.logstream.facade.v2;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import software.amazon.awssdk.services.cloudwatchlogs.model.LiveTailSessionLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.LiveTailSessionStart;
import software.amazon.awssdk.services.cloudwatchlogs.model.LiveTailSessionUpdate;
import software.amazon.awssdk.services.cloudwatchlogs.model.StartLiveTailResponseStream;

import com.kdgregory.logstream.common.util.InternalLogger;
import com.kdgregory.logstream.facade.LiveTailStream;
import com.kdgregory.logstream.facade.RawLogEvent;
import com.kdgregory.logstream.facade.SessionChunk;


/**
 *  Adapts the SDK's push-style live-tail response handler to the pull-style
 *  {@link LiveTailStream}. The SDK's event thread calls {@link #publish},
 *  {@link #complete}, and {@link #fail}; the consumer iterates.
 *  <p>
 *  Chunks are held in a bounded queue. If the consumer stops taking them, the
 *  SDK thread waits up to the configured publish timeout and then fails the
 *  session.
 */
public class LiveTailStreamImpl
implements LiveTailStream
{
    public final static int DEFAULT_QUEUE_CAPACITY      = 1000;
    public final static long DEFAULT_PUBLISH_TIMEOUT    = 30000;

    private final static Object END = new Object();
    private final static long POLL_INTERVAL = 100;

    private InternalLogger logger;
    private Function<Throwable,RuntimeException> exceptionTranslator;
    private long publishTimeout;
    private BlockingQueue<Object> queue;

    private volatile boolean closed;
    private volatile boolean producerDone;
    private volatile CompletableFuture<Void> future;

    // only touched by the consuming thread
    private Object pending;
    private boolean finished;


    /**
     *  @param  logger              Used to report discarded or unrecognized events.
     *  @param  exceptionTranslator Converts SDK failures to the exception thrown
     *                              by the iterator.
     *  @param  queueCapacity       Maximum number of chunks held for the consumer.
     *  @param  publishTimeout      Milliseconds that the producer waits for space
     *                              in the queue before failing the session.
     */
    public LiveTailStreamImpl(InternalLogger logger, Function<Throwable,RuntimeException> exceptionTranslator,
                              int queueCapacity, long publishTimeout)
    {
        this.logger = logger;
        this.exceptionTranslator = exceptionTranslator;
        this.publishTimeout = publishTimeout;
        this.queue = new LinkedBlockingQueue<>(queueCapacity);
    }


    public LiveTailStreamImpl(InternalLogger logger, Function<Throwable,RuntimeException> exceptionTranslator)
    {
        this(logger, exceptionTranslator, DEFAULT_QUEUE_CAPACITY, DEFAULT_PUBLISH_TIMEOUT);
    }

//----------------------------------------------------------------------------
//  Producer side
//----------------------------------------------------------------------------

    /**
     *  Associates the SDK's completion future with this stream, so that closing
     *  the stream cancels the session.
     */
    public void setFuture(CompletableFuture<Void> value)
    {
        future = value;
        if (closed)
            value.cancel(true);
    }


    /**
     *  Converts an SDK event and queues it for the consumer.
     */
    public void publish(StartLiveTailResponseStream event)
    {
        if (closed || producerDone)
            return;

        SessionChunk chunk = convert(event);
        if (chunk == null)
            return;

        try
        {
            if (queue.offer(chunk, publishTimeout, TimeUnit.MILLISECONDS))
                return;

            fail(new IllegalStateException("live tail consumer not keeping up; waited " + publishTimeout + " ms"));
        }
        catch (InterruptedException ex)
        {
            Thread.currentThread().interrupt();
            fail(ex);
        }
        CompletableFuture<Void> f = future;
        if (f != null)
            f.cancel(true);
    }


    /**
     *  Called when the service ends the event stream normally.
     */
    public void complete()
    {
        complete(null);
    }


    /**
     *  Ends the session with an explicit reason.
     */
    public void complete(String reason)
    {
        terminate(SessionChunk.sessionStop(reason));
    }


    /**
     *  Called when the event stream fails. The translated exception is thrown to
     *  the consumer after any chunks that are already queued.
     */
    public void fail(Throwable cause)
    {
        terminate(exceptionTranslator.apply(cause));
    }

//----------------------------------------------------------------------------
//  Consumer side
//----------------------------------------------------------------------------

    @Override
    public boolean hasNext()
    {
        if (pending != null)
            return true;

        while (! closed && ! finished)
        {
            Object item;
            try
            {
                item = queue.poll(POLL_INTERVAL, TimeUnit.MILLISECONDS);
            }
            catch (InterruptedException ex)
            {
                Thread.currentThread().interrupt();
                close();
                return false;
            }

            if (item == null)
                continue;

            if (item == END)
            {
                finished = true;
                return false;
            }

            if (item instanceof RuntimeException)
            {
                finished = true;
                throw (RuntimeException)item;
            }

            // nothing follows a stop, even if the end marker didn't fit in the queue
            if (((SessionChunk)item).getType() == SessionChunk.Type.SESSION_STOP)
                finished = true;

            pending = item;
            return true;
        }

        return false;
    }


    @Override
    public SessionChunk next()
    {
        if (! hasNext())
            throw new NoSuchElementException();

        SessionChunk chunk = (SessionChunk)pending;
        pending = null;
        return chunk;
    }


    @Override
    public void close()
    {
        if (closed)
            return;

        closed = true;
        CompletableFuture<Void> f = future;
        if (f != null)
            f.cancel(true);

        queue.clear();
        queue.offer(END);
    }


    public boolean isClosed()
    {
        return closed;
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    private SessionChunk convert(StartLiveTailResponseStream event)
    {
        if (event instanceof LiveTailSessionStart)
        {
            LiveTailSessionStart start = (LiveTailSessionStart)event;
            return SessionChunk.sessionStart(start.sessionId(), start.logGroupIdentifiers(), start.logEventFilterPattern());
        }

        if (event instanceof LiveTailSessionUpdate)
        {
            LiveTailSessionUpdate update = (LiveTailSessionUpdate)event;
            List<RawLogEvent> events = new ArrayList<>();
            for (LiveTailSessionLogEvent result : update.sessionResults())
            {
                events.add(new RawLogEvent(result.timestamp(), result.message(), result.logStreamName(), null));
            }
            return SessionChunk.sessionUpdate(events);
        }

        logger.debug("ignoring unrecognized live tail event: " + event);
        return null;
    }


    /**
     *  Queues the final item. If the queue is full, queued chunks are discarded
     *  so that the consumer sees the end of the session.
     */
    private void terminate(Object item)
    {
        if (closed || producerDone)
            return;

        producerDone = true;
        if (! queue.offer(item))
        {
            logger.warn("live tail queue full at end of session; discarding " + queue.size() + " chunks");
            queue.clear();
            queue.offer(item);
        }
        queue.offer(END);
    }
}
