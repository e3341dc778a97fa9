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

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;
import static org.junit.Assert.*;

import software.amazon.awssdk.services.cloudwatchlogs.model.LiveTailSessionLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.LiveTailSessionStart;
import software.amazon.awssdk.services.cloudwatchlogs.model.LiveTailSessionUpdate;

import com.kdgregory.logstream.common.util.Slf4jInternalLogger;
import com.kdgregory.logstream.facade.RawLogEvent;
import com.kdgregory.logstream.facade.SessionChunk;


public class TestLiveTailStreamImpl
{
    private LiveTailStreamImpl stream = new LiveTailStreamImpl(
                                            new Slf4jInternalLogger(TestLiveTailStreamImpl.class),
                                            ex -> new RuntimeException("translated: " + ex.getMessage(), ex));

//----------------------------------------------------------------------------
//  Support Code
//----------------------------------------------------------------------------

    private static LiveTailSessionStart sessionStart()
    {
        return LiveTailSessionStart.builder()
               .sessionId("session-1")
               .logGroupIdentifiers("argle", "bargle")
               .logEventFilterPattern("ERROR")
               .build();
    }


    private static LiveTailSessionUpdate sessionUpdate(String... messages)
    {
        LiveTailSessionLogEvent[] events = new LiveTailSessionLogEvent[messages.length];
        for (int ii = 0 ; ii < messages.length ; ii++)
        {
            events[ii] = LiveTailSessionLogEvent.builder()
                         .timestamp(1000L + ii)
                         .message(messages[ii])
                         .logStreamName("stream-" + ii)
                         .build();
        }
        return LiveTailSessionUpdate.builder().sessionResults(events).build();
    }

//----------------------------------------------------------------------------
//  Testcases
//----------------------------------------------------------------------------

    @Test
    public void testNormalSession() throws Exception
    {
        stream.publish(sessionStart());
        stream.publish(sessionUpdate("first", null));
        stream.complete();

        assertTrue("has start chunk",                                           stream.hasNext());
        SessionChunk start = stream.next();
        assertEquals("start: type",             SessionChunk.Type.SESSION_START, start.getType());
        assertEquals("start: session ID",       "session-1",                    start.getSessionId());
        assertEquals("start: identifiers",      2,                              start.getLogGroupIdentifiers().size());
        assertTrue("start: identifiers",                                        start.getLogGroupIdentifiers().containsAll(Arrays.asList("argle", "bargle")));
        assertEquals("start: filter",           "ERROR",                        start.getFilterPattern());

        assertTrue("has update chunk",                                          stream.hasNext());
        SessionChunk update = stream.next();
        assertEquals("update: type",            SessionChunk.Type.SESSION_UPDATE, update.getType());
        assertEquals("update: event count",     2,                              update.getEvents().size());

        RawLogEvent first = update.getEvents().get(0);
        assertEquals("first event: timestamp",  Long.valueOf(1000),             first.getTimestamp());
        assertEquals("first event: message",    "first",                        first.getMessage());
        assertEquals("first event: stream",     "stream-0",                     first.getStreamName());
        assertNull("first event: no ID",                                        first.getEventId());
        assertFalse("second event is malformed",                                update.getEvents().get(1).isWellFormed());

        assertTrue("has stop chunk",                                            stream.hasNext());
        SessionChunk stop = stream.next();
        assertEquals("stop: type",              SessionChunk.Type.SESSION_STOP, stop.getType());
        assertNull("stop: reason",                                              stop.getStopReason());

        assertFalse("no more chunks",                                           stream.hasNext());
        try
        {
            stream.next();
            fail("next() should have thrown after end of session");
        }
        catch (NoSuchElementException ex)
        {
            // success
        }
    }


    @Test
    public void testFailureAfterEvents() throws Exception
    {
        IllegalStateException cause = new IllegalStateException("connection reset");

        stream.publish(sessionStart());
        stream.fail(cause);

        // these should be ignored
        stream.publish(sessionUpdate("ignored"));
        stream.complete();

        assertEquals("first chunk delivered",   SessionChunk.Type.SESSION_START, stream.next().getType());
        try
        {
            stream.hasNext();
            fail("should have thrown");
        }
        catch (RuntimeException ex)
        {
            assertEquals("exception message",   "translated: connection reset", ex.getMessage());
            assertSame("exception cause",       cause,                          ex.getCause());
        }

        assertFalse("no more chunks after failure",                             stream.hasNext());
    }


    @Test
    public void testCloseUnblocksConsumer() throws Exception
    {
        CompletableFuture<Void> future = new CompletableFuture<>();
        stream.setFuture(future);

        AtomicReference<Boolean> result = new AtomicReference<>();
        Thread consumer = new Thread(() -> result.set(stream.hasNext()));
        consumer.start();

        Thread.sleep(200);
        assertTrue("consumer is blocked",                       consumer.isAlive());

        stream.close();
        consumer.join(1000);

        assertFalse("consumer has exited",                      consumer.isAlive());
        assertEquals("hasNext() result",        Boolean.FALSE,  result.get());
        assertTrue("session cancelled",                         future.isCancelled());
        assertTrue("stream reports closed",                     stream.isClosed());

        // these should be no-ops
        stream.close();
        stream.publish(sessionStart());
        assertFalse("no chunks after close",                    stream.hasNext());
    }


    @Test
    public void testFutureSetAfterClose() throws Exception
    {
        stream.close();

        CompletableFuture<Void> future = new CompletableFuture<>();
        stream.setFuture(future);

        assertTrue("session cancelled",                         future.isCancelled());
    }


    @Test
    public void testSlowConsumer() throws Exception
    {
        stream = new LiveTailStreamImpl(
                    new Slf4jInternalLogger(TestLiveTailStreamImpl.class),
                    ex -> new RuntimeException("translated: " + ex.getMessage(), ex),
                    1, 50);

        CompletableFuture<Void> future = new CompletableFuture<>();
        stream.setFuture(future);

        stream.publish(sessionStart());
        stream.publish(sessionUpdate("overflow"));

        assertTrue("session cancelled",                         future.isCancelled());

        // the queued chunk was discarded to make room for the failure
        try
        {
            stream.hasNext();
            fail("should have thrown");
        }
        catch (RuntimeException ex)
        {
            assertEquals("exception message",
                         "translated: live tail consumer not keeping up; waited 50 ms",
                         ex.getMessage());
        }
    }


    @Test
    public void testCompleteWithReason() throws Exception
    {
        stream.complete("session timed out");

        SessionChunk chunk = stream.next();
        assertEquals("chunk type",              SessionChunk.Type.SESSION_STOP, chunk.getType());
        assertEquals("stop reason",             "session timed out",            chunk.getStopReason());
        assertFalse("no more chunks",                                           stream.hasNext());
    }
}
