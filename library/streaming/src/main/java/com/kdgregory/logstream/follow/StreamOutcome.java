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

import java.time.Instant;


/**
 *  Describes how a single stream's worker finished.
 */
public class StreamOutcome
{
    public enum Status
    {
        /** The worker was stopped by cancellation. */
        STOPPED,

        /** The worker gave up on the stream. */
        FAILED
    }


    private String streamName;
    private Status status;
    private Throwable failure;
    private long eventCount;
    private int reconnectAttempts;
    private Instant lastTimestamp;


    public StreamOutcome(String streamName, Status status, Throwable failure, long eventCount, int reconnectAttempts, Instant lastTimestamp)
    {
        this.streamName = streamName;
        this.status = status;
        this.failure = failure;
        this.eventCount = eventCount;
        this.reconnectAttempts = reconnectAttempts;
        this.lastTimestamp = lastTimestamp;
    }


    public String getStreamName()
    {
        return streamName;
    }


    public Status getStatus()
    {
        return status;
    }


    /**
     *  Returns the reason that the worker failed; null if it was stopped.
     */
    public Throwable getFailure()
    {
        return failure;
    }


    /**
     *  Returns the number of events delivered to the listener.
     */
    public long getEventCount()
    {
        return eventCount;
    }


    /**
     *  Returns the number of failed polls.
     */
    public int getReconnectAttempts()
    {
        return reconnectAttempts;
    }


    /**
     *  Returns the latest event timestamp seen by the worker (or the start time,
     *  if it saw none).
     */
    public Instant getLastTimestamp()
    {
        return lastTimestamp;
    }


    @Override
    public String toString()
    {
        return "StreamOutcome[" + streamName + ": " + status + ", " + eventCount + " events, "
             + reconnectAttempts + " reconnects, last " + lastTimestamp + "]";
    }
}
