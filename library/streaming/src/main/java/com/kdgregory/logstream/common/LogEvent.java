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

package com.kdgregory.logstream.common;

import java.time.Instant;
import java.util.Objects;


/**
 *  A single log event, as delivered to listeners. Instances are created from
 *  well-formed records only (those that have both a timestamp and a message),
 *  and are immutable.
 */
public class LogEvent
{
    private Instant timestamp;
    private String message;
    private String streamName;
    private String eventId;


    /**
     *  Base constructor.
     *
     *  @param  timestamp   The event's timestamp. Must not be null.
     *  @param  message     The event's message. Must not be null.
     *  @param  streamName  The name of the log stream that holds the event. May be null.
     *  @param  eventId     The service-assigned event ID. May be null.
     */
    public LogEvent(Instant timestamp, String message, String streamName, String eventId)
    {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.message = Objects.requireNonNull(message, "message");
        this.streamName = streamName;
        this.eventId = eventId;
    }


    /**
     *  Convenience constructor for events that don't carry a stream name or ID.
     */
    public LogEvent(Instant timestamp, String message)
    {
        this(timestamp, message, null, null);
    }


    public Instant getTimestamp()
    {
        return timestamp;
    }


    public String getMessage()
    {
        return message;
    }


    /**
     *  Returns the name of the stream that contains this event, null if unknown.
     */
    public String getStreamName()
    {
        return streamName;
    }


    /**
     *  Returns the service-assigned ID for this event, null if not provided.
     */
    public String getEventId()
    {
        return eventId;
    }


    @Override
    public boolean equals(Object obj)
    {
        if (obj == this)
            return true;
        if (! (obj instanceof LogEvent))
            return false;

        LogEvent that = (LogEvent)obj;
        return timestamp.equals(that.timestamp)
            && message.equals(that.message)
            && Objects.equals(streamName, that.streamName)
            && Objects.equals(eventId, that.eventId);
    }


    @Override
    public int hashCode()
    {
        return Objects.hash(timestamp, message, streamName, eventId);
    }


    @Override
    public String toString()
    {
        return "LogEvent[" + timestamp + ", " + streamName + ": " + message + "]";
    }
}
