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

package com.kdgregory.logstream.facade;

import java.time.Instant;

import com.kdgregory.logstream.common.LogEvent;


/**
 *  A log record as returned by the service. Any field may be null; only records
 *  that have both a timestamp and a message are converted to {@link LogEvent}.
 */
public class RawLogEvent
{
    private Long timestamp;
    private String message;
    private String streamName;
    private String eventId;


    /**
     *  @param  timestamp   Milliseconds since epoch.
     */
    public RawLogEvent(Long timestamp, String message, String streamName, String eventId)
    {
        this.timestamp = timestamp;
        this.message = message;
        this.streamName = streamName;
        this.eventId = eventId;
    }


    public Long getTimestamp()
    {
        return timestamp;
    }


    public String getMessage()
    {
        return message;
    }


    public String getStreamName()
    {
        return streamName;
    }


    public String getEventId()
    {
        return eventId;
    }


    /**
     *  Returns <code>true</code> if this record has the fields needed to become
     *  a <code>LogEvent</code>. An empty message is valid; a missing one is not.
     */
    public boolean isWellFormed()
    {
        return (timestamp != null) && (message != null);
    }


    /**
     *  Converts this record to a <code>LogEvent</code>, using the provided stream
     *  name if the record doesn't have one.
     *
     *  @throws IllegalStateException if the record is not well-formed.
     */
    public LogEvent toLogEvent(String defaultStreamName)
    {
        if (! isWellFormed())
            throw new IllegalStateException("malformed event: timestamp " + timestamp + ", message " + message);

        return new LogEvent(
                Instant.ofEpochMilli(timestamp),
                message,
                (streamName != null) ? streamName : defaultStreamName,
                eventId);
    }
}
