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


/**
 *  Describes a log stream, as returned by discovery. Only the name is guaranteed
 *  to be present; the other fields are null if the service didn't report them
 *  (for example, a stream that has never received an event has no last-event
 *  timestamp).
 */
public class LogStreamInfo
{
    private String name;
    private Instant lastEventTimestamp;
    private Instant creationTime;
    private String arn;


    public LogStreamInfo(String name, Instant lastEventTimestamp, Instant creationTime, String arn)
    {
        this.name = name;
        this.lastEventTimestamp = lastEventTimestamp;
        this.creationTime = creationTime;
        this.arn = arn;
    }


    public LogStreamInfo(String name, Instant lastEventTimestamp)
    {
        this(name, lastEventTimestamp, null, null);
    }


    public String getName()
    {
        return name;
    }


    public Instant getLastEventTimestamp()
    {
        return lastEventTimestamp;
    }


    public Instant getCreationTime()
    {
        return creationTime;
    }


    public String getArn()
    {
        return arn;
    }


    @Override
    public String toString()
    {
        return "LogStreamInfo[" + name + ", last event " + lastEventTimestamp + "]";
    }
}
