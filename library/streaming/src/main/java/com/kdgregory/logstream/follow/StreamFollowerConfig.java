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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;


/**
 *  Configuration for {@link StreamFollower}. Only the log group name is required.
 */
public class StreamFollowerConfig
{
    public final static Duration        DEFAULT_START_OFFSET        = Duration.ofMinutes(5);
    public final static int             DEFAULT_MAX_RECONNECTS      = 5;
    public final static Duration        DEFAULT_RECONNECT_DELAY     = Duration.ofMillis(1000);
    public final static int             DEFAULT_DISCOVERY_PAGE_SIZE = 50;
    public final static int             DEFAULT_POLL_PAGE_SIZE      = 100;
    public final static Duration        DEFAULT_IDLE_POLL_DELAY     = Duration.ofSeconds(2);
    public final static Duration        DEFAULT_IDLE_LOOKBACK       = Duration.ofSeconds(10);
    public final static int             DEFAULT_RECENT_ID_CAPACITY  = 10000;

    // these limits are imposed by the service
    public final static int             MAX_DISCOVERY_PAGE_SIZE     = 50;
    public final static int             MAX_POLL_PAGE_SIZE          = 10000;


    private String                      logGroupName;
    private String                      streamPattern;
    private boolean                     useRegex;
    private String                      filterPattern;
    private Instant                     startTime;
    private int                         maxReconnects               = DEFAULT_MAX_RECONNECTS;
    private Duration                    reconnectDelay              = DEFAULT_RECONNECT_DELAY;
    private int                         discoveryPageSize           = DEFAULT_DISCOVERY_PAGE_SIZE;
    private int                         pollPageSize                = DEFAULT_POLL_PAGE_SIZE;
    private Duration                    idlePollDelay               = DEFAULT_IDLE_POLL_DELAY;
    private Duration                    idleLookback                = DEFAULT_IDLE_LOOKBACK;
    private int                         recentIdCapacity            = DEFAULT_RECENT_ID_CAPACITY;


    public String getLogGroupName()
    {
        return logGroupName;
    }

    public StreamFollowerConfig setLogGroupName(String value)
    {
        logGroupName = value;
        return this;
    }


    /**
     *  Selects the streams to follow. Interpreted as a glob unless
     *  {@link #setUseRegex} is true. If not set, all discovered streams
     *  are followed.
     */
    public String getStreamPattern()
    {
        return streamPattern;
    }

    public StreamFollowerConfig setStreamPattern(String value)
    {
        streamPattern = value;
        return this;
    }


    public boolean getUseRegex()
    {
        return useRegex;
    }

    public StreamFollowerConfig setUseRegex(boolean value)
    {
        useRegex = value;
        return this;
    }


    /**
     *  A CloudWatch filter pattern that is passed to the service with each poll.
     */
    public String getFilterPattern()
    {
        return filterPattern;
    }

    public StreamFollowerConfig setFilterPattern(String value)
    {
        filterPattern = value;
        return this;
    }


    /**
     *  The earliest event to retrieve. If null, the follower starts five minutes
     *  before it is invoked.
     */
    public Instant getStartTime()
    {
        return startTime;
    }

    public StreamFollowerConfig setStartTime(Instant value)
    {
        startTime = value;
        return this;
    }


    /**
     *  The number of failed polls that a stream may have before it's abandoned.
     */
    public int getMaxReconnects()
    {
        return maxReconnects;
    }

    public StreamFollowerConfig setMaxReconnects(int value)
    {
        maxReconnects = value;
        return this;
    }


    /**
     *  The base delay for exponential backoff after a failed poll.
     */
    public Duration getReconnectDelay()
    {
        return reconnectDelay;
    }

    public StreamFollowerConfig setReconnectDelay(Duration value)
    {
        reconnectDelay = value;
        return this;
    }


    public int getDiscoveryPageSize()
    {
        return discoveryPageSize;
    }

    public StreamFollowerConfig setDiscoveryPageSize(int value)
    {
        discoveryPageSize = value;
        return this;
    }


    public int getPollPageSize()
    {
        return pollPageSize;
    }

    public StreamFollowerConfig setPollPageSize(int value)
    {
        pollPageSize = value;
        return this;
    }


    /**
     *  The time to wait after a poll that returns nothing.
     */
    public Duration getIdlePollDelay()
    {
        return idlePollDelay;
    }

    public StreamFollowerConfig setIdlePollDelay(Duration value)
    {
        idlePollDelay = value;
        return this;
    }


    /**
     *  After an idle poll, the next poll starts this far before the current time.
     */
    public Duration getIdleLookback()
    {
        return idleLookback;
    }

    public StreamFollowerConfig setIdleLookback(Duration value)
    {
        idleLookback = value;
        return this;
    }


    /**
     *  The number of event IDs that each stream remembers to suppress duplicates.
     */
    public int getRecentIdCapacity()
    {
        return recentIdCapacity;
    }

    public StreamFollowerConfig setRecentIdCapacity(int value)
    {
        recentIdCapacity = value;
        return this;
    }


    /**
     *  Validates the configuration, returning a list of any validation errors.
     *  An empty list indicates a valid config.
     */
    public List<String> validate()
    {
        List<String> result = new ArrayList<>();

        if (logGroupName == null)
        {
            result.add("missing log group name");
        }
        else if (logGroupName.isEmpty())
        {
            result.add("blank log group name");
        }

        if (maxReconnects < 0)
        {
            result.add("max reconnects may not be negative: " + maxReconnects);
        }

        validateDuration(result, "reconnect delay", reconnectDelay);
        validateDuration(result, "idle poll delay", idlePollDelay);
        validateDuration(result, "idle lookback", idleLookback);

        if ((discoveryPageSize < 1) || (discoveryPageSize > MAX_DISCOVERY_PAGE_SIZE))
        {
            result.add("discovery page size must be between 1 and " + MAX_DISCOVERY_PAGE_SIZE + ", was " + discoveryPageSize);
        }

        if ((pollPageSize < 1) || (pollPageSize > MAX_POLL_PAGE_SIZE))
        {
            result.add("poll page size must be between 1 and " + MAX_POLL_PAGE_SIZE + ", was " + pollPageSize);
        }

        if (recentIdCapacity < 1)
        {
            result.add("recent ID capacity must be > 0, was " + recentIdCapacity);
        }

        return result;
    }


    private static void validateDuration(List<String> result, String name, Duration value)
    {
        if (value == null)
            result.add("missing " + name);
        else if (value.isNegative())
            result.add(name + " may not be negative: " + value);
    }
}
