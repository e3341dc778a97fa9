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

package com.kdgregory.logstream.query;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;


/**
 *  Configuration for {@link QueryPoller}. The defaults allow a query to run for
 *  ten minutes before the poller gives up on it.
 */
public class QueryPollerConfig
{
    public final static Duration        DEFAULT_POLL_INTERVAL       = Duration.ofSeconds(5);
    public final static int             DEFAULT_MAX_POLL_ATTEMPTS   = 120;


    private Duration                    pollInterval                = DEFAULT_POLL_INTERVAL;
    private int                         maxPollAttempts             = DEFAULT_MAX_POLL_ATTEMPTS;


    /**
     *  The time to wait before each status check.
     */
    public Duration getPollInterval()
    {
        return pollInterval;
    }

    public QueryPollerConfig setPollInterval(Duration value)
    {
        pollInterval = value;
        return this;
    }


    /**
     *  The number of status checks before the query is cancelled.
     */
    public int getMaxPollAttempts()
    {
        return maxPollAttempts;
    }

    public QueryPollerConfig setMaxPollAttempts(int value)
    {
        maxPollAttempts = value;
        return this;
    }


    /**
     *  Validates the configuration, returning a list of any validation errors.
     *  An empty list indicates a valid config.
     */
    public List<String> validate()
    {
        List<String> result = new ArrayList<>();

        if (pollInterval == null)
        {
            result.add("missing poll interval");
        }
        else if (pollInterval.isNegative())
        {
            result.add("poll interval may not be negative: " + pollInterval);
        }

        if (maxPollAttempts < 1)
        {
            result.add("max poll attempts must be > 0, was " + maxPollAttempts);
        }

        return result;
    }
}
