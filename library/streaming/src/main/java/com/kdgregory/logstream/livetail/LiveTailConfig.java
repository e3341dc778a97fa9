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

import java.util.ArrayList;
import java.util.List;

import com.kdgregory.logstream.facade.LiveTailRequest;


/**
 *  Configuration for {@link LiveTailMultiplexer}. At least one log group is
 *  required; the service allows at most ten.
 */
public class LiveTailConfig
{
    public final static int             MAX_LOG_GROUPS              = 10;
    public final static boolean         DEFAULT_VERBOSE             = false;


    private List<String>                logGroupIdentifiers         = new ArrayList<>();
    private List<String>                logStreamNames              = new ArrayList<>();
    private List<String>                logStreamNamePrefixes       = new ArrayList<>();
    private String                      filterPattern;
    private boolean                     verbose                     = DEFAULT_VERBOSE;


    /**
     *  The log groups to tail, as names or ARNs.
     */
    public List<String> getLogGroupIdentifiers()
    {
        return logGroupIdentifiers;
    }

    public LiveTailConfig setLogGroupIdentifiers(List<String> value)
    {
        logGroupIdentifiers = (value == null) ? new ArrayList<>() : new ArrayList<>(value);
        return this;
    }

    public LiveTailConfig addLogGroupIdentifier(String value)
    {
        logGroupIdentifiers.add(value);
        return this;
    }


    public List<String> getLogStreamNames()
    {
        return logStreamNames;
    }

    public LiveTailConfig setLogStreamNames(List<String> value)
    {
        logStreamNames = (value == null) ? new ArrayList<>() : new ArrayList<>(value);
        return this;
    }


    public List<String> getLogStreamNamePrefixes()
    {
        return logStreamNamePrefixes;
    }

    public LiveTailConfig setLogStreamNamePrefixes(List<String> value)
    {
        logStreamNamePrefixes = (value == null) ? new ArrayList<>() : new ArrayList<>(value);
        return this;
    }


    public String getFilterPattern()
    {
        return filterPattern;
    }

    public LiveTailConfig setFilterPattern(String value)
    {
        filterPattern = value;
        return this;
    }


    /**
     *  If true, the listener is told about session start and stop.
     */
    public boolean getVerbose()
    {
        return verbose;
    }

    public LiveTailConfig setVerbose(boolean value)
    {
        verbose = value;
        return this;
    }


    /**
     *  Creates the facade request corresponding to this configuration.
     */
    public LiveTailRequest toRequest()
    {
        return new LiveTailRequest(logGroupIdentifiers, logStreamNames, logStreamNamePrefixes, filterPattern);
    }


    /**
     *  Validates the configuration, returning a list of any validation errors.
     *  An empty list indicates a valid config.
     */
    public List<String> validate()
    {
        List<String> result = new ArrayList<>();

        if (logGroupIdentifiers.isEmpty())
        {
            result.add("at least one log group is required");
        }
        else if (logGroupIdentifiers.size() > MAX_LOG_GROUPS)
        {
            result.add("maximum of " + MAX_LOG_GROUPS + " log groups can be tailed simultaneously");
        }

        if (! logStreamNames.isEmpty() && ! logStreamNamePrefixes.isEmpty())
        {
            result.add("may specify log stream names or prefixes, not both");
        }

        return result;
    }
}
