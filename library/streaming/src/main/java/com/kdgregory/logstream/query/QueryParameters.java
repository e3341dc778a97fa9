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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 *  Describes a Logs Insights query: the log groups it searches, the query text,
 *  and the time window. Limit and language are optional.
 */
public class QueryParameters
{
    public final static int MAX_LIMIT = 10000;

    private List<String> logGroupNames;
    private String queryString;
    private Instant startTime;
    private Instant endTime;
    private Integer limit;
    private QueryLanguage queryLanguage;


    public QueryParameters(List<String> logGroupNames, String queryString, Instant startTime, Instant endTime,
                           Integer limit, QueryLanguage queryLanguage)
    {
        this.logGroupNames = (logGroupNames == null)
                           ? Collections.emptyList()
                           : Collections.unmodifiableList(new ArrayList<>(logGroupNames));
        this.queryString = queryString;
        this.startTime = startTime;
        this.endTime = endTime;
        this.limit = limit;
        this.queryLanguage = queryLanguage;
    }


    /**
     *  Convenience constructor for a query without limit, using the default language.
     */
    public QueryParameters(List<String> logGroupNames, String queryString, Instant startTime, Instant endTime)
    {
        this(logGroupNames, queryString, startTime, endTime, null, null);
    }


    public List<String> getLogGroupNames()
    {
        return logGroupNames;
    }


    public String getQueryString()
    {
        return queryString;
    }


    public Instant getStartTime()
    {
        return startTime;
    }


    public Instant getEndTime()
    {
        return endTime;
    }


    /**
     *  Returns the maximum number of rows to return, null to use the service default.
     */
    public Integer getLimit()
    {
        return limit;
    }


    /**
     *  Returns the query language, null if the service default (CWLI) should be used.
     */
    public QueryLanguage getQueryLanguage()
    {
        return queryLanguage;
    }


    /**
     *  Returns the effective query language.
     */
    public QueryLanguage getEffectiveLanguage()
    {
        return (queryLanguage != null) ? queryLanguage : QueryLanguage.CWLI;
    }


    /**
     *  Validates the parameters, returning a list of any validation errors.
     *  An empty list indicates valid parameters.
     */
    public List<String> validate()
    {
        List<String> result = new ArrayList<>();

        if (logGroupNames.isEmpty())
        {
            result.add("at least one log group is required");
        }
        for (String name : logGroupNames)
        {
            if ((name == null) || name.trim().isEmpty())
            {
                result.add("log group names may not be blank");
                break;
            }
        }

        if ((queryString == null) || queryString.trim().isEmpty())
        {
            result.add("query string is required");
        }

        if (startTime == null)
        {
            result.add("start time is required");
        }
        if (endTime == null)
        {
            result.add("end time is required");
        }
        if ((startTime != null) && (endTime != null) && startTime.isAfter(endTime))
        {
            result.add("start time (" + startTime + ") is after end time (" + endTime + ")");
        }

        if ((limit != null) && ((limit < 1) || (limit > MAX_LIMIT)))
        {
            result.add("limit must be between 1 and " + MAX_LIMIT + ", was " + limit);
        }

        return result;
    }


    @Override
    public String toString()
    {
        return "QueryParameters[groups " + logGroupNames
             + ", window " + startTime + " - " + endTime
             + ", language " + getEffectiveLanguage()
             + ", query \"" + queryString + "\"]";
    }
}
