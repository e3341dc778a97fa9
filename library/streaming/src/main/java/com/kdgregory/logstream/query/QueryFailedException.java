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


/**
 *  Thrown when the service reports that a query failed or was cancelled. The
 *  exception carries the query's parameters, so that the caller can report
 *  exactly what was run.
 */
public class QueryFailedException
extends QueryException
{
    private static final long serialVersionUID = 1L;

    private transient QueryParameters parameters;
    private QueryStatus status;


    public QueryFailedException(String queryId, QueryStatus status, QueryParameters parameters)
    {
        super("query " + status.name().toLowerCase() + ": " + queryId
              + " (" + parameters.getEffectiveLanguage()
              + " on " + parameters.getLogGroupNames()
              + ", " + parameters.getStartTime() + " - " + parameters.getEndTime()
              + "): " + parameters.getQueryString(),
              queryId);
        this.status = status;
        this.parameters = parameters;
    }


    public QueryStatus getStatus()
    {
        return status;
    }


    public QueryParameters getParameters()
    {
        return parameters;
    }
}
