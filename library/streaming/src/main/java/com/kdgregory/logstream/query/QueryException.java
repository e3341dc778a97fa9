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
 *  Base class for exceptions thrown by {@link QueryPoller}. Thrown directly when
 *  the service calls themselves fail.
 */
public class QueryException
extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private String queryId;


    public QueryException(String message, String queryId, Throwable cause)
    {
        super(message, cause);
        this.queryId = queryId;
    }


    public QueryException(String message, String queryId)
    {
        this(message, queryId, null);
    }


    /**
     *  Returns the ID of the query, null if the failure happened before the
     *  query was started.
     */
    public String getQueryId()
    {
        return queryId;
    }
}
