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

import java.util.List;


/**
 *  The outcome of a completed query.
 */
public class QueryResult
{
    private String queryId;
    private QueryStatus status;
    private List<List<ResultField>> rows;
    private QueryStatistics statistics;
    private String encryptionKey;


    public QueryResult(String queryId, QueryStatus status, List<List<ResultField>> rows,
                       QueryStatistics statistics, String encryptionKey)
    {
        this.queryId = queryId;
        this.status = status;
        this.rows = rows;
        this.statistics = statistics;
        this.encryptionKey = encryptionKey;
    }


    public String getQueryId()
    {
        return queryId;
    }


    public QueryStatus getStatus()
    {
        return status;
    }


    public List<List<ResultField>> getRows()
    {
        return rows;
    }


    public QueryStatistics getStatistics()
    {
        return statistics;
    }


    public String getEncryptionKey()
    {
        return encryptionKey;
    }
}
