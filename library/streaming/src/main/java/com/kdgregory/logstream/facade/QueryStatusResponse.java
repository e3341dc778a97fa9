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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.kdgregory.logstream.query.QueryStatistics;
import com.kdgregory.logstream.query.QueryStatus;
import com.kdgregory.logstream.query.ResultField;


/**
 *  The current state of a query, as reported by the service. Rows and statistics
 *  are normally only present once the query is complete.
 */
public class QueryStatusResponse
{
    private QueryStatus status;
    private List<List<ResultField>> rows;
    private QueryStatistics statistics;
    private String encryptionKey;


    public QueryStatusResponse(QueryStatus status, List<List<ResultField>> rows, QueryStatistics statistics, String encryptionKey)
    {
        this.status = status;
        this.rows = new ArrayList<>();
        if (rows != null)
        {
            for (List<ResultField> row : rows)
            {
                this.rows.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        this.rows = Collections.unmodifiableList(this.rows);
        this.statistics = statistics;
        this.encryptionKey = encryptionKey;
    }


    /**
     *  Convenience constructor for a response that has only a status.
     */
    public QueryStatusResponse(QueryStatus status)
    {
        this(status, null, null, null);
    }


    public QueryStatus getStatus()
    {
        return status;
    }


    public List<List<ResultField>> getRows()
    {
        return rows;
    }


    /**
     *  Returns the query statistics, null if the service did not report them.
     */
    public QueryStatistics getStatistics()
    {
        return statistics;
    }


    public String getEncryptionKey()
    {
        return encryptionKey;
    }
}
