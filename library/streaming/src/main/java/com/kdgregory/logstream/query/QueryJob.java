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


/**
 *  Tracks a single submitted query. The status only moves forward: from
 *  <code>RUNNING</code> to exactly one terminal status.
 *  <p>
 *  Instances are updated by the poller thread, but may be read from a progress
 *  listener on any thread.
 */
public class QueryJob
{
    private String queryId;
    private Instant startedAt;
    private volatile QueryStatus status = QueryStatus.RUNNING;


    public QueryJob(String queryId, Instant startedAt)
    {
        this.queryId = queryId;
        this.startedAt = startedAt;
    }


    public String getQueryId()
    {
        return queryId;
    }


    public Instant getStartedAt()
    {
        return startedAt;
    }


    public QueryStatus getStatus()
    {
        return status;
    }


    /**
     *  Updates the status. Setting the current status again is allowed.
     *
     *  @throws IllegalStateException if the job is already in a different
     *          terminal status, or the new status is <code>RUNNING</code>
     *          after a terminal status.
     */
    public synchronized void transitionTo(QueryStatus newStatus)
    {
        if (newStatus == status)
            return;

        if (status.isTerminal())
            throw new IllegalStateException("query " + queryId + " is " + status + "; can not change to " + newStatus);

        status = newStatus;
    }


    @Override
    public String toString()
    {
        return "QueryJob[" + queryId + ", " + status + "]";
    }
}
