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
 *  Receives progress notifications from {@link QueryPoller}. All methods are
 *  called on the thread that invoked the poller. Default implementations do
 *  nothing.
 */
public interface QueryProgressListener
{
    /**
     *  Called once the query has been submitted.
     */
    default void onQueryStarted(QueryJob job)
    {
        // no-op
    }


    /**
     *  Called after each status check that finds the query still running.
     *
     *  @param  attempt     The number of status checks so far (1-based).
     *  @param  maxAttempts The number of checks before the poller gives up.
     */
    default void onQueryProgress(QueryJob job, int attempt, int maxAttempts)
    {
        // no-op
    }


    /**
     *  Called when the query has completed successfully.
     */
    default void onQueryComplete(QueryJob job, QueryResult result)
    {
        // no-op
    }
}
