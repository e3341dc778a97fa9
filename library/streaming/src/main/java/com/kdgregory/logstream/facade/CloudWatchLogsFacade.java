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

import java.time.Instant;
import java.util.List;

import com.kdgregory.logstream.common.LogStreamInfo;
import com.kdgregory.logstream.query.QueryParameters;


/**
 *  Exposes the CloudWatch Logs APIs used by the stream follower, live-tail
 *  multiplexer, and query poller.
 *  <p>
 *  Instances are created by {@link FacadeFactory}, and are tied to a single
 *  client configuration. They must be safe for concurrent use, as the stream
 *  follower polls several streams at once.
 *  <p>
 *  All operations may throw {@link CloudWatchLogsFacadeException}. Callers are
 *  expected to catch this exception and take action based on the reason code that
 *  it exposes.
 */
public interface CloudWatchLogsFacade
{
    /**
     *  Lists the streams in a log group, most recent activity first.
     *
     *  @param  logGroupName    The log group to examine.
     *  @param  pageSize        The maximum number of streams to return.
     */
    List<LogStreamInfo> listStreams(String logGroupName, int pageSize);


    /**
     *  Retrieves a page of events from a single stream.
     *
     *  @param  logGroupName    The log group that contains the stream.
     *  @param  logStreamName   The stream to read.
     *  @param  since           Only events at or after this time are returned.
     *  @param  filterPattern   A CloudWatch filter pattern; null to return all events.
     *  @param  nextToken       The continuation token from a previous call; null for
     *                          the first page.
     *  @param  pageSize        The maximum number of events to return.
     */
    EventBatch pollEvents(String logGroupName, String logStreamName, Instant since, String filterPattern, String nextToken, int pageSize);


    /**
     *  Opens a live-tail session. The returned stream must be closed by the caller.
     */
    LiveTailStream openLiveSession(LiveTailRequest request);


    /**
     *  Starts a Logs Insights query, returning its ID.
     */
    String submitQuery(QueryParameters parameters);


    /**
     *  Returns the current status of a query, along with its results if complete.
     */
    QueryStatusResponse getQueryStatus(String queryId);


    /**
     *  Requests that a running query be stopped.
     */
    void cancelQuery(String queryId);


    /**
     *  Shuts down the underlying client(s).
     */
    void shutdown();
}
