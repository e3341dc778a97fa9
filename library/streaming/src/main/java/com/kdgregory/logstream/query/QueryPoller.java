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

import java.time.Clock;
import java.util.List;

import com.kdgregory.logstream.common.util.CancellationToken;
import com.kdgregory.logstream.common.util.InternalLogger;
import com.kdgregory.logstream.facade.CloudWatchLogsFacade;
import com.kdgregory.logstream.facade.QueryStatusResponse;


/**
 *  Runs a Logs Insights query: submits it, then checks its status at a fixed
 *  interval until it reaches a terminal status or the poller runs out of
 *  attempts.
 *  <p>
 *  The poller runs on the caller's thread. It does not retry failed service
 *  calls; any such failure ends the query with a {@link QueryException}.
 *  <p>
 *  Instances are stateless (apart from configuration) and may be reused for
 *  multiple queries, including concurrently.
 */
public class QueryPoller
{
    private final static QueryProgressListener NO_LISTENER = new QueryProgressListener() { /* defaults */ };

    private CloudWatchLogsFacade facade;
    private QueryPollerConfig config;
    private InternalLogger logger;
    private Clock clock;


    /**
     *  @throws IllegalArgumentException if the configuration is invalid.
     */
    public QueryPoller(CloudWatchLogsFacade facade, QueryPollerConfig config, InternalLogger logger, Clock clock)
    {
        List<String> errors = config.validate();
        if (! errors.isEmpty())
            throw new IllegalArgumentException("invalid configuration: " + errors);

        this.facade = facade;
        this.config = config;
        this.logger = logger;
        this.clock = clock;
    }


    public QueryPoller(CloudWatchLogsFacade facade, QueryPollerConfig config, InternalLogger logger)
    {
        this(facade, config, logger, Clock.systemUTC());
    }


    /**
     *  Executes a query, blocking until it completes.
     *
     *  @param  parameters  Identifies the query.
     *  @param  listener    Receives progress notifications; may be null.
     *  @param  token       Allows the caller to abandon the query while waiting.
     *
     *  @return The query's results.
     *
     *  @throws IllegalArgumentException if the parameters are invalid; in this case
     *          no service call has been made.
     *  @throws QueryFailedException if the service reports that the query failed or
     *          was cancelled.
     *  @throws QueryTimeoutException if the query did not complete in the configured
     *          number of attempts.
     *  @throws QueryCancelledException if the token was cancelled.
     *  @throws QueryException if any service call failed.
     */
    public QueryResult execute(QueryParameters parameters, QueryProgressListener listener, CancellationToken token)
    {
        List<String> errors = parameters.validate();
        if (! errors.isEmpty())
            throw new IllegalArgumentException("invalid query parameters: " + errors);

        if (listener == null)
            listener = NO_LISTENER;

        QueryJob job = new QueryJob(submit(parameters), clock.instant());
        logger.debug("started query " + job.getQueryId() + ": " + parameters);
        listener.onQueryStarted(job);

        int maxAttempts = config.getMaxPollAttempts();
        for (int attempt = 1 ; attempt <= maxAttempts ; attempt++)
        {
            if (! token.sleep(config.getPollInterval()))
            {
                cancelQuietly(job);
                throw new QueryCancelledException(job.getQueryId());
            }

            QueryStatusResponse response = retrieveStatus(job.getQueryId());
            switch (response.getStatus())
            {
                case RUNNING:
                    listener.onQueryProgress(job, attempt, maxAttempts);
                    break;
                case COMPLETE:
                    job.transitionTo(QueryStatus.COMPLETE);
                    QueryResult result = new QueryResult(
                            job.getQueryId(),
                            QueryStatus.COMPLETE,
                            response.getRows(),
                            response.getStatistics(),
                            response.getEncryptionKey());
                    logger.debug("query " + job.getQueryId() + " complete: " + result.getRows().size() + " rows");
                    listener.onQueryComplete(job, result);
                    return result;
                default:
                    job.transitionTo(response.getStatus());
                    throw new QueryFailedException(job.getQueryId(), response.getStatus(), parameters);
            }
        }

        logger.warn("query " + job.getQueryId() + " did not complete after " + maxAttempts + " status checks; cancelling");
        cancelQuietly(job);
        throw new QueryTimeoutException(job.getQueryId(), maxAttempts);
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    private String submit(QueryParameters parameters)
    {
        try
        {
            return facade.submitQuery(parameters);
        }
        catch (RuntimeException ex)
        {
            throw new QueryException("failed to execute query: " + ex.getMessage(), null, ex);
        }
    }


    private QueryStatusResponse retrieveStatus(String queryId)
    {
        try
        {
            return facade.getQueryStatus(queryId);
        }
        catch (RuntimeException ex)
        {
            throw new QueryException("failed to execute query: " + ex.getMessage(), queryId, ex);
        }
    }


    /**
     *  Attempts to stop the query on the service side, and marks the job as
     *  cancelled. A failure to stop is logged and otherwise ignored.
     */
    private void cancelQuietly(QueryJob job)
    {
        try
        {
            facade.cancelQuery(job.getQueryId());
        }
        catch (RuntimeException ex)
        {
            logger.warn("unable to cancel query " + job.getQueryId() + ": " + ex.getMessage());
        }
        job.transitionTo(QueryStatus.CANCELLED);
    }
}
