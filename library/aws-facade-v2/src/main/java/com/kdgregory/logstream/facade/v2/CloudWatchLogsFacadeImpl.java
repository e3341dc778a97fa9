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

package com.kdgregory.logstream.facade.v2;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsAsyncClient;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.CloudWatchLogsException;
import software.amazon.awssdk.services.cloudwatchlogs.model.DescribeLogStreamsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.DescribeLogStreamsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.FilterLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.FilterLogEventsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.FilteredLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.GetQueryResultsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.GetQueryResultsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.InvalidParameterException;
import software.amazon.awssdk.services.cloudwatchlogs.model.LimitExceededException;
import software.amazon.awssdk.services.cloudwatchlogs.model.LogStream;
import software.amazon.awssdk.services.cloudwatchlogs.model.MalformedQueryException;
import software.amazon.awssdk.services.cloudwatchlogs.model.OperationAbortedException;
import software.amazon.awssdk.services.cloudwatchlogs.model.OrderBy;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceNotFoundException;
import software.amazon.awssdk.services.cloudwatchlogs.model.ServiceUnavailableException;
import software.amazon.awssdk.services.cloudwatchlogs.model.StartLiveTailRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.StartLiveTailResponseHandler;
import software.amazon.awssdk.services.cloudwatchlogs.model.StartQueryRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.StartQueryResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.StopQueryRequest;

import com.kdgregory.logstream.common.LogStreamInfo;
import com.kdgregory.logstream.common.util.BackoffPolicy;
import com.kdgregory.logstream.common.util.InternalLogger;
import com.kdgregory.logstream.common.util.RetryManager;
import com.kdgregory.logstream.common.util.Slf4jInternalLogger;
import com.kdgregory.logstream.facade.ClientConfig;
import com.kdgregory.logstream.facade.CloudWatchLogsFacade;
import com.kdgregory.logstream.facade.CloudWatchLogsFacadeException;
import com.kdgregory.logstream.facade.CloudWatchLogsFacadeException.ReasonCode;
import com.kdgregory.logstream.facade.EventBatch;
import com.kdgregory.logstream.facade.LiveTailRequest;
import com.kdgregory.logstream.facade.LiveTailStream;
import com.kdgregory.logstream.facade.QueryStatusResponse;
import com.kdgregory.logstream.facade.RawLogEvent;
import com.kdgregory.logstream.facade.v2.internal.ClientFactory;
import com.kdgregory.logstream.query.QueryParameters;
import com.kdgregory.logstream.query.QueryStatistics;
import com.kdgregory.logstream.query.QueryStatus;
import com.kdgregory.logstream.query.ResultField;


/**
 *  Provides a facade over the CloudWatch Logs API using the v2 SDK.
 *  <p>
 *  Synchronous calls are retried (three attempts, exponential backoff) when the
 *  service reports a retryable condition. Live tail uses the asynchronous client,
 *  and is not retried.
 */
public class CloudWatchLogsFacadeImpl
implements CloudWatchLogsFacade
{
    public final static int RETRY_ATTEMPTS              = 3;
    public final static Duration RETRY_BASE_DELAY       = Duration.ofMillis(100);

    private final static String SESSION_TIMEOUT_CODE    = "SessionTimeoutException";

    // passed to constructor
    private ClientConfig config;

    // lazily constructed; protected so that they can be set for testing
    protected CloudWatchLogsClient client;
    protected CloudWatchLogsAsyncClient asyncClient;

    // protected so that tests can replace
    protected InternalLogger logger = new Slf4jInternalLogger(CloudWatchLogsFacadeImpl.class);
    protected RetryManager retryManager = new RetryManager(
                                            RETRY_ATTEMPTS,
                                            new BackoffPolicy(RETRY_BASE_DELAY),
                                            ex -> (ex instanceof CloudWatchLogsFacadeException) && ((CloudWatchLogsFacadeException)ex).isRetryable());


    public CloudWatchLogsFacadeImpl(ClientConfig config)
    {
        this.config = config;
    }

//----------------------------------------------------------------------------
//  CloudWatchLogsFacade
//----------------------------------------------------------------------------

    @Override
    public List<LogStreamInfo> listStreams(String logGroupName, int pageSize)
    {
        DescribeLogStreamsRequest request = DescribeLogStreamsRequest.builder()
                                            .logGroupName(logGroupName)
                                            .orderBy(OrderBy.LAST_EVENT_TIME)
                                            .descending(Boolean.TRUE)
                                            .limit(pageSize)
                                            .build();

        return retryManager.invoke(() ->
        {
            try
            {
                DescribeLogStreamsResponse response = client().describeLogStreams(request);
                List<LogStreamInfo> result = new ArrayList<>();
                for (LogStream stream : response.logStreams())
                {
                    result.add(new LogStreamInfo(
                            stream.logStreamName(),
                            toInstant(stream.lastEventTimestamp()),
                            toInstant(stream.creationTime()),
                            stream.arn()));
                }
                return result;
            }
            catch (Exception ex)
            {
                throw transformException("listStreams", ex, logGroupName);
            }
        });
    }


    @Override
    public EventBatch pollEvents(String logGroupName, String logStreamName, Instant since, String filterPattern, String nextToken, int pageSize)
    {
        FilterLogEventsRequest.Builder builder = FilterLogEventsRequest.builder()
                                                 .logGroupName(logGroupName)
                                                 .logStreamNames(logStreamName)
                                                 .limit(pageSize);
        if (since != null)
            builder.startTime(since.toEpochMilli());
        if ((filterPattern != null) && ! filterPattern.isEmpty())
            builder.filterPattern(filterPattern);
        if ((nextToken != null) && ! nextToken.isEmpty())
            builder.nextToken(nextToken);

        FilterLogEventsRequest request = builder.build();

        return retryManager.invoke(() ->
        {
            try
            {
                FilterLogEventsResponse response = client().filterLogEvents(request);
                List<RawLogEvent> events = new ArrayList<>();
                for (FilteredLogEvent event : response.events())
                {
                    events.add(new RawLogEvent(event.timestamp(), event.message(), event.logStreamName(), event.eventId()));
                }
                return new EventBatch(events, response.nextToken());
            }
            catch (Exception ex)
            {
                throw transformException("pollEvents", ex, logGroupName, logStreamName);
            }
        });
    }


    @Override
    public LiveTailStream openLiveSession(LiveTailRequest request)
    {
        StartLiveTailRequest.Builder builder = StartLiveTailRequest.builder()
                                               .logGroupIdentifiers(request.getLogGroupIdentifiers());
        if (! request.getLogStreamNames().isEmpty())
            builder.logStreamNames(request.getLogStreamNames());
        if (! request.getLogStreamNamePrefixes().isEmpty())
            builder.logStreamNamePrefixes(request.getLogStreamNamePrefixes());
        if ((request.getFilterPattern() != null) && ! request.getFilterPattern().isEmpty())
            builder.logEventFilterPattern(request.getFilterPattern());

        Object[] args = request.getLogGroupIdentifiers().toArray();
        LiveTailStreamImpl stream = new LiveTailStreamImpl(logger, ex -> transformException("openLiveSession", ex, args));

        StartLiveTailResponseHandler handler = StartLiveTailResponseHandler.builder()
                                               .subscriber(stream::publish)
                                               .onError(ex ->
                                               {
                                                   if (isSessionTimeout(ex))
                                                       stream.complete("session timed out");
                                                   else
                                                       stream.fail(ex);
                                               })
                                               .onComplete(stream::complete)
                                               .build();

        try
        {
            CompletableFuture<Void> future = asyncClient().startLiveTail(builder.build(), handler);
            stream.setFuture(future);
            return stream;
        }
        catch (Exception ex)
        {
            throw transformException("openLiveSession", ex, args);
        }
    }


    @Override
    public String submitQuery(QueryParameters parameters)
    {
        StartQueryRequest.Builder builder = StartQueryRequest.builder()
                                            .logGroupNames(parameters.getLogGroupNames())
                                            .queryString(parameters.getQueryString())
                                            .startTime(parameters.getStartTime().getEpochSecond())
                                            .endTime(parameters.getEndTime().getEpochSecond());
        if (parameters.getLimit() != null)
            builder.limit(parameters.getLimit());
        if (parameters.getQueryLanguage() != null)
            builder.queryLanguage(parameters.getQueryLanguage().name());

        StartQueryRequest request = builder.build();

        return retryManager.invoke(() ->
        {
            try
            {
                StartQueryResponse response = client().startQuery(request);
                return response.queryId();
            }
            catch (Exception ex)
            {
                throw transformException("submitQuery", ex, parameters.getLogGroupNames());
            }
        });
    }


    @Override
    public QueryStatusResponse getQueryStatus(String queryId)
    {
        GetQueryResultsRequest request = GetQueryResultsRequest.builder()
                                         .queryId(queryId)
                                         .build();

        return retryManager.invoke(() ->
        {
            try
            {
                GetQueryResultsResponse response = client().getQueryResults(request);
                QueryStatus status = translateStatus(response.statusAsString());
                if (status != QueryStatus.COMPLETE)
                    return new QueryStatusResponse(status);

                List<List<ResultField>> rows = new ArrayList<>();
                for (List<software.amazon.awssdk.services.cloudwatchlogs.model.ResultField> row : response.results())
                {
                    List<ResultField> fields = new ArrayList<>();
                    for (software.amazon.awssdk.services.cloudwatchlogs.model.ResultField field : row)
                    {
                        fields.add(new ResultField(field.field(), field.value()));
                    }
                    rows.add(fields);
                }

                return new QueryStatusResponse(status, rows, translateStatistics(response.statistics()), response.encryptionKey());
            }
            catch (Exception ex)
            {
                throw transformException("getQueryStatus", ex, queryId);
            }
        });
    }


    @Override
    public void cancelQuery(String queryId)
    {
        StopQueryRequest request = StopQueryRequest.builder()
                                   .queryId(queryId)
                                   .build();
        retryManager.invoke(() ->
        {
            try
            {
                return client().stopQuery(request).success();
            }
            catch (Exception ex)
            {
                throw transformException("cancelQuery", ex, queryId);
            }
        });
    }


    @Override
    public void shutdown()
    {
        if (client != null)
            client.close();
        if (asyncClient != null)
            asyncClient.close();
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    /**
     *  Returns the synchronous client, creating it if necessary.
     */
    protected synchronized CloudWatchLogsClient client()
    {
        if (client == null)
        {
            client = new ClientFactory<>(CloudWatchLogsClient.class, config).create();
        }
        return client;
    }


    /**
     *  Returns the asynchronous client, creating it if necessary.
     */
    protected synchronized CloudWatchLogsAsyncClient asyncClient()
    {
        if (asyncClient == null)
        {
            asyncClient = new ClientFactory<>(CloudWatchLogsAsyncClient.class, config).create();
        }
        return asyncClient;
    }


    /**
     *  Maps the service's query status. Scheduled and unknown queries are still
     *  running as far as the poller is concerned; a service timeout is a failure.
     */
    protected static QueryStatus translateStatus(String status)
    {
        if (status == null)
            return QueryStatus.RUNNING;

        switch (status)
        {
            case "Complete":
                return QueryStatus.COMPLETE;
            case "Failed":
            case "Timeout":
                return QueryStatus.FAILED;
            case "Cancelled":
                return QueryStatus.CANCELLED;
            default:
                return QueryStatus.RUNNING;
        }
    }


    private static QueryStatistics translateStatistics(software.amazon.awssdk.services.cloudwatchlogs.model.QueryStatistics stats)
    {
        if (stats == null)
            return null;

        return new QueryStatistics(
                toDouble(stats.recordsMatched()),
                toDouble(stats.recordsScanned()),
                toDouble(stats.bytesScanned()));
    }


    private static double toDouble(Double value)
    {
        return (value != null) ? value.doubleValue() : 0.0;
    }


    private static Instant toInstant(Long millis)
    {
        return (millis != null) ? Instant.ofEpochMilli(millis) : null;
    }


    private static Throwable unwrap(Throwable ex)
    {
        while (((ex instanceof CompletionException) || (ex instanceof ExecutionException)) && (ex.getCause() != null))
        {
            ex = ex.getCause();
        }
        return ex;
    }


    private static String errorCode(Throwable ex)
    {
        if (! (ex instanceof CloudWatchLogsException))
            return null;

        CloudWatchLogsException cwex = (CloudWatchLogsException)ex;
        return (cwex.awsErrorDetails() != null) ? cwex.awsErrorDetails().errorCode() : null;
    }


    private static boolean isSessionTimeout(Throwable ex)
    {
        return SESSION_TIMEOUT_CODE.equals(errorCode(unwrap(ex)));
    }


    /**
     *  Translates an SDK exception into a facade exception, with reason code and
     *  indication of whether the operation can be retried.
     */
    protected CloudWatchLogsFacadeException transformException(String functionName, Throwable ex, Object... args)
    {
        Throwable cause = unwrap(ex);

        if (cause instanceof CloudWatchLogsFacadeException)
            return (CloudWatchLogsFacadeException)cause;

        ReasonCode reason;
        String message;
        boolean isRetryable;

        if (cause == null)
        {
            reason = ReasonCode.UNEXPECTED_EXCEPTION;
            message = "coding error; exception not provided";
            isRetryable = false;
        }
        else if (cause instanceof OperationAbortedException)
        {
            reason = ReasonCode.ABORTED;
            message = "request aborted";
            isRetryable = true;
        }
        else if (cause instanceof ResourceNotFoundException)
        {
            reason = ReasonCode.MISSING_LOG_GROUP;
            message = "resource not found: " + cause.getMessage();
            isRetryable = false;
        }
        else if (cause instanceof MalformedQueryException)
        {
            reason = ReasonCode.INVALID_QUERY;
            message = "invalid query: " + cause.getMessage();
            isRetryable = false;
        }
        else if (cause instanceof InvalidParameterException)
        {
            reason = ReasonCode.INVALID_CONFIGURATION;
            message = "invalid parameter: " + cause.getMessage();
            isRetryable = false;
        }
        else if (cause instanceof LimitExceededException)
        {
            reason = ReasonCode.LIMIT_EXCEEDED;
            message = "limit exceeded: " + cause.getMessage();
            isRetryable = false;
        }
        else if (cause instanceof ServiceUnavailableException)
        {
            reason = ReasonCode.SERVICE_UNAVAILABLE;
            message = "service unavailable";
            isRetryable = true;
        }
        else if (cause instanceof CloudWatchLogsException)
        {
            String errorCode = errorCode(cause);
            if ("ThrottlingException".equals(errorCode))
            {
                reason = ReasonCode.THROTTLING;
                message = "request throttled";
                isRetryable = true;
            }
            else if (SESSION_TIMEOUT_CODE.equals(errorCode))
            {
                reason = ReasonCode.SESSION_TIMEOUT;
                message = "session timed out";
                isRetryable = false;
            }
            else
            {
                reason = ReasonCode.UNEXPECTED_EXCEPTION;
                message = "service exception: " + cause.getMessage();
                isRetryable = false;  // SDKException considers some things retryable that we don't
            }
        }
        else
        {
            reason = ReasonCode.UNEXPECTED_EXCEPTION;
            message = "unexpected exception: " + cause.getMessage();
            isRetryable = false;
        }

        return new CloudWatchLogsFacadeException(message, cause, reason, isRetryable, functionName, args);
    }
}
