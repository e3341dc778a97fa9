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
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

import static net.sf.kdgcommons.test.StringAsserts.*;

import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
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
import software.amazon.awssdk.services.cloudwatchlogs.model.LimitExceededException;
import software.amazon.awssdk.services.cloudwatchlogs.model.LogStream;
import software.amazon.awssdk.services.cloudwatchlogs.model.MalformedQueryException;
import software.amazon.awssdk.services.cloudwatchlogs.model.OperationAbortedException;
import software.amazon.awssdk.services.cloudwatchlogs.model.OrderBy;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceNotFoundException;
import software.amazon.awssdk.services.cloudwatchlogs.model.StartQueryRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.StartQueryResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.StopQueryRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.StopQueryResponse;

import com.kdgregory.logstream.common.LogStreamInfo;
import com.kdgregory.logstream.common.util.BackoffPolicy;
import com.kdgregory.logstream.common.util.RetryManager;
import com.kdgregory.logstream.facade.ClientConfig;
import com.kdgregory.logstream.facade.CloudWatchLogsFacade;
import com.kdgregory.logstream.facade.CloudWatchLogsFacadeException;
import com.kdgregory.logstream.facade.CloudWatchLogsFacadeException.ReasonCode;
import com.kdgregory.logstream.facade.EventBatch;
import com.kdgregory.logstream.facade.LiveTailRequest;
import com.kdgregory.logstream.facade.LiveTailStream;
import com.kdgregory.logstream.facade.QueryStatusResponse;
import com.kdgregory.logstream.facade.RawLogEvent;
import com.kdgregory.logstream.facade.SessionChunk;
import com.kdgregory.logstream.query.QueryLanguage;
import com.kdgregory.logstream.query.QueryParameters;
import com.kdgregory.logstream.query.QueryStatus;
import com.kdgregory.logstream.query.ResultField;
import com.kdgregory.logstream.testhelpers.CloudWatchLogsClientMock;


public class TestCloudWatchLogsFacadeImpl
{
    private final static String TEST_LOG_GROUP = "argle";
    private final static String TEST_LOG_STREAM = "bargle";

    private final static Instant QUERY_START = Instant.parse("2024-01-01T00:00:00Z");
    private final static Instant QUERY_END   = Instant.parse("2024-01-01T01:00:00Z");

    private ClientConfig config = new ClientConfig();

    // default mock returns no streams, no events, and a running query
    private CloudWatchLogsClientMock mock = new CloudWatchLogsClientMock();

    // note: can update config or mock any time before making first call
    private CloudWatchLogsFacade facade = new CloudWatchLogsFacadeImpl(config)
    {
        {
            retryManager = new RetryManager(RETRY_ATTEMPTS, new BackoffPolicy(Duration.ofMillis(1)),
                                            ex -> ((CloudWatchLogsFacadeException)ex).isRetryable());
        }

        @Override
        protected CloudWatchLogsClient client()
        {
            if (client == null)
            {
                client = mock.createClient();
            }
            return client;
        }

        @Override
        protected CloudWatchLogsAsyncClient asyncClient()
        {
            if (asyncClient == null)
            {
                asyncClient = mock.createAsyncClient();
            }
            return asyncClient;
        }
    };

//----------------------------------------------------------------------------
//  Helpers
//----------------------------------------------------------------------------

    private static CloudWatchLogsException serviceException(String errorCode)
    {
        return (CloudWatchLogsException)
               CloudWatchLogsException.builder()
               .message("service exception: " + errorCode)
               .awsErrorDetails(AwsErrorDetails.builder().errorCode(errorCode).build())
               .build();
    }


    private static LogStream logStream(String name, long lastEventTimestamp)
    {
        return LogStream.builder()
               .logStreamName(name)
               .lastEventTimestamp(lastEventTimestamp)
               .creationTime(lastEventTimestamp - 1000)
               .arn("arn:aws:logs:us-east-1:123456789012:log-group:" + TEST_LOG_GROUP + ":log-stream:" + name)
               .build();
    }


    private static software.amazon.awssdk.services.cloudwatchlogs.model.ResultField sdkField(String name, String value)
    {
        return software.amazon.awssdk.services.cloudwatchlogs.model.ResultField.builder()
               .field(name)
               .value(value)
               .build();
    }


    private static QueryParameters queryParameters(QueryLanguage language)
    {
        return new QueryParameters(Arrays.asList("foo", "bar"), "fields @message", QUERY_START, QUERY_END, 25, language);
    }

//----------------------------------------------------------------------------
//  Testcases
//----------------------------------------------------------------------------

    @Test
    public void testListStreams() throws Exception
    {
        mock.logStreams.add(logStream("newest", 2000));
        mock.logStreams.add(logStream("oldest", 1000));

        List<LogStreamInfo> streams = facade.listStreams(TEST_LOG_GROUP, 50);

        assertEquals("invocation count",            1,                      mock.describeLogStreamsInvocationCount);
        DescribeLogStreamsRequest request = mock.lastDescribeLogStreamsRequest;
        assertEquals("request: group name",         TEST_LOG_GROUP,         request.logGroupName());
        assertEquals("request: order by",           OrderBy.LAST_EVENT_TIME, request.orderBy());
        assertEquals("request: descending",         Boolean.TRUE,           request.descending());
        assertEquals("request: limit",              Integer.valueOf(50),    request.limit());

        assertEquals("number of streams",           2,                      streams.size());
        assertEquals("first stream: name",          "newest",               streams.get(0).getName());
        assertEquals("first stream: last event",    Instant.ofEpochMilli(2000), streams.get(0).getLastEventTimestamp());
        assertEquals("first stream: created",       Instant.ofEpochMilli(1000), streams.get(0).getCreationTime());
        assertRegex("first stream: ARN",            "arn:.*:log-stream:newest", streams.get(0).getArn());
        assertEquals("second stream: name",         "oldest",               streams.get(1).getName());
    }


    @Test
    public void testListStreamsMissingGroup() throws Exception
    {
        mock = new CloudWatchLogsClientMock()
        {
            @Override
            protected DescribeLogStreamsResponse describeLogStreams(DescribeLogStreamsRequest request)
            {
                throw ResourceNotFoundException.builder().message("no such group").build();
            }
        };

        try
        {
            facade.listStreams(TEST_LOG_GROUP, 50);
            fail("should have thrown");
        }
        catch (CloudWatchLogsFacadeException ex)
        {
            assertEquals("reason",              ReasonCode.MISSING_LOG_GROUP,   ex.getReason());
            assertFalse("retryable",                                            ex.isRetryable());
            assertRegex("message",              "listStreams\\(argle\\): resource not found.*", ex.getMessage());
            assertEquals("cause",               ResourceNotFoundException.class, ex.getCause().getClass());
        }

        assertEquals("invocation count",        1,                              mock.describeLogStreamsInvocationCount);
    }


    @Test
    public void testPollEvents() throws Exception
    {
        mock.filteredEvents.add(FilteredLogEvent.builder().timestamp(1000L).message("first").logStreamName(TEST_LOG_STREAM).eventId("e1").build());
        mock.filteredEvents.add(FilteredLogEvent.builder().timestamp(2000L).logStreamName(TEST_LOG_STREAM).eventId("e2").build());
        mock.filterNextToken = "next";

        EventBatch batch = facade.pollEvents(TEST_LOG_GROUP, TEST_LOG_STREAM, Instant.ofEpochMilli(12345), "ERROR", "previous", 100);

        FilterLogEventsRequest request = mock.lastFilterLogEventsRequest;
        assertEquals("request: group name",     TEST_LOG_GROUP,                         request.logGroupName());
        assertEquals("request: stream names",   Arrays.asList(TEST_LOG_STREAM),         request.logStreamNames());
        assertEquals("request: start time",     Long.valueOf(12345),                    request.startTime());
        assertEquals("request: filter",         "ERROR",                                request.filterPattern());
        assertEquals("request: token",          "previous",                             request.nextToken());
        assertEquals("request: limit",          Integer.valueOf(100),                   request.limit());

        assertEquals("number of events",        2,                                      batch.getEvents().size());
        assertEquals("next token",              "next",                                 batch.getNextToken());

        RawLogEvent first = batch.getEvents().get(0);
        assertEquals("first event: timestamp",  Long.valueOf(1000),                     first.getTimestamp());
        assertEquals("first event: message",    "first",                                first.getMessage());
        assertEquals("first event: stream",     TEST_LOG_STREAM,                        first.getStreamName());
        assertEquals("first event: ID",         "e1",                                   first.getEventId());
        assertTrue("first event is well-formed",                                        first.isWellFormed());
        assertFalse("second event is malformed (no message)",                           batch.getEvents().get(1).isWellFormed());
    }


    @Test
    public void testPollEventsOmitsOptionalParameters() throws Exception
    {
        EventBatch batch = facade.pollEvents(TEST_LOG_GROUP, TEST_LOG_STREAM, null, null, null, 100);

        FilterLogEventsRequest request = mock.lastFilterLogEventsRequest;
        assertNull("request: start time",       request.startTime());
        assertNull("request: filter",           request.filterPattern());
        assertNull("request: token",            request.nextToken());

        assertTrue("batch is idle",             batch.isIdle());
    }


    @Test
    public void testPollEventsRetriesThrottling() throws Exception
    {
        mock = new CloudWatchLogsClientMock()
        {
            @Override
            protected FilterLogEventsResponse filterLogEvents(FilterLogEventsRequest request)
            {
                if (filterLogEventsInvocationCount < 3)
                    throw serviceException("ThrottlingException");
                return super.filterLogEvents(request);
            }
        };

        EventBatch batch = facade.pollEvents(TEST_LOG_GROUP, TEST_LOG_STREAM, Instant.ofEpochMilli(0), null, null, 100);

        assertEquals("invocation count",        3,          mock.filterLogEventsInvocationCount);
        assertEquals("returned batch",          0,          batch.getEvents().size());
    }


    @Test
    public void testPollEventsRetryExhausted() throws Exception
    {
        mock = new CloudWatchLogsClientMock()
        {
            @Override
            protected FilterLogEventsResponse filterLogEvents(FilterLogEventsRequest request)
            {
                throw OperationAbortedException.builder().message("aborted").build();
            }
        };

        try
        {
            facade.pollEvents(TEST_LOG_GROUP, TEST_LOG_STREAM, Instant.ofEpochMilli(0), null, null, 100);
            fail("should have thrown");
        }
        catch (CloudWatchLogsFacadeException ex)
        {
            assertEquals("reason",              ReasonCode.ABORTED,     ex.getReason());
            assertTrue("retryable",                                     ex.isRetryable());
            assertRegex("message",              "pollEvents\\(argle,bargle\\): request aborted", ex.getMessage());
        }

        assertEquals("invocation count",        CloudWatchLogsFacadeImpl.RETRY_ATTEMPTS, mock.filterLogEventsInvocationCount);
    }


    @Test
    public void testUnexpectedServiceException() throws Exception
    {
        mock = new CloudWatchLogsClientMock()
        {
            @Override
            protected FilterLogEventsResponse filterLogEvents(FilterLogEventsRequest request)
            {
                throw serviceException("AccessDeniedException");
            }
        };

        try
        {
            facade.pollEvents(TEST_LOG_GROUP, TEST_LOG_STREAM, Instant.ofEpochMilli(0), null, null, 100);
            fail("should have thrown");
        }
        catch (CloudWatchLogsFacadeException ex)
        {
            assertEquals("reason",              ReasonCode.UNEXPECTED_EXCEPTION,    ex.getReason());
            assertFalse("retryable",                                                ex.isRetryable());
            assertRegex("message",              "pollEvents.*: service exception: .*AccessDeniedException.*", ex.getMessage());
        }

        assertEquals("invocation count",        1,                                  mock.filterLogEventsInvocationCount);
    }


    @Test
    public void testSubmitQuery() throws Exception
    {
        String queryId = facade.submitQuery(queryParameters(QueryLanguage.PPL));

        assertEquals("returned ID",             "query-1",                      queryId);

        StartQueryRequest request = mock.lastStartQueryRequest;
        assertEquals("request: groups",         Arrays.asList("foo", "bar"),    request.logGroupNames());
        assertEquals("request: query",          "fields @message",              request.queryString());
        assertEquals("request: start",          Long.valueOf(QUERY_START.getEpochSecond()), request.startTime());
        assertEquals("request: end",            Long.valueOf(QUERY_END.getEpochSecond()),   request.endTime());
        assertEquals("request: limit",          Integer.valueOf(25),            request.limit());
        assertEquals("request: language",       "PPL",                          request.queryLanguageAsString());
    }


    @Test
    public void testSubmitQueryDefaultLanguage() throws Exception
    {
        facade.submitQuery(new QueryParameters(Arrays.asList("foo"), "fields @message", QUERY_START, QUERY_END));

        StartQueryRequest request = mock.lastStartQueryRequest;
        assertNull("request: limit",            request.limit());
        assertNull("request: language",         request.queryLanguageAsString());
    }


    @Test
    public void testSubmitQueryExceptions() throws Exception
    {
        mock = new CloudWatchLogsClientMock()
        {
            @Override
            protected StartQueryResponse startQuery(StartQueryRequest request)
            {
                if (startQueryInvocationCount == 1)
                    throw MalformedQueryException.builder().message("bad syntax").build();
                else
                    throw LimitExceededException.builder().message("too many queries").build();
            }
        };

        try
        {
            facade.submitQuery(queryParameters(null));
            fail("should have thrown");
        }
        catch (CloudWatchLogsFacadeException ex)
        {
            assertEquals("first call: reason",  ReasonCode.INVALID_QUERY,   ex.getReason());
            assertRegex("first call: message",  "submitQuery\\(\\[foo, bar\\]\\): invalid query: .*", ex.getMessage());
        }

        try
        {
            facade.submitQuery(queryParameters(null));
            fail("should have thrown");
        }
        catch (CloudWatchLogsFacadeException ex)
        {
            assertEquals("second call: reason", ReasonCode.LIMIT_EXCEEDED,  ex.getReason());
            assertFalse("second call: retryable",                           ex.isRetryable());
        }

        assertEquals("invocation count",        2,                          mock.startQueryInvocationCount);
    }


    @Test
    public void testGetQueryStatusRunning() throws Exception
    {
        QueryStatusResponse response = facade.getQueryStatus("query-1");

        assertEquals("request: ID",         "query-1",                  mock.lastGetQueryResultsRequest.queryId());
        assertEquals("status",              QueryStatus.RUNNING,        response.getStatus());
        assertTrue("no rows",                                           response.getRows().isEmpty());
    }


    @Test
    public void testGetQueryStatusComplete() throws Exception
    {
        mock = new CloudWatchLogsClientMock()
        {
            @Override
            protected GetQueryResultsResponse getQueryResults(GetQueryResultsRequest request)
            {
                return GetQueryResultsResponse.builder()
                       .status(software.amazon.awssdk.services.cloudwatchlogs.model.QueryStatus.COMPLETE)
                       .results(Arrays.asList(
                           Arrays.asList(sdkField("@timestamp", "2024-01-01 00:00:01.000"), sdkField("@message", "first")),
                           Arrays.asList(sdkField("@timestamp", "2024-01-01 00:00:02.000"), sdkField("@message", "second"))))
                       .statistics(software.amazon.awssdk.services.cloudwatchlogs.model.QueryStatistics.builder()
                                   .recordsMatched(2.0)
                                   .recordsScanned(10.0)
                                   .bytesScanned(1234.0)
                                   .build())
                       .encryptionKey("key-arn")
                       .build();
            }
        };

        QueryStatusResponse response = facade.getQueryStatus("query-1");

        assertEquals("status",                  QueryStatus.COMPLETE,                       response.getStatus());
        assertEquals("number of rows",          2,                                          response.getRows().size());
        assertEquals("first row",               Arrays.asList(new ResultField("@timestamp", "2024-01-01 00:00:01.000"),
                                                              new ResultField("@message", "first")),
                                                response.getRows().get(0));
        assertEquals("records matched",         2.0,                                        response.getStatistics().getRecordsMatched(), 0.0);
        assertEquals("records scanned",         10.0,                                       response.getStatistics().getRecordsScanned(), 0.0);
        assertEquals("bytes scanned",           1234.0,                                     response.getStatistics().getBytesScanned(), 0.0);
        assertEquals("encryption key",          "key-arn",                                  response.getEncryptionKey());
    }


    @Test
    public void testQueryStatusTranslation() throws Exception
    {
        assertEquals("Scheduled",   QueryStatus.RUNNING,    CloudWatchLogsFacadeImpl.translateStatus("Scheduled"));
        assertEquals("Running",     QueryStatus.RUNNING,    CloudWatchLogsFacadeImpl.translateStatus("Running"));
        assertEquals("Unknown",     QueryStatus.RUNNING,    CloudWatchLogsFacadeImpl.translateStatus("Unknown"));
        assertEquals("null",        QueryStatus.RUNNING,    CloudWatchLogsFacadeImpl.translateStatus(null));
        assertEquals("Complete",    QueryStatus.COMPLETE,   CloudWatchLogsFacadeImpl.translateStatus("Complete"));
        assertEquals("Failed",      QueryStatus.FAILED,     CloudWatchLogsFacadeImpl.translateStatus("Failed"));
        assertEquals("Timeout",     QueryStatus.FAILED,     CloudWatchLogsFacadeImpl.translateStatus("Timeout"));
        assertEquals("Cancelled",   QueryStatus.CANCELLED,  CloudWatchLogsFacadeImpl.translateStatus("Cancelled"));
    }


    @Test
    public void testCancelQuery() throws Exception
    {
        facade.cancelQuery("query-1");

        assertEquals("invocation count",    1,              mock.stopQueryInvocationCount);
        assertEquals("request: ID",         "query-1",      mock.lastStopQueryRequest.queryId());
    }


    @Test
    public void testCancelQueryFailure() throws Exception
    {
        mock = new CloudWatchLogsClientMock()
        {
            @Override
            protected StopQueryResponse stopQuery(StopQueryRequest request)
            {
                throw ResourceNotFoundException.builder().message("no such query").build();
            }
        };

        try
        {
            facade.cancelQuery("query-1");
            fail("should have thrown");
        }
        catch (CloudWatchLogsFacadeException ex)
        {
            assertRegex("message",          "cancelQuery\\(query-1\\): .*", ex.getMessage());
        }
    }


    @Test
    public void testOpenLiveSession() throws Exception
    {
        LiveTailRequest request = new LiveTailRequest(
                                    Arrays.asList("arn:aws:logs:us-east-1:123456789012:log-group:argle"),
                                    Arrays.asList(TEST_LOG_STREAM),
                                    Arrays.asList(),
                                    "ERROR");

        LiveTailStream stream = facade.openLiveSession(request);

        assertEquals("invocation count",        1,                                  mock.startLiveTailInvocationCount);
        assertEquals("request: groups",         request.getLogGroupIdentifiers(),   mock.lastStartLiveTailRequest.logGroupIdentifiers());
        assertEquals("request: streams",        Arrays.asList(TEST_LOG_STREAM),     mock.lastStartLiveTailRequest.logStreamNames());
        assertFalse("request: no prefixes",                                         mock.lastStartLiveTailRequest.hasLogStreamNamePrefixes());
        assertEquals("request: filter",         "ERROR",                            mock.lastStartLiveTailRequest.logEventFilterPattern());

        mock.liveTailHandler.complete();

        assertTrue("stream has stop chunk",                                         stream.hasNext());
        assertEquals("chunk type",              SessionChunk.Type.SESSION_STOP,     stream.next().getType());
        assertFalse("stream is finished",                                           stream.hasNext());

        stream.close();
        assertTrue("closing stream cancels the session",                            mock.liveTailFuture.isCancelled());
    }


    @Test
    public void testOpenLiveSessionError() throws Exception
    {
        LiveTailStream stream = facade.openLiveSession(new LiveTailRequest(Arrays.asList("argle"), null, null, null));

        assertFalse("request: no streams",                                          mock.lastStartLiveTailRequest.hasLogStreamNames());
        assertNull("request: no filter",                                            mock.lastStartLiveTailRequest.logEventFilterPattern());

        mock.liveTailHandler.exceptionOccurred(LimitExceededException.builder().message("too many sessions").build());

        try
        {
            stream.hasNext();
            fail("should have thrown");
        }
        catch (CloudWatchLogsFacadeException ex)
        {
            assertEquals("reason",              ReasonCode.LIMIT_EXCEEDED,          ex.getReason());
            assertRegex("message",              "openLiveSession\\(argle\\): limit exceeded: .*", ex.getMessage());
        }
    }


    @Test
    public void testLiveSessionTimeout() throws Exception
    {
        LiveTailStream stream = facade.openLiveSession(new LiveTailRequest(Arrays.asList("argle"), null, null, null));

        mock.liveTailHandler.exceptionOccurred(serviceException("SessionTimeoutException"));

        assertTrue("stream has stop chunk",                                         stream.hasNext());
        SessionChunk chunk = stream.next();
        assertEquals("chunk type",              SessionChunk.Type.SESSION_STOP,     chunk.getType());
        assertEquals("stop reason",             "session timed out",                chunk.getStopReason());
        assertFalse("stream is finished",                                           stream.hasNext());
    }


    @Test
    public void testShutdown() throws Exception
    {
        // nothing created, nothing to close
        facade.shutdown();
        assertEquals("close, before any calls",         0,  mock.closeInvocationCount);

        facade.listStreams(TEST_LOG_GROUP, 10);
        facade.openLiveSession(new LiveTailRequest(Arrays.asList("argle"), null, null, null));
        facade.shutdown();

        assertEquals("close, synchronous client",       1,  mock.closeInvocationCount);
        assertEquals("close, asynchronous client",      1,  mock.asyncCloseInvocationCount);
    }
}
