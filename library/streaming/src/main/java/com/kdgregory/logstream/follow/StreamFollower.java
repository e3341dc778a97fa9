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

package com.kdgregory.logstream.follow;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Predicate;

import com.kdgregory.logstream.common.LogStreamInfo;
import com.kdgregory.logstream.common.util.CancellationToken;
import com.kdgregory.logstream.common.util.DefaultThreadFactory;
import com.kdgregory.logstream.common.util.InternalLogger;
import com.kdgregory.logstream.facade.CloudWatchLogsFacade;


/**
 *  Follows the streams of a log group that match a pattern, delivering their
 *  events to a listener as they are written.
 *  <p>
 *  Each matching stream is followed by its own {@link StreamWorker}, on its own
 *  thread. Workers are independent: a stream that can not be read is eventually
 *  abandoned, without affecting the others. {@link #follow} returns once every
 *  worker has finished, which normally means that the caller has cancelled the
 *  token.
 */
public class StreamFollower
{
    private CloudWatchLogsFacade facade;
    private StreamFollowerConfig config;
    private InternalLogger logger;
    private Clock clock;


    /**
     *  @throws IllegalArgumentException if the configuration is invalid.
     */
    public StreamFollower(CloudWatchLogsFacade facade, StreamFollowerConfig config, InternalLogger logger, Clock clock)
    {
        List<String> errors = config.validate();
        if (! errors.isEmpty())
            throw new IllegalArgumentException("invalid configuration: " + errors);

        this.facade = facade;
        this.config = config;
        this.logger = logger;
        this.clock = clock;
    }


    public StreamFollower(CloudWatchLogsFacade facade, StreamFollowerConfig config, InternalLogger logger)
    {
        this(facade, config, logger, Clock.systemUTC());
    }


    /**
     *  Follows all matching streams until cancelled, or until every stream has
     *  failed. Failures that prevent following from starting are reported to the
     *  listener's <code>onError()</code>, with a null stream name, and then thrown.
     *
     *  @throws PatternCompileException if the stream pattern is not a valid regex.
     *  @throws StreamDiscoveryException if unable to list the group's streams.
     *  @throws NoMatchingStreamsException if no streams match the pattern.
     */
    public FollowResult follow(StreamListener listener, CancellationToken token)
    {
        Predicate<String> matcher;
        try
        {
            matcher = StreamPatternMatcher.compile(config.getStreamPattern(), config.getUseRegex());
        }
        catch (PatternCompileException ex)
        {
            logger.error(ex.getMessage(), ex);
            listener.onError(ex, null);
            throw ex;
        }

        List<String> streamNames = discoverStreams(matcher, listener);
        Instant startTime = (config.getStartTime() != null)
                          ? config.getStartTime()
                          : clock.instant().minus(StreamFollowerConfig.DEFAULT_START_OFFSET);

        logger.debug("following " + streamNames.size() + " streams in " + config.getLogGroupName() + ", starting at " + startTime);

        // interrupting this thread cancels the workers, not the caller's token
        CancellationToken workerToken = new CancellationToken();
        Runnable propagateCancel = workerToken::cancel;
        token.onCancel(propagateCancel);

        List<StreamWorker> workers = new ArrayList<>();
        for (String streamName : streamNames)
        {
            workers.add(new StreamWorker(streamName, startTime, config, facade, listener, workerToken, logger, clock));
        }

        ExecutorService executor = Executors.newFixedThreadPool(workers.size(), new DefaultThreadFactory("follow", logger));
        try
        {
            List<Future<StreamOutcome>> futures = new ArrayList<>();
            for (StreamWorker worker : workers)
            {
                futures.add(executor.submit(worker));
            }

            List<StreamOutcome> outcomes = new ArrayList<>();
            for (int ii = 0 ; ii < workers.size() ; ii++)
            {
                outcomes.add(awaitOutcome(workers.get(ii), futures.get(ii), workerToken));
            }
            return new FollowResult(outcomes);
        }
        finally
        {
            token.removeOnCancel(propagateCancel);
            executor.shutdownNow();
        }
    }


    /**
     *  Lists the log group's streams, most recently written first, and returns the
     *  names of those that match. Streams without a name are ignored. A failure is
     *  reported to the listener (with a null stream name) before being thrown.
     */
    public List<String> discoverStreams(Predicate<String> matcher, StreamListener listener)
    {
        List<LogStreamInfo> streams;
        try
        {
            streams = facade.listStreams(config.getLogGroupName(), config.getDiscoveryPageSize());
        }
        catch (RuntimeException ex)
        {
            StreamDiscoveryException wrapped = new StreamDiscoveryException(config.getLogGroupName(), ex);
            logger.error(wrapped.getMessage(), ex);
            listener.onError(wrapped, null);
            throw wrapped;
        }

        List<String> result = new ArrayList<>();
        for (LogStreamInfo stream : streams)
        {
            if ((stream.getName() != null) && matcher.test(stream.getName()))
                result.add(stream.getName());
        }

        if (result.isEmpty())
        {
            NoMatchingStreamsException ex = new NoMatchingStreamsException(config.getLogGroupName(), config.getStreamPattern());
            logger.warn(ex.getMessage());
            listener.onError(ex, null);
            throw ex;
        }

        return result;
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    /**
     *  Waits for a single worker to finish. If this thread is interrupted, all
     *  workers are cancelled and the wait continues, so that every worker has
     *  reached a terminal state when <code>follow()</code> returns.
     */
    private StreamOutcome awaitOutcome(StreamWorker worker, Future<StreamOutcome> future, CancellationToken workerToken)
    {
        boolean interrupted = false;
        try
        {
            while (true)
            {
                try
                {
                    return future.get();
                }
                catch (InterruptedException ex)
                {
                    interrupted = true;
                    workerToken.cancel();
                }
                catch (ExecutionException ex)
                {
                    Throwable cause = (ex.getCause() != null) ? ex.getCause() : ex;
                    logger.error("worker for " + worker.getStreamName() + " terminated unexpectedly", cause);
                    return new StreamOutcome(worker.getStreamName(), StreamOutcome.Status.FAILED, cause,
                                             worker.getEventCount(), worker.getReconnectAttempts(), worker.getLastTimestamp());
                }
            }
        }
        finally
        {
            if (interrupted)
                Thread.currentThread().interrupt();
        }
    }
}
