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

import com.kdgregory.logstream.common.LogEvent;


/**
 *  Receives events and status notifications from a {@link StreamFollower}.
 *  <p>
 *  Each followed stream has its own thread, and calls for different streams can
 *  happen concurrently, so implementations must be thread-safe. Calls for a single
 *  stream are made in order from that stream's thread.
 *  <p>
 *  An exception thrown from {@link #onEvent} is treated as a failed poll of that
 *  stream.
 */
public interface StreamListener
{
    /**
     *  Called once per stream, before its first poll.
     */
    default void onStreamConnect(String streamName)
    {
        // no-op
    }


    /**
     *  Called for each event, in the order that events are retrieved.
     */
    void onEvent(LogEvent event, String streamName);


    /**
     *  Called after a poll of the stream fails.
     */
    default void onStreamDisconnect(String streamName, String reason)
    {
        // no-op
    }


    /**
     *  Called when the follower is about to wait and then retry a failed stream.
     *
     *  @param  attempt The number of failed polls so far (1-based).
     */
    default void onReconnect(String streamName, int attempt)
    {
        // no-op
    }


    /**
     *  Called when an error can not be recovered.
     *
     *  @param  error       The error; for a single stream this is a
     *                      {@link StreamFatalException}.
     *  @param  streamName  The affected stream, null if the error affects the
     *                      entire operation (such as failure to discover streams).
     */
    default void onError(Exception error, String streamName)
    {
        // no-op
    }
}
