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

package com.kdgregory.logstream.livetail;

import com.kdgregory.logstream.common.LogEvent;


/**
 *  Receives events from a {@link LiveTailMultiplexer}. All calls are made on the
 *  thread that is running the session.
 */
public interface LiveTailListener
{
    /**
     *  Called when the service confirms the session. Only called in verbose mode.
     */
    default void onSessionStart(LiveTailSession session)
    {
        // no-op
    }


    /**
     *  Called for each well-formed event.
     */
    void onEvent(LogEvent event);


    /**
     *  Called when the service ends the session. Only called in verbose mode.
     *
     *  @param  session The session, null if the service never reported its start.
     *  @param  reason  The reason for stopping, if known.
     */
    default void onSessionStop(LiveTailSession session, String reason)
    {
        // no-op
    }


    /**
     *  Called when the session can't be started, or fails while running.
     */
    default void onError(Exception error)
    {
        // no-op
    }


    /**
     *  Called exactly once, after the session has been closed for any reason.
     *  Not called if the session could not be started.
     */
    default void onClose()
    {
        // no-op
    }
}
