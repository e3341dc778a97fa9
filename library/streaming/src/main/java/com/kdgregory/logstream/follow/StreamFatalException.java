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


/**
 *  Reports that the follower has given up on a stream after exhausting its
 *  reconnect attempts. Other streams are not affected.
 */
public class StreamFatalException
extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private String streamName;
    private int attempts;


    public StreamFatalException(String streamName, int attempts, Throwable cause)
    {
        super("abandoned " + streamName + " after " + attempts + " failed polls: " + cause.getMessage(), cause);
        this.streamName = streamName;
        this.attempts = attempts;
    }


    public String getStreamName()
    {
        return streamName;
    }


    /**
     *  Returns the number of failed polls, including the last one.
     */
    public int getAttempts()
    {
        return attempts;
    }
}
