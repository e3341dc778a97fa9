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
 *  Reports a single failed attempt to read from a stream. These are retried,
 *  so are normally only seen as the cause of a {@link StreamFatalException}.
 */
public class StreamPollException
extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private String streamName;


    public StreamPollException(String streamName, Throwable cause)
    {
        super("failed to poll " + streamName + ": " + cause.getMessage(), cause);
        this.streamName = streamName;
    }


    public String getStreamName()
    {
        return streamName;
    }
}
