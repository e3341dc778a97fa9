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

import java.time.Instant;


/**
 *  Tracks a worker's position in its stream.
 *  <p>
 *  <code>lastTimestamp</code> is the latest event timestamp that has been seen,
 *  and never decreases. <code>pollFrom</code> is the start time for the next
 *  poll: it normally follows <code>lastTimestamp</code>, but is rewound after
 *  an idle poll so that late-arriving events are picked up.
 *  <p>
 *  Not thread-safe; owned by a single worker.
 */
public class StreamCursor
{
    private Instant lastTimestamp;
    private Instant pollFrom;
    private String nextToken;


    public StreamCursor(Instant startTime)
    {
        this.lastTimestamp = startTime;
        this.pollFrom = startTime;
    }


    public Instant getLastTimestamp()
    {
        return lastTimestamp;
    }


    public Instant getPollFrom()
    {
        return pollFrom;
    }


    public String getNextToken()
    {
        return nextToken;
    }


    public void setNextToken(String value)
    {
        nextToken = ((value == null) || value.isEmpty()) ? null : value;
    }


    /**
     *  Records an observed event timestamp. Earlier timestamps are ignored.
     */
    public void advance(Instant timestamp)
    {
        if (timestamp.isAfter(lastTimestamp))
            lastTimestamp = timestamp;
        if (timestamp.isAfter(pollFrom))
            pollFrom = timestamp;
    }


    /**
     *  Moves the start time for the next poll, without affecting the last
     *  observed timestamp. Clears any continuation token, as it was issued for
     *  a different start time.
     */
    public void rewind(Instant value)
    {
        pollFrom = value;
        nextToken = null;
    }


    @Override
    public String toString()
    {
        return "StreamCursor[last " + lastTimestamp + ", from " + pollFrom + "]";
    }
}
