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

import java.time.Duration;

import com.kdgregory.logstream.common.util.BackoffPolicy;


/**
 *  Counts a worker's failed polls. The count is never reset: a stream that
 *  fails intermittently is abandoned once its total failures exceed the limit.
 */
public class ReconnectState
{
    private int attempts;
    private int maxAttempts;
    private BackoffPolicy backoff;


    public ReconnectState(int maxAttempts, Duration baseDelay)
    {
        this.maxAttempts = maxAttempts;
        this.backoff = new BackoffPolicy(baseDelay);
    }


    /**
     *  Records a failure, returning the updated count.
     */
    public int recordFailure()
    {
        return ++attempts;
    }


    public int getAttempts()
    {
        return attempts;
    }


    public int getMaxAttempts()
    {
        return maxAttempts;
    }


    /**
     *  Returns <code>true</code> if there have been more failures than allowed.
     */
    public boolean isExhausted()
    {
        return attempts > maxAttempts;
    }


    /**
     *  Returns the time to wait before the next attempt. Only meaningful after
     *  at least one failure.
     */
    public Duration currentDelay()
    {
        return backoff.delay(Math.max(attempts, 1));
    }
}
