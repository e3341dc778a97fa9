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

package com.kdgregory.logstream.common.util;

import java.time.Duration;


/**
 *  Computes the delay before a retry: the base delay, doubled for each attempt
 *  after the first. There is no jitter, so delays are predictable.
 *  <p>
 *  Attempts are numbered from 1: <code>delay(1)</code> is the base delay,
 *  <code>delay(3)</code> is four times the base delay. Delays saturate at
 *  <code>Long.MAX_VALUE</code> milliseconds rather than overflowing.
 *  <p>
 *  Instances are immutable and thread-safe.
 */
public class BackoffPolicy
{
    private Duration baseDelay;


    public BackoffPolicy(Duration baseDelay)
    {
        if ((baseDelay == null) || baseDelay.isNegative())
            throw new IllegalArgumentException("base delay must be non-negative: " + baseDelay);

        this.baseDelay = baseDelay;
    }


    public Duration getBaseDelay()
    {
        return baseDelay;
    }


    /**
     *  Returns the delay for the specified attempt.
     *
     *  @throws IllegalArgumentException if <code>attempt</code> is less than 1.
     */
    public Duration delay(int attempt)
    {
        return delay(attempt, baseDelay);
    }


    /**
     *  Returns the delay for the specified attempt, given a base delay.
     *
     *  @throws IllegalArgumentException if <code>attempt</code> is less than 1.
     */
    public static Duration delay(int attempt, Duration baseDelay)
    {
        if (attempt <= 0)
            throw new IllegalArgumentException("attempt must be >= 1, was " + attempt);

        long baseMillis = baseDelay.toMillis();
        int exponent = attempt - 1;

        // 2^exponent doesn't fit in a long past 62, and the product can overflow well before that
        if ((baseMillis != 0) && ((exponent >= 63) || (baseMillis > (Long.MAX_VALUE >> exponent))))
            return Duration.ofMillis(Long.MAX_VALUE);

        return Duration.ofMillis(baseMillis << exponent);
    }
}
