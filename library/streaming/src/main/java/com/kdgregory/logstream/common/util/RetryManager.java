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

import java.util.function.Predicate;
import java.util.function.Supplier;


/**
 *  Invokes a function, retrying it after failures that the caller considers
 *  transient, with exponential backoff between attempts. If the function
 *  succeeds its result is returned; if it fails with a non-retryable exception,
 *  or the maximum number of attempts is reached, the last exception is thrown.
 *  <p>
 *  The function must be a Java8 <code>Supplier</code>. Use a lambda to wrap
 *  calls that don't return a value.
 *  <p>
 *  If the thread is interrupted while waiting to retry, the last exception is
 *  thrown immediately (and the thread's interrupt status is preserved).
 *  <p>
 *  Instances are reusable and thread-safe, so can be created once to define the
 *  "standard" retry logic for a given set of operations.
 */
public class RetryManager
{
    private int maxAttempts;
    private BackoffPolicy backoff;
    private Predicate<RuntimeException> isRetryable;


    /**
     *  @param  maxAttempts     The total number of times that the function will be
     *                          called (so 1 means no retries).
     *  @param  backoff         Determines the delay between attempts.
     *  @param  isRetryable     Examines an exception to decide whether to retry.
     */
    public RetryManager(int maxAttempts, BackoffPolicy backoff, Predicate<RuntimeException> isRetryable)
    {
        if (maxAttempts < 1)
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);

        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.isRetryable = isRetryable;
    }


    public <T> T invoke(Supplier<T> supplier)
    {
        for (int attempt = 1 ; ; attempt++)
        {
            try
            {
                return supplier.get();
            }
            catch (RuntimeException ex)
            {
                if ((attempt >= maxAttempts) || ! isRetryable.test(ex))
                    throw ex;

                if (! sleepQuietly(backoff.delay(attempt).toMillis()))
                    throw ex;
            }
        }
    }


    /**
     *  Sleeps for the specified duration (in milliseconds). Returns <code>true</code> if
     *  the sleep completes normally, <code>false</code> if the thread is interrupted.
     */
    public static boolean sleepQuietly(long duration)
    {
        try
        {
            Thread.sleep(duration);
            return true;
        }
        catch (InterruptedException ex)
        {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
