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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;


/**
 *  A cancellation signal that is passed into long-running operations. Once
 *  cancelled, a token stays cancelled.
 *  <p>
 *  Operations check {@link #isCancelled} between units of work, and use
 *  {@link #sleep} for any waits, so that cancellation takes effect without
 *  waiting for a sleep to finish. Operations that block on something other
 *  than a sleep (for example, a live-tail stream) register an action with
 *  {@link #onCancel} that unblocks them.
 *  <p>
 *  Instances are thread-safe. A single token may be shared between several
 *  operations, which are then all cancelled together.
 */
public class CancellationToken
{
    private CountDownLatch latch = new CountDownLatch(1);
    private List<Runnable> actions = new ArrayList<>();


    /**
     *  Returns a token that is never cancelled by anyone else. Each call returns
     *  a new instance.
     */
    public static CancellationToken none()
    {
        return new CancellationToken();
    }


    /**
     *  Cancels the token: wakes all threads that are sleeping on it, and runs any
     *  registered actions (on the calling thread). Subsequent calls do nothing.
     */
    public void cancel()
    {
        List<Runnable> toRun;
        synchronized (this)
        {
            if (isCancelled())
                return;

            latch.countDown();
            toRun = new ArrayList<>(actions);
            actions.clear();
        }

        for (Runnable action : toRun)
        {
            action.run();
        }
    }


    public boolean isCancelled()
    {
        return latch.getCount() == 0;
    }


    /**
     *  Registers an action to be run when the token is cancelled. If the token
     *  has already been cancelled, the action is run immediately.
     */
    public void onCancel(Runnable action)
    {
        synchronized (this)
        {
            if (! isCancelled())
            {
                actions.add(action);
                return;
            }
        }
        action.run();
    }


    /**
     *  Removes a previously registered action; used when the operation that
     *  registered it has completed.
     */
    public synchronized void removeOnCancel(Runnable action)
    {
        actions.remove(action);
    }


    /**
     *  Sleeps for the specified duration, or until the token is cancelled.
     *  Returns <code>true</code> if the sleep ran to completion, <code>false</code>
     *  if it was cut short by cancellation or by interruption of the calling
     *  thread. In the latter case the thread's interrupt status is preserved.
     */
    public boolean sleep(Duration duration)
    {
        if (isCancelled())
            return false;

        if (duration.isZero() || duration.isNegative())
            return true;

        try
        {
            return ! latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException ex)
        {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
