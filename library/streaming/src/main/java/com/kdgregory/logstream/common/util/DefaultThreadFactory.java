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

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;


/**
 *  The standard thread factory for stream workers: creates named daemon threads,
 *  and reports anything that escapes a worker to the internal logger.
 */
public class DefaultThreadFactory
implements ThreadFactory
{
    private static AtomicInteger threadNumber = new AtomicInteger(0);

    private String operationName;
    private UncaughtExceptionHandler exceptionHandler;


    public DefaultThreadFactory(String operationName, final InternalLogger logger)
    {
        this.operationName = operationName;
        this.exceptionHandler = new UncaughtExceptionHandler()
        {
            @Override
            public void uncaughtException(Thread thread, Throwable ex)
            {
                logger.error("unhandled exception in thread " + thread.getName(), ex);
            }
        };
    }


    @Override
    public Thread newThread(Runnable runnable)
    {
        return createThread(runnable);
    }


    /**
     *  Creates and initializes the thread. This can be overridden by tests that need
     *  to work with the thread; in normal operation we just let it do its thing.
     */
    protected Thread createThread(Runnable runnable)
    {
        Thread thread = new Thread(runnable);
        thread.setName("com-kdgregory-logstream-" + operationName + "-" + threadNumber.incrementAndGet());
        thread.setPriority(Thread.NORM_PRIORITY);
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(exceptionHandler);
        return thread;
    }
}
