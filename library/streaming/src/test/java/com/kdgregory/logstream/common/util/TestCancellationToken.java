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
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import static org.junit.Assert.*;

import static net.sf.kdgcommons.test.NumericAsserts.*;


public class TestCancellationToken
{
    @Test
    public void testSleepCompletes() throws Exception
    {
        CancellationToken token = new CancellationToken();

        long start = System.currentTimeMillis();
        assertTrue("sleep completed",   token.sleep(Duration.ofMillis(50)));
        long elapsed = System.currentTimeMillis() - start;

        assertInRange("elapsed time", 40, 1000, elapsed);
        assertFalse("not cancelled",    token.isCancelled());
    }


    @Test
    public void testZeroSleep() throws Exception
    {
        assertTrue("zero sleep completes", new CancellationToken().sleep(Duration.ZERO));
    }


    @Test(timeout=5000)
    public void testCancelWakesSleeper() throws Exception
    {
        final CancellationToken token = new CancellationToken();

        Thread canceller = new Thread(() ->
        {
            try
            {
                Thread.sleep(50);
            }
            catch (InterruptedException ignored)
            {
                // test will fail by timeout
            }
            token.cancel();
        });
        canceller.start();

        assertFalse("sleep was cancelled",  token.sleep(Duration.ofMinutes(5)));
        assertTrue("token is cancelled",    token.isCancelled());
        assertFalse("subsequent sleep",     token.sleep(Duration.ofMinutes(5)));
    }


    @Test
    public void testActionsRunOnce() throws Exception
    {
        final AtomicInteger counter = new AtomicInteger();
        CancellationToken token = new CancellationToken();

        token.onCancel(counter::incrementAndGet);
        token.onCancel(counter::incrementAndGet);
        assertEquals("before cancel",   0,  counter.get());

        token.cancel();
        assertEquals("after cancel",    2,  counter.get());

        token.cancel();
        assertEquals("second cancel",   2,  counter.get());

        token.onCancel(counter::incrementAndGet);
        assertEquals("registered after cancel runs immediately", 3, counter.get());
    }


    @Test
    public void testRemovedActionNotRun() throws Exception
    {
        final AtomicInteger counter = new AtomicInteger();
        Runnable action = counter::incrementAndGet;

        CancellationToken token = new CancellationToken();
        token.onCancel(action);
        token.removeOnCancel(action);
        token.cancel();

        assertEquals("action not run",  0,  counter.get());
    }


    @Test
    public void testInterruptEndsSleep() throws Exception
    {
        CancellationToken token = new CancellationToken();

        Thread.currentThread().interrupt();
        assertFalse("sleep did not complete",   token.sleep(Duration.ofMinutes(5)));
        assertTrue("interrupt flag preserved",  Thread.interrupted());
        assertFalse("token not cancelled",      token.isCancelled());
    }
}
