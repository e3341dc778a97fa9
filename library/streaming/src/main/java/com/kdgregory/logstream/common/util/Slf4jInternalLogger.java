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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 *  An implementation of <code>InternalLogger</code> that passes all messages
 *  to SLF4J. This is the default logger for all components; the application
 *  chooses the actual logging framework by its choice of SLF4J binding.
 *  <p>
 *  Debug messages are written at SLF4J's <code>DEBUG</code> level, so will not
 *  normally appear.
 */
public class Slf4jInternalLogger
implements InternalLogger
{
    private Logger destination;


    public Slf4jInternalLogger(Class<?> component)
    {
        this(LoggerFactory.getLogger(component));
    }


    public Slf4jInternalLogger(Logger destination)
    {
        this.destination = destination;
    }


    @Override
    public void debug(String message)
    {
        destination.debug(message);
    }


    @Override
    public void warn(String message)
    {
        destination.warn(message);
    }


    @Override
    public void error(String message, Throwable ex)
    {
        if (ex != null)
            destination.error(message, ex);
        else
            destination.error(message);
    }
}
