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

package com.kdgregory.logstream.livetail;

import java.time.Instant;
import java.util.Set;


/**
 *  Information about a live-tail session, as reported by the service when the
 *  session starts.
 */
public class LiveTailSession
{
    private String sessionId;
    private Set<String> logGroupIdentifiers;
    private String filterPattern;
    private Instant startedAt;


    public LiveTailSession(String sessionId, Set<String> logGroupIdentifiers, String filterPattern, Instant startedAt)
    {
        this.sessionId = sessionId;
        this.logGroupIdentifiers = logGroupIdentifiers;
        this.filterPattern = filterPattern;
        this.startedAt = startedAt;
    }


    public String getSessionId()
    {
        return sessionId;
    }


    public Set<String> getLogGroupIdentifiers()
    {
        return logGroupIdentifiers;
    }


    public String getFilterPattern()
    {
        return filterPattern;
    }


    public Instant getStartedAt()
    {
        return startedAt;
    }


    @Override
    public String toString()
    {
        return "LiveTailSession[" + sessionId + ", groups " + logGroupIdentifiers + "]";
    }
}
