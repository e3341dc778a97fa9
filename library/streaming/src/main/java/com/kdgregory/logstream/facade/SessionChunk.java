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

package com.kdgregory.logstream.facade;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;


/**
 *  One element of a live-tail session's event stream. The type determines which
 *  fields are populated: a session start carries the session ID, identifiers and
 *  filter pattern; an update carries zero or more events; a stop may carry a
 *  reason.
 *  <p>
 *  Instances are created with the static factory methods.
 */
public class SessionChunk
{
    public enum Type
    {
        SESSION_START,
        SESSION_UPDATE,
        SESSION_STOP
    }


    private Type type;
    private String sessionId;
    private Set<String> logGroupIdentifiers;
    private String filterPattern;
    private List<RawLogEvent> events;
    private String stopReason;


    private SessionChunk(Type type, String sessionId, Set<String> logGroupIdentifiers, String filterPattern,
                         List<RawLogEvent> events, String stopReason)
    {
        this.type = type;
        this.sessionId = sessionId;
        this.logGroupIdentifiers = logGroupIdentifiers;
        this.filterPattern = filterPattern;
        this.events = events;
        this.stopReason = stopReason;
    }


    public static SessionChunk sessionStart(String sessionId, List<String> logGroupIdentifiers, String filterPattern)
    {
        Set<String> identifiers = (logGroupIdentifiers == null)
                                ? Collections.emptySet()
                                : Collections.unmodifiableSet(new LinkedHashSet<>(logGroupIdentifiers));
        return new SessionChunk(Type.SESSION_START, sessionId, identifiers, filterPattern, Collections.emptyList(), null);
    }


    public static SessionChunk sessionUpdate(List<RawLogEvent> events)
    {
        List<RawLogEvent> copy = (events == null)
                               ? Collections.emptyList()
                               : Collections.unmodifiableList(new ArrayList<>(events));
        return new SessionChunk(Type.SESSION_UPDATE, null, Collections.emptySet(), null, copy, null);
    }


    public static SessionChunk sessionStop(String reason)
    {
        return new SessionChunk(Type.SESSION_STOP, null, Collections.emptySet(), null, Collections.emptyList(), reason);
    }


    public Type getType()
    {
        return type;
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


    /**
     *  Returns the events in an update chunk; empty for other types.
     */
    public List<RawLogEvent> getEvents()
    {
        return events;
    }


    public String getStopReason()
    {
        return stopReason;
    }


    @Override
    public String toString()
    {
        switch (type)
        {
            case SESSION_START:
                return "SessionChunk[start " + sessionId + "]";
            case SESSION_UPDATE:
                return "SessionChunk[update, " + events.size() + " events]";
            default:
                return "SessionChunk[stop " + stopReason + "]";
        }
    }
}
