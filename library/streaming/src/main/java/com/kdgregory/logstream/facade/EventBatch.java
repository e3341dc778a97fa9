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
import java.util.List;


/**
 *  The result of a single poll for events: the events themselves (in service
 *  order), and a continuation token if there are more to retrieve.
 */
public class EventBatch
{
    private List<RawLogEvent> events;
    private String nextToken;


    public EventBatch(List<RawLogEvent> events, String nextToken)
    {
        this.events = (events == null)
                    ? Collections.emptyList()
                    : Collections.unmodifiableList(new ArrayList<>(events));
        this.nextToken = nextToken;
    }


    public List<RawLogEvent> getEvents()
    {
        return events;
    }


    /**
     *  Returns the continuation token, null if this is the last page.
     */
    public String getNextToken()
    {
        return nextToken;
    }


    /**
     *  Returns <code>true</code> if the batch has no events and no continuation;
     *  the caller has caught up with the stream.
     */
    public boolean isIdle()
    {
        return events.isEmpty() && ((nextToken == null) || nextToken.isEmpty());
    }
}
