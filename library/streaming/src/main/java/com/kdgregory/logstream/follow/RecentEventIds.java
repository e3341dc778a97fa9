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

import java.util.LinkedHashMap;
import java.util.Map;


/**
 *  Remembers the IDs of the most recently delivered events, so that events that
 *  are returned again after a rewind are not delivered twice. Once full, the
 *  oldest ID is discarded for each new one.
 *  <p>
 *  Not thread-safe; owned by a single worker.
 */
public class RecentEventIds
{
    private Map<String,Boolean> ids;


    public RecentEventIds(final int capacity)
    {
        ids = new LinkedHashMap<String,Boolean>(capacity * 4 / 3 + 1)
        {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String,Boolean> eldest)
            {
                return size() > capacity;
            }
        };
    }


    /**
     *  Records an ID, returning <code>true</code> if it has not been seen recently.
     *  Null IDs can not be tracked, and are always considered new.
     */
    public boolean add(String eventId)
    {
        if (eventId == null)
            return true;

        return ids.put(eventId, Boolean.TRUE) == null;
    }


    /**
     *  Returns <code>true</code> if the ID has been recorded recently. Null IDs are
     *  never recorded.
     */
    public boolean contains(String eventId)
    {
        return (eventId != null) && ids.containsKey(eventId);
    }


    public int size()
    {
        return ids.size();
    }
}
