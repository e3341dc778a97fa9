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

import java.time.Instant;

import org.junit.Test;
import static org.junit.Assert.*;


public class TestStreamCursor
{
    private final static Instant START = Instant.parse("2024-01-15T10:00:00Z");


    @Test
    public void testAdvanceIsMonotonic() throws Exception
    {
        StreamCursor cursor = new StreamCursor(START);

        cursor.advance(START.plusSeconds(10));
        cursor.advance(START.plusSeconds(5));
        cursor.advance(START.minusSeconds(5));

        assertEquals("last timestamp",  START.plusSeconds(10),  cursor.getLastTimestamp());
        assertEquals("poll from",       START.plusSeconds(10),  cursor.getPollFrom());
    }


    @Test
    public void testRewindDoesNotAffectLastTimestamp() throws Exception
    {
        StreamCursor cursor = new StreamCursor(START);
        cursor.advance(START.plusSeconds(10));
        cursor.setNextToken("token");

        cursor.rewind(START.plusSeconds(2));

        assertEquals("last timestamp",  START.plusSeconds(10),  cursor.getLastTimestamp());
        assertEquals("poll from",       START.plusSeconds(2),   cursor.getPollFrom());
        assertNull("next token cleared",                        cursor.getNextToken());

        cursor.advance(START.plusSeconds(5));
        assertEquals("last timestamp after older event",    START.plusSeconds(10),  cursor.getLastTimestamp());
        assertEquals("poll from after older event",         START.plusSeconds(5),   cursor.getPollFrom());
    }


    @Test
    public void testEmptyTokenIsNull() throws Exception
    {
        StreamCursor cursor = new StreamCursor(START);
        cursor.setNextToken("");
        assertNull("empty token", cursor.getNextToken());
    }
}
