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
 *  Identifies the log groups (and optionally streams) that a live-tail session
 *  should watch, along with an optional CloudWatch filter pattern.
 */
public class LiveTailRequest
{
    private List<String> logGroupIdentifiers;
    private List<String> logStreamNames;
    private List<String> logStreamNamePrefixes;
    private String filterPattern;


    public LiveTailRequest(List<String> logGroupIdentifiers, List<String> logStreamNames,
                           List<String> logStreamNamePrefixes, String filterPattern)
    {
        this.logGroupIdentifiers = copy(logGroupIdentifiers);
        this.logStreamNames = copy(logStreamNames);
        this.logStreamNamePrefixes = copy(logStreamNamePrefixes);
        this.filterPattern = filterPattern;
    }


    public List<String> getLogGroupIdentifiers()
    {
        return logGroupIdentifiers;
    }


    /**
     *  Returns the stream names to restrict the session to; empty means all streams.
     */
    public List<String> getLogStreamNames()
    {
        return logStreamNames;
    }


    /**
     *  Returns the stream-name prefixes to restrict the session to; empty means all streams.
     */
    public List<String> getLogStreamNamePrefixes()
    {
        return logStreamNamePrefixes;
    }


    public String getFilterPattern()
    {
        return filterPattern;
    }


    private static List<String> copy(List<String> values)
    {
        return (values == null)
             ? Collections.emptyList()
             : Collections.unmodifiableList(new ArrayList<>(values));
    }
}
