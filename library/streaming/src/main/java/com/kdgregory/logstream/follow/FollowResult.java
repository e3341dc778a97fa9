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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 *  The outcome of {@link StreamFollower#follow}: one entry per followed stream,
 *  in discovery order.
 */
public class FollowResult
{
    private List<StreamOutcome> outcomes;


    public FollowResult(List<StreamOutcome> outcomes)
    {
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }


    public List<StreamOutcome> getOutcomes()
    {
        return outcomes;
    }


    /**
     *  Returns the outcome for a named stream, null if that stream wasn't followed.
     */
    public StreamOutcome getOutcome(String streamName)
    {
        for (StreamOutcome outcome : outcomes)
        {
            if (outcome.getStreamName().equals(streamName))
                return outcome;
        }
        return null;
    }


    public List<StreamOutcome> getFailures()
    {
        List<StreamOutcome> result = new ArrayList<>();
        for (StreamOutcome outcome : outcomes)
        {
            if (outcome.getStatus() == StreamOutcome.Status.FAILED)
                result.add(outcome);
        }
        return result;
    }


    public boolean hasFailures()
    {
        return ! getFailures().isEmpty();
    }


    public long getTotalEvents()
    {
        long total = 0;
        for (StreamOutcome outcome : outcomes)
        {
            total += outcome.getEventCount();
        }
        return total;
    }
}
