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

package com.kdgregory.logstream.query;


/**
 *  Execution statistics reported for a completed query.
 */
public class QueryStatistics
{
    private double recordsMatched;
    private double recordsScanned;
    private double bytesScanned;


    public QueryStatistics(double recordsMatched, double recordsScanned, double bytesScanned)
    {
        this.recordsMatched = recordsMatched;
        this.recordsScanned = recordsScanned;
        this.bytesScanned = bytesScanned;
    }


    public double getRecordsMatched()
    {
        return recordsMatched;
    }


    public double getRecordsScanned()
    {
        return recordsScanned;
    }


    public double getBytesScanned()
    {
        return bytesScanned;
    }


    @Override
    public String toString()
    {
        return "QueryStatistics[matched " + (long)recordsMatched
             + ", scanned " + (long)recordsScanned
             + ", bytes " + (long)bytesScanned + "]";
    }
}
