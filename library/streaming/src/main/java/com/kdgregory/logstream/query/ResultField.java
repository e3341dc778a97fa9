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

import java.util.Objects;


/**
 *  A single named value in a query result row.
 */
public class ResultField
{
    private String field;
    private String value;


    public ResultField(String field, String value)
    {
        this.field = field;
        this.value = value;
    }


    public String getField()
    {
        return field;
    }


    public String getValue()
    {
        return value;
    }


    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (! (obj instanceof ResultField))
            return false;

        ResultField that = (ResultField)obj;
        return Objects.equals(field, that.field)
            && Objects.equals(value, that.value);
    }


    @Override
    public int hashCode()
    {
        return Objects.hash(field, value);
    }


    @Override
    public String toString()
    {
        return field + "=" + value;
    }
}
