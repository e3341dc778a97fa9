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


/**
 *  Thrown when a stream-name pattern can not be compiled. This happens before
 *  any service call is made.
 */
public class PatternCompileException
extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private String pattern;


    public PatternCompileException(String pattern, Throwable cause)
    {
        super("invalid stream name pattern: '" + pattern + "': " + cause.getMessage(), cause);
        this.pattern = pattern;
    }


    public String getPattern()
    {
        return pattern;
    }
}
