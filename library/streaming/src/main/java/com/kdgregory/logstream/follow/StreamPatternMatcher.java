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

import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;


/**
 *  Converts a user-supplied stream name pattern into a predicate.
 *  <p>
 *  Glob patterns must match the entire name: <code>*</code> matches any sequence of
 *  characters, <code>?</code> matches a single character, and everything else is
 *  literal. Regular expressions are <em>not</em> anchored: they match if they are
 *  found anywhere in the name. Use <code>^</code> and <code>$</code> to anchor them.
 *  <p>
 *  A null or empty pattern matches every name.
 */
public class StreamPatternMatcher
{
    private final static String REGEX_METACHARS = "\\.[]{}()+-^$|";


    private StreamPatternMatcher()
    {
        // static methods only
    }


    /**
     *  Compiles a pattern.
     *
     *  @param  pattern     The pattern; may be null.
     *  @param  isRegex     If true, the pattern is a regular expression; otherwise
     *                      it's a glob.
     *
     *  @throws PatternCompileException if the pattern is an invalid regex.
     */
    public static Predicate<String> compile(String pattern, boolean isRegex)
    {
        if ((pattern == null) || pattern.isEmpty())
            return name -> true;

        if (isRegex)
        {
            try
            {
                Pattern regex = Pattern.compile(pattern);
                return name -> regex.matcher(name).find();
            }
            catch (PatternSyntaxException ex)
            {
                throw new PatternCompileException(pattern, ex);
            }
        }

        Pattern glob = Pattern.compile(globToRegex(pattern));
        return name -> glob.matcher(name).matches();
    }


    /**
     *  Translates a glob into an anchored regular expression.
     */
    public static String globToRegex(String glob)
    {
        StringBuilder sb = new StringBuilder(glob.length() + 8).append('^');
        for (char c : glob.toCharArray())
        {
            if (c == '*')
                sb.append(".*");
            else if (c == '?')
                sb.append('.');
            else if (REGEX_METACHARS.indexOf(c) >= 0)
                sb.append('\\').append(c);
            else
                sb.append(c);
        }
        return sb.append('$').toString();
    }
}
