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

package com.kdgregory.logstream.common.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 *  Parses the start-time values accepted by "since" options: either relative
 *  to now ("5m ago", "2 hours ago", "1 day ago") or an absolute ISO-8601 value
 *  ("2024-01-15T10:00:00Z", or a local date-time that is interpreted in the
 *  clock's zone).
 */
public class TimeParser
{
    private final static Pattern RELATIVE_TIME
        = Pattern.compile("^(\\d+)\\s*(m|min|minutes?|h|hour|hours?|d|day|days?)\\s*ago$", Pattern.CASE_INSENSITIVE);

    private Clock clock;


    public TimeParser(Clock clock)
    {
        this.clock = clock;
    }


    public TimeParser()
    {
        this(Clock.systemUTC());
    }


    /**
     *  Parses the passed string.
     *
     *  @throws IllegalArgumentException if the value is blank or not in a recognized format.
     */
    public Instant parse(String value)
    {
        if ((value == null) || value.trim().isEmpty())
            throw new IllegalArgumentException("time value is blank");

        String trimmed = value.trim();
        Matcher matcher = RELATIVE_TIME.matcher(trimmed);
        if (matcher.matches())
        {
            long amount = Long.parseLong(matcher.group(1));
            return clock.instant().minus(unitDuration(matcher.group(2)).multipliedBy(amount));
        }

        try
        {
            return Instant.parse(trimmed);
        }
        catch (DateTimeParseException ignored)
        {
            // fall through to local date-time
        }

        try
        {
            ZoneId zone = clock.getZone();
            return LocalDateTime.parse(trimmed).atZone(zone).toInstant();
        }
        catch (DateTimeParseException ex)
        {
            throw new IllegalArgumentException(
                "invalid time format: " + value + "; use relative (e.g., '5m ago') or ISO-8601", ex);
        }
    }


    private static Duration unitDuration(String unit)
    {
        switch (Character.toLowerCase(unit.charAt(0)))
        {
            case 'm':
                return Duration.ofMinutes(1);
            case 'h':
                return Duration.ofHours(1);
            case 'd':
                return Duration.ofDays(1);
            default:
                throw new IllegalArgumentException("unsupported time unit: " + unit);
        }
    }
}
