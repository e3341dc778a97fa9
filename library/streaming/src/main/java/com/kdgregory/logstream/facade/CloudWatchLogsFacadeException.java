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


/**
 *  This exception is thrown by {@link CloudWatchLogsFacade} for any failure of
 *  an underlying service call. Each instance has a reason code, and an indication
 *  of whether the condition is retryable. Where relevant, it wraps an underlying
 *  SDK-specific cause.
 */
public class CloudWatchLogsFacadeException
extends FacadeException
{
    private static final long serialVersionUID = 1L;

    public enum ReasonCode
    {
        /**
         *  An exception that isn't expected to be corrected by the caller (just
         *  throw it on up).
         */
        UNEXPECTED_EXCEPTION,


        /**
         *  An invalid configuration or request value. The message will indicate
         *  the problem.
         */
        INVALID_CONFIGURATION,


        /**
         *  The log group (or stream) named in the request does not exist.
         */
        MISSING_LOG_GROUP,


        /**
         *  The query string was rejected by the service (usually a syntax error).
         */
        INVALID_QUERY,


        /**
         *  An account limit was reached; for example, too many concurrent queries
         *  or live-tail sessions.
         */
        LIMIT_EXCEEDED,


        /**
         *  The API call was aborted; according to the Interwebs, this is caused by
         *  thread interruption. Caller should retry.
         */
        ABORTED,


        /**
         *  The API call was throttled; caller should retry.
         */
        THROTTLING,


        /**
         *  The service reported a transient internal failure; caller should retry.
         */
        SERVICE_UNAVAILABLE,


        /**
         *  A live-tail session ended because the service timed it out.
         */
        SESSION_TIMEOUT
    }


    private ReasonCode reasonCode;


    /**
     *  Base constructor.
     */
    public CloudWatchLogsFacadeException(String message, Throwable cause, ReasonCode reasonCode, boolean isRetryable, String functionName, Object... args)
    {
        super(message, cause, isRetryable, functionName, args);
        this.reasonCode = reasonCode;
    }


    /**
     *  Convenience constructor, for conditions where there is no underlying exception,
     *  or where it's irrelevant.
     */
    public CloudWatchLogsFacadeException(String message, ReasonCode reasonCode, boolean isRetryable, String functionName, Object... args)
    {
        this(message, null, reasonCode, isRetryable, functionName, args);
    }


    /**
     *  Returns a code that can be used by the application to dispatch exception handling.
     */
    public ReasonCode getReason()
    {
        return reasonCode;
    }
}
