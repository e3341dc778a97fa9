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

import java.util.Iterator;


/**
 *  The chunks of a live-tail session, in the order that the service sent them.
 *  <p>
 *  <code>hasNext()</code> blocks until the next chunk arrives or the session ends.
 *  A failure of the underlying connection is thrown (as an unchecked exception)
 *  from <code>hasNext()</code> or <code>next()</code>.
 *  <p>
 *  {@link #close} may be called from any thread, and causes a blocked
 *  <code>hasNext()</code> to return <code>false</code>. Closing an already
 *  closed stream does nothing.
 */
public interface LiveTailStream
extends Iterator<SessionChunk>, AutoCloseable
{
    @Override
    public void close();
}
