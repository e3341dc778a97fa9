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

package com.kdgregory.logstream.facade.v2;

import org.junit.Test;
import static org.junit.Assert.*;

import com.kdgregory.logstream.facade.ClientConfig;
import com.kdgregory.logstream.facade.CloudWatchLogsFacade;
import com.kdgregory.logstream.facade.FacadeFactory;


public class TestFacadeFactory
{
    @Test
    public void testCreateCloudWatchLogsFacade() throws Exception
    {
        CloudWatchLogsFacade facade = FacadeFactory.createFacade(CloudWatchLogsFacade.class, new ClientConfig());

        assertNotNull("created facade",                                             facade);
        assertEquals("implementation class",    CloudWatchLogsFacadeImpl.class,     facade.getClass());

        // no client has been created, so this should be harmless
        facade.shutdown();
    }
}
