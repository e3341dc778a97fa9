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

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;
import static org.junit.Assert.*;


public class TestClientConfig
{
    @Test
    public void testDefaults() throws Exception
    {
        ClientConfig config = new ClientConfig();

        assertNull("factory method",    config.getClientFactoryMethod());
        assertNull("assumed role",      config.getAssumedRole());
        assertNull("profile",           config.getProfileName());
        assertNull("region",            config.getClientRegion());
        assertNull("endpoint",          config.getClientEndpoint());
        assertEquals("validation",      Collections.emptyList(),    config.validate());
    }


    @Test
    public void testValidConfiguration() throws Exception
    {
        ClientConfig config = new ClientConfig()
                              .setAssumedRole("arn:aws:iam::123456789012:role/Example")
                              .setClientEndpoint("https://logs.us-east-2.amazonaws.com")
                              .setClientRegion("us-east-2")
                              .setProfileName("dev");

        assertEquals("validation",      Collections.emptyList(),    config.validate());
    }


    @Test
    public void testInvalidConfiguration() throws Exception
    {
        ClientConfig config = new ClientConfig()
                              .setAssumedRole("Example")
                              .setClientEndpoint("logs.us-east-2.amazonaws.com");

        assertEquals("validation",
                     Arrays.asList("assumed role must be a role ARN: Example",
                                   "endpoint must be an HTTP(S) URL: logs.us-east-2.amazonaws.com"),
                     config.validate());
    }


    @Test
    public void testClone() throws Exception
    {
        ClientConfig config = new ClientConfig().setClientRegion("us-east-2");
        ClientConfig clone = config.clone();

        assertNotSame("clone is new object",    config,         clone);
        assertEquals("region copied",           "us-east-2",    clone.getClientRegion());

        clone.setClientRegion("us-west-1");
        assertEquals("original unchanged",      "us-east-2",    config.getClientRegion());
    }
}
