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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;


/**
 *  Holds the configuration used to construct the AWS client(s) behind a facade.
 *  All properties are optional; if none are set, the SDK's default region and
 *  credentials provider chains are used.
 */
public class ClientConfig
implements Cloneable
{
    private final static Pattern ROLE_ARN = Pattern.compile("arn:.*:iam::\\d{12}:role/.*");

    private String clientFactoryMethod;
    private String assumedRole;
    private String profileName;
    private String clientRegion;
    private String clientEndpoint;


    @Override
    public ClientConfig clone()
    {
        try
        {
            return (ClientConfig)super.clone();
        }
        catch (CloneNotSupportedException e)
        {
            throw new RuntimeException("failed to expose Object.clone(); should never happen", e);
        }
    }


    /**
     *  A fully-qualified static method (<code>com.example.Factory.createClient</code>)
     *  that returns a configured client. It may either take no parameters, or take
     *  three strings: assumed role, region, and endpoint.
     */
    public String getClientFactoryMethod()
    {
        return clientFactoryMethod;
    }

    public ClientConfig setClientFactoryMethod(String value)
    {
        clientFactoryMethod = value;
        return this;
    }


    /**
     *  The ARN of a role to assume using the default credentials.
     */
    public String getAssumedRole()
    {
        return assumedRole;
    }

    public ClientConfig setAssumedRole(String value)
    {
        assumedRole = value;
        return this;
    }


    /**
     *  A named profile from the shared credentials/config files.
     */
    public String getProfileName()
    {
        return profileName;
    }

    public ClientConfig setProfileName(String value)
    {
        profileName = value;
        return this;
    }


    public String getClientRegion()
    {
        return clientRegion;
    }

    public ClientConfig setClientRegion(String value)
    {
        clientRegion = value;
        return this;
    }


    public String getClientEndpoint()
    {
        return clientEndpoint;
    }

    public ClientConfig setClientEndpoint(String value)
    {
        clientEndpoint = value;
        return this;
    }


    /**
     *  Validates the configuration, returning a list of any validation errors.
     *  An empty list indicates a valid config.
     */
    public List<String> validate()
    {
        List<String> result = new ArrayList<>();

        if ((assumedRole != null) && ! assumedRole.isEmpty() && ! ROLE_ARN.matcher(assumedRole).matches())
        {
            result.add("assumed role must be a role ARN: " + assumedRole);
        }

        if ((clientEndpoint != null) && ! clientEndpoint.isEmpty()
            && ! (clientEndpoint.startsWith("http://") || clientEndpoint.startsWith("https://")))
        {
            result.add("endpoint must be an HTTP(S) URL: " + clientEndpoint);
        }

        return result;
    }
}
