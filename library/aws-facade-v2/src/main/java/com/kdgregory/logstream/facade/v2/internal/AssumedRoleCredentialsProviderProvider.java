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

package com.kdgregory.logstream.facade.v2.internal;

import java.util.regex.Pattern;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.StsClientBuilder;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleCredentialsProvider;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;


/**
 *  Used by {@link ClientFactory} to create an <code>StsAssumeRoleCredentialsProvider</code>.
 *  This is a separate class to (1) ensure that there isn't a hard reference to the STS SDK,
 *  and (2) to simplify testing.
 *  <p>
 *  The role must be identified by ARN.
 */
public class AssumedRoleCredentialsProviderProvider
{
    public final static String SESSION_NAME = "com.kdgregory.logstream";

    private final static Pattern ROLE_ARN = Pattern.compile("arn:.*:iam::\\d{12}:role/.*");

    private String region;
    private AwsCredentialsProvider baseCredentials;
    private StsClient stsClient;


    /**
     *  @param  region          The region for the STS client; null for the default.
     *  @param  baseCredentials The credentials used to call STS; null for the default.
     */
    public AssumedRoleCredentialsProviderProvider(String region, AwsCredentialsProvider baseCredentials)
    {
        this.region = region;
        this.baseCredentials = baseCredentials;
    }

//----------------------------------------------------------------------------
//  Public methods
//----------------------------------------------------------------------------

    /**
     *  @throws IllegalArgumentException if not passed a role ARN.
     */
    public StsAssumeRoleCredentialsProvider provideProvider(String roleArn)
    {
        if ((roleArn == null) || ! ROLE_ARN.matcher(roleArn).matches())
            throw new IllegalArgumentException("assumed role must be specified as an ARN: " + roleArn);

        AssumeRoleRequest request = AssumeRoleRequest.builder()
                                    .roleArn(roleArn)
                                    .roleSessionName(SESSION_NAME)
                                    .build();

        return StsAssumeRoleCredentialsProvider.builder()
               .stsClient(stsClient())
               .refreshRequest(request)
               .build();
    }

//----------------------------------------------------------------------------
//  Internals -- protected so they can be overridden for testing
//----------------------------------------------------------------------------

    protected StsClient stsClient()
    {
        if (stsClient == null)
        {
            StsClientBuilder clientBuilder = StsClient.builder();
            if ((region != null) && ! region.isEmpty())
                clientBuilder.region(Region.of(region));
            if (baseCredentials != null)
                clientBuilder.credentialsProvider(baseCredentials);
            stsClient = clientBuilder.build();
        }
        return stsClient;
    }
}
