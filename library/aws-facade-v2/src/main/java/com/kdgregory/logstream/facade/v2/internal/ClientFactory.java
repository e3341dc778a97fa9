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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.URI;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsAsyncClient;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;

import com.kdgregory.logstream.facade.ClientConfig;


/**
 *  Creates and configures an AWS client based on the provided client configuration.
 *  Supports the synchronous and asynchronous CloudWatch Logs clients; the latter
 *  is needed for live tail.
 *  <p>
 *  If the configuration names a factory method, and that method returns the
 *  requested client type, the factory method is used. Otherwise the client is
 *  built from the configured region, endpoint, profile, and assumed role.
 *  <p>
 *  Implementation note: all internal methods are protected to enable testing.
 */
public class ClientFactory<T>
{
    private Class<T> clientType;
    private ClientConfig config;


    public ClientFactory(Class<T> clientType, ClientConfig config)
    {
        this.clientType = clientType;
        this.config = config;
    }

//----------------------------------------------------------------------------
//  Public methods
//----------------------------------------------------------------------------

    public T create()
    {
        T client = tryInstantiateFromFactory();
        if (client != null)
            return client;

        AwsClientBuilder<?,?> builder = createClientBuilder();
        optSetRegionOrEndpoint(builder);

        AwsCredentialsProvider credentialsProvider = optCreateProfileCredentialsProvider();

        String roleToAssume = config.getAssumedRole();
        if ((roleToAssume != null) && ! roleToAssume.isEmpty())
        {
            credentialsProvider = createAssumedRoleCredentialsProvider(roleToAssume, credentialsProvider);
        }

        if (credentialsProvider != null)
        {
            builder.credentialsProvider(credentialsProvider);
        }

        return clientType.cast(builder.build());
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    /**
     *  Determines whether the configuration specifies a factory method that returns
     *  the desired client type, and if so invokes it. Returns null if there's no
     *  factory method, or it returns a different type of client.
     */
    protected T tryInstantiateFromFactory()
    {
        String fullyQualifiedMethodName = config.getClientFactoryMethod();
        if ((fullyQualifiedMethodName == null) || fullyQualifiedMethodName.isEmpty())
            return null;

        // there are two variants of the factory method; we'll look for the simple one
        // first, then the one that takes arguments
        Method factoryMethod = findFactoryMethod(fullyQualifiedMethodName);
        if (factoryMethod == null)
            factoryMethod = findFactoryMethod(fullyQualifiedMethodName, String.class, String.class, String.class);
        if (factoryMethod == null)
            throw new IllegalArgumentException("invalid factory method: " + fullyQualifiedMethodName);

        if (! clientType.isAssignableFrom(factoryMethod.getReturnType()))
            return null;

        try
        {
            return (factoryMethod.getParameterTypes().length == 0)
                 ? clientType.cast(factoryMethod.invoke(null))
                 : clientType.cast(factoryMethod.invoke(null, config.getAssumedRole(), config.getClientRegion(), config.getClientEndpoint()));
        }
        catch (Throwable ex)
        {
            if (ex instanceof InvocationTargetException)
                ex = ex.getCause();

            throw new RuntimeException("exception invoking factory method: " + fullyQualifiedMethodName, ex);
        }
    }


    /**
     *  Finds a public static method given its fully-qualified name and parameter
     *  types. Returns null if the class or method doesn't exist.
     */
    protected static Method findFactoryMethod(String fullyQualifiedName, Class<?>... params)
    {
        int methodIdx = fullyQualifiedName.lastIndexOf('.');
        if (methodIdx <= 0)
            throw new IllegalArgumentException("invalid factory method name: " + fullyQualifiedName);

        String className = fullyQualifiedName.substring(0, methodIdx);
        String methodName = fullyQualifiedName.substring(methodIdx + 1);

        try
        {
            Class<?> klass = Class.forName(className);
            Method method = klass.getMethod(methodName, params);
            return Modifier.isStatic(method.getModifiers()) ? method : null;
        }
        catch (ClassNotFoundException | NoSuchMethodException ex)
        {
            return null;
        }
    }


    /**
     *  Picks an appropriate client builder, based on the client type.
     */
    protected AwsClientBuilder<?,?> createClientBuilder()
    {
        if (clientType == CloudWatchLogsClient.class)
            return CloudWatchLogsClient.builder();

        if (clientType == CloudWatchLogsAsyncClient.class)
            return CloudWatchLogsAsyncClient.builder();

        throw new IllegalArgumentException("unsupported client type: " + clientType.getName());
    }


    /**
     *  If the configuration specifies region or endpoint, sets them.
     */
    protected void optSetRegionOrEndpoint(AwsClientBuilder<?,?> builder)
    {
        String region = config.getClientRegion();
        String endpoint = config.getClientEndpoint();

        if ((endpoint != null) && ! endpoint.isEmpty())
        {
            builder.endpointOverride(URI.create(endpoint));
        }
        if ((region != null) && ! region.isEmpty())
        {
            builder.region(Region.of(region));
        }
    }


    /**
     *  If the configuration names a profile, returns a credentials provider for it.
     *  Otherwise returns null, and the SDK's default provider chain is used.
     */
    protected AwsCredentialsProvider optCreateProfileCredentialsProvider()
    {
        String profileName = config.getProfileName();
        if ((profileName == null) || profileName.isEmpty())
            return null;

        return ProfileCredentialsProvider.create(profileName);
    }


    /**
     *  Creates an assumed-role credentials provider. The test for this is in the
     *  caller, so that we can override this method for testing.
     *
     *  @param  baseCredentials The credentials used to assume the role; null to use
     *                          the default provider chain.
     */
    protected AwsCredentialsProvider createAssumedRoleCredentialsProvider(String roleArn, AwsCredentialsProvider baseCredentials)
    {
        return new AssumedRoleCredentialsProviderProvider(config.getClientRegion(), baseCredentials)
               .provideProvider(roleArn);
    }
}
