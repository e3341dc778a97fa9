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

import java.lang.reflect.Constructor;


/**
 *  Creates new instances of AWS facade objects. Uses reflection to determine
 *  which implementation library is linked into the application, so that the
 *  core does not depend on any AWS SDK.
 */
public class FacadeFactory
{
    private final static String[] FACADE_PACKAGES = new String[]
    {
        "com.kdgregory.logstream.facade.v2"
    };


    /**
     *  Instantiates the facade implementation corresponding to the provided
     *  interface class.
     *
     *  @throws IllegalArgumentException if unable to instantiate. Exception
     *          message will provide more information.
     */
    public static <T> T createFacade(Class<T> facadeType, ClientConfig config)
    {
        Class<?> implClass = findImplementationClass(facadeType);
        return facadeType.cast(instantiate(implClass, config));
    }


    /**
     *  Finds the implementation class, which is named after the interface with
     *  an "Impl" suffix, in one of the known implementation packages.
     */
    private static Class<?> findImplementationClass(Class<?> facadeType)
    {
        for (String packageName : FACADE_PACKAGES)
        {
            String className = packageName + "." + facadeType.getSimpleName() + "Impl";
            try
            {
                return Class.forName(className);
            }
            catch (ClassNotFoundException ignored)
            {
                // not linked; try the next package
            }
        }

        throw new IllegalArgumentException("no implementation class for " + facadeType.getName());
    }


    private static Object instantiate(Class<?> implClass, Object... ctorArgs)
    {
        try
        {
            Constructor<?>[] ctors = implClass.getConstructors();
            if (ctors.length != 1)
            {
                throw new IllegalArgumentException("implementation class does not expose a single constructor: " + implClass.getName());
            }

            return ctors[0].newInstance(ctorArgs);
        }
        catch (IllegalArgumentException ex)
        {
            throw ex;
        }
        catch (Exception ex)
        {
            throw new IllegalArgumentException("unable to instantiate: " + implClass.getName(), ex);
        }
    }
}
