package io.github.goodees.aggregates.routing;

/*-
 * #%L
 * aggregates-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.aggregates.instance.HandlerFunction;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Resolution of handler functions to public two argument methods of handler objects.
 */
final class HandlerMethods {
    private HandlerMethods() {
    }

    /**
     * Resolve method {@code name(state, command)}.
     * @param handler the handler or aggregate
     * @param name name of the method
     * @param commandType type of command the method needs to accept as second argument
     * @return the handler function
     * @throws RouterConfigurationException when there is no such method
     */
    static HandlerFunction aggregateFunction(Object handler, String name, Class<?> commandType) {
        Method method = resolve(handler, name, commandType, 1);
        return (state, command) -> invoke(method, handler, state, command);
    }

    /**
     * Resolve method {@code name(command, assigns)}.
     * @param handler the plain handler
     * @param name name of the method
     * @param commandType type of command the method needs to accept as first argument
     * @return handler function invoked with command and assigns
     * @throws RouterConfigurationException when there is no such method
     */
    static HandlerFunction plainFunction(Object handler, String name, Class<?> commandType) {
        Method method = resolve(handler, name, commandType, 0);
        if (!method.getParameterTypes()[1].isAssignableFrom(Map.class)) {
            throw new RouterConfigurationException("Command handler " + handler.getClass().getName()
                    + " function " + name + "/2 does not accept assigns as second argument");
        }
        return (command, assigns) -> invoke(method, handler, command, assigns);
    }

    private static Method resolve(Object handler, String name, Class<?> commandType, int commandParameter) {
        List<Method> candidates = Arrays.stream(handler.getClass().getMethods())
                .filter(m -> m.getName().equals(name))
                .filter(m -> m.getParameterCount() == 2)
                .filter(m -> !Modifier.isStatic(m.getModifiers()))
                .filter(m -> m.getParameterTypes()[commandParameter].isAssignableFrom(commandType))
                .filter(m -> !m.isBridge())
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            throw new RouterConfigurationException("Command handler " + handler.getClass().getName()
                    + " does not define a function: " + name + "/2 accepting " + commandType.getName());
        }
        // most specific command parameter wins
        Method method = candidates.stream()
                .min(Comparator.comparingInt(m -> distance(commandType, m.getParameterTypes()[commandParameter])))
                .get();
        method.trySetAccessible();
        return method;
    }

    private static int distance(Class<?> type, Class<?> parameter) {
        if (type.equals(parameter)) {
            return 0;
        }
        int depth = 0;
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            if (c.equals(parameter)) {
                return depth;
            }
            depth++;
        }
        return parameter.isInterface() ? depth : Integer.MAX_VALUE;
    }

    private static Object invoke(Method method, Object target, Object first, Object second) throws Exception {
        try {
            return method.invoke(target, first, second);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
