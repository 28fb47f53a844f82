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

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/**
 * Reads aggregate identity from a command.
 */
@FunctionalInterface
public interface IdentityExtractor {

    /**
     * Extract identity.
     * @param command the command
     * @return the identity, {@code null} if command carries none
     */
    Object extract(Object command);

    /**
     * Extractor reading named property of the command. The property is looked up as a getter {@code getField()},
     * accessor {@code field()} or a field {@code field}, in this order.
     * @param commandType type of command
     * @param field name of the property
     * @return extractor of the property
     * @throws RouterConfigurationException when the command type does not expose such property
     */
    static IdentityExtractor forField(Class<?> commandType, String field) {
        String getter = "get" + Character.toUpperCase(field.charAt(0)) + field.substring(1);
        Method method = findAccessor(commandType, getter);
        if (method == null) {
            method = findAccessor(commandType, field);
        }
        if (method != null) {
            Method accessor = method;
            return command -> {
                try {
                    return accessor.invoke(command);
                } catch (InvocationTargetException e) {
                    if (e.getCause() instanceof RuntimeException) {
                        throw (RuntimeException) e.getCause();
                    }
                    throw new IllegalStateException("Failed to read identity " + field + " of " + command, e.getCause());
                } catch (IllegalAccessException e) {
                    throw new IllegalStateException("Cannot access identity " + field + " of " + command, e);
                }
            };
        }
        Field f = findField(commandType, field);
        if (f == null) {
            throw new RouterConfigurationException("Command " + commandType.getName()
                    + " does not expose identity field " + field);
        }
        return command -> {
            try {
                return f.get(command);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot access identity " + field + " of " + command, e);
            }
        };
    }

    private static Method findAccessor(Class<?> type, String name) {
        try {
            Method method = type.getMethod(name);
            if (method.getReturnType() == void.class) {
                return null;
            }
            method.trySetAccessible();
            return method;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static Field findField(Class<?> type, String name) {
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            try {
                Field field = c.getDeclaredField(name);
                field.trySetAccessible();
                return field;
            } catch (NoSuchFieldException e) {
                // continue with superclass
            }
        }
        return null;
    }
}
