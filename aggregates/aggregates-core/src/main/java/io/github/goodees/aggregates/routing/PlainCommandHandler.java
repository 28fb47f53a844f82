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

import java.util.Map;

/**
 * Handler of commands that are not routed to an aggregate. Identity of an aggregate, if any, has to be extracted by
 * the handler itself or by middleware, which may also pass dependencies to the handler in the assigns.
 *
 * <p>Implementing this interface is optional, a route without aggregate only requires a public method with the same
 * signature.</p>
 *
 * @param <C> type of command
 */
@FunctionalInterface
public interface PlainCommandHandler<C> {
    /**
     * Handle the command.
     * @param command the command
     * @param assigns assigns of the dispatch pipeline
     * @return {@code null} for commands, the result for queries
     * @throws Exception when handling fails
     */
    Object handle(C command, Map<String, Object> assigns) throws Exception;
}
