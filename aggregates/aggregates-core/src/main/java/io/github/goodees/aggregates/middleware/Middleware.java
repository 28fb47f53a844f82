package io.github.goodees.aggregates.middleware;

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

/**
 * Interceptor of command dispatch. Before-dispatch hooks run in order the middleware was registered with the router,
 * after-dispatch and after-failure hooks in reverse order.
 *
 * <p>A middleware may {@linkplain Pipeline#halt(Object) halt} the pipeline in before-dispatch hook, in which case
 * remaining hooks and the execution of the command are skipped. It may also replace the response of the dispatch
 * in any of the hooks.</p>
 */
public interface Middleware {

    default void beforeDispatch(Pipeline pipeline) {
    }

    default void afterDispatch(Pipeline pipeline) {
    }

    default void afterFailure(Pipeline pipeline) {
    }
}
