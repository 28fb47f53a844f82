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

import io.github.goodees.aggregates.dispatch.DispatchFailure;
import io.github.goodees.aggregates.dispatch.DispatchResult;
import io.github.goodees.aggregates.routing.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts aggregate identity from the command according to its route. Halts the dispatch with
 * {@link DispatchFailure.Kind#INVALID_AGGREGATE_IDENTITY} when the command has no identity. Identity already set by
 * preceding middleware is kept.
 */
public class ExtractAggregateIdentity implements Middleware {
    private static final Logger logger = LoggerFactory.getLogger(ExtractAggregateIdentity.class);

    @Override
    public void beforeDispatch(Pipeline pipeline) {
        Route route = pipeline.getRoute();
        if (!route.getAggregate().isPresent() || pipeline.getIdentity().isPresent()) {
            return;
        }
        Object identity = route.getIdentityExtractor().extract(pipeline.getCommand());
        if (identity == null || identity.toString().isEmpty()) {
            logger.warn("Command {} has no aggregate identity", pipeline.getCommand());
            pipeline.respond(DispatchResult.failed(DispatchFailure.invalidAggregateIdentity(pipeline.getCommand())))
                    .halt("invalid aggregate identity");
        } else {
            pipeline.setIdentity(identity.toString());
        }
    }
}
