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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Logs dispatched commands, their outcome and duration.
 */
public class CommandLogger implements Middleware {
    private final Logger logger = LoggerFactory.getLogger(getClass());

    @Override
    public void beforeDispatch(Pipeline pipeline) {
        logger.info("{} dispatch start, command id {}", commandName(pipeline), pipeline.getCommandId());
    }

    @Override
    public void afterDispatch(Pipeline pipeline) {
        // middleware running after this one may have replaced the result with a failure
        Optional<DispatchFailure> failure = pipeline.getResponse().flatMap(DispatchResult::getFailure);
        if (failure.isPresent()) {
            logFailure(pipeline, failure.get().toString());
        } else {
            logger.info("{} succeeded in {} ms", commandName(pipeline), pipeline.elapsedMillis());
        }
    }

    @Override
    public void afterFailure(Pipeline pipeline) {
        String reason = pipeline.getResponse()
                .flatMap(DispatchResult::getFailure)
                .map(DispatchFailure::toString)
                .orElse("halted");
        logFailure(pipeline, reason);
    }

    private void logFailure(Pipeline pipeline, String reason) {
        logger.info("{} failed in {} ms: {}", commandName(pipeline), pipeline.elapsedMillis(), reason);
    }

    private static String commandName(Pipeline pipeline) {
        return pipeline.getCommand().getClass().getSimpleName();
    }
}
