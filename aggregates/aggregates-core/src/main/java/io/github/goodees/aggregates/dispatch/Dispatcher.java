package io.github.goodees.aggregates.dispatch;

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

import io.github.goodees.aggregates.Aggregate;
import io.github.goodees.aggregates.instance.AggregateInstance;
import io.github.goodees.aggregates.instance.AggregateTerminatedException;
import io.github.goodees.aggregates.instance.AggregateLifespan;
import io.github.goodees.aggregates.instance.ExecutionContext;
import io.github.goodees.aggregates.instance.ExecutionResult;
import io.github.goodees.aggregates.instance.ImmutableExecutionContext;
import io.github.goodees.aggregates.middleware.Middleware;
import io.github.goodees.aggregates.middleware.Pipeline;
import io.github.goodees.aggregates.routing.Route;
import io.github.goodees.aggregates.routing.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches commands through the middleware pipeline to aggregate instances.
 *
 * <p>Dispatch runs on the calling thread, which waits for the execution at most for the timeout of the dispatch.
 * When the timeout elapses the caller stops waiting. The command stays in the aggregate's queue, and runs to
 * completion including persisting its events.</p>
 *
 * <p>An instance that stopped, after idle timeout or shutdown, before the command reached it does not fail the
 * dispatch. The command is sent to a new instance recovered from the store.</p>
 *
 * <p>Expected failures are not thrown, they are returned as {@link DispatchResult#failed(DispatchFailure) failed}
 * results.</p>
 */
public class Dispatcher {
    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    private final Router router;

    public Dispatcher(Router router) {
        this.router = router;
    }

    /**
     * Dispatch a command.
     * <ol>
     *     <li>Look up the route of the command. Unregistered commands fail with
     *     {@link DispatchFailure.Kind#UNREGISTERED_COMMAND}</li>
     *     <li>Run before-dispatch hooks of middleware in order. When a middleware halts the pipeline, after-failure
     *     hooks run and the response of the pipeline is returned</li>
     *     <li>Execute the command by the aggregate instance, or the plain handler</li>
     *     <li>Run after-dispatch or after-failure hooks in reverse order</li>
     *     <li>Return the response set by middleware, or the result shaped according to the options</li>
     * </ol>
     * @param command the command
     * @param options options of the dispatch
     * @return result of the dispatch
     */
    public DispatchResult dispatch(Object command, DispatchOptions options) {
        Objects.requireNonNull(command, "Command must not be null");
        Optional<Route> maybeRoute = router.route(command.getClass());
        if (!maybeRoute.isPresent()) {
            logger.error("Attempted to dispatch an unregistered command: {}", command);
            return DispatchResult.failed(DispatchFailure.unregisteredCommand(command));
        }
        Route route = maybeRoute.get();
        Pipeline pipeline = createPipeline(command, route, options);

        List<Middleware> middleware = router.middleware();
        for (Middleware m : middleware) {
            m.beforeDispatch(pipeline);
            if (pipeline.isHalted()) {
                logger.debug("Dispatch of {} halted by {}", command, m);
                afterFailure(pipeline, middleware);
                return pipeline.getResponse().orElseGet(() -> DispatchResult.failed(DispatchFailure.halted(null)));
            }
        }

        if (route.getAggregate().isPresent()) {
            return executeAggregate(pipeline, route, options, middleware);
        } else {
            return executePlain(pipeline, route, middleware);
        }
    }

    private Pipeline createPipeline(Object command, Route route, DispatchOptions options) {
        Map<String, Object> assigns = new LinkedHashMap<>(route.getAssigns());
        assigns.putAll(options.getAssigns());
        return new Pipeline(command, route,
                options.getConsistency().orElse(route.getConsistency()),
                options.getTimeout().orElse(route.getTimeout()),
                options.getMetadata(),
                assigns);
    }

    private DispatchResult executeAggregate(Pipeline pipeline, Route route, DispatchOptions options,
                                            List<Middleware> middleware) {
        String streamId = pipeline.getStreamId()
                .orElseThrow(() -> new IllegalStateException("No aggregate identity extracted for " + pipeline));
        Aggregate<?> aggregate = route.getAggregate().get();
        AggregateLifespan lifespan = options.getLifespan().orElse(route.getLifespan());
        ExecutionContext context = ImmutableExecutionContext.builder()
                .command(pipeline.getCommand())
                .function(route.getFunction())
                .metadata(pipeline.getMetadata())
                .assigns(pipeline.getAssigns())
                .lifespan(lifespan)
                .causationId(pipeline.getCommandId())
                .correlationId(pipeline.getCorrelationId())
                .build();

        try {
            ExecutionResult result = execute(aggregate, streamId, context, pipeline);
            pipeline.executed(result);
            afterDispatch(pipeline, middleware);
            return pipeline.getResponse().orElseGet(() -> shape(result, options));
        } catch (TimeoutException e) {
            logger.warn("Execution of {} by {} timed out", pipeline.getCommand(), streamId);
            return fail(pipeline, middleware, DispatchFailure.executionTimeout(pipeline.getTimeoutMillis()));
        } catch (ExecutionException e) {
            return fail(pipeline, middleware, DispatchFailure.executionFailed(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(pipeline, middleware, DispatchFailure.executionFailed(e));
        }
    }

    private ExecutionResult execute(Aggregate<?> aggregate, String streamId, ExecutionContext context,
                                    Pipeline pipeline)
            throws InterruptedException, ExecutionException, TimeoutException {
        while (true) {
            AggregateInstance<?> instance = router.registry().getOrStart(aggregate, streamId);
            try {
                return await(instance.execute(context), pipeline.remainingMillis());
            } catch (ExecutionException e) {
                if (!isStop(e.getCause())) {
                    throw e;
                }
                logger.debug("Aggregate {} stopped before executing {}, restarting", instance.getKey(),
                        pipeline.getCommand());
            }
        }
    }

    private static boolean isStop(Throwable t) {
        return t instanceof AggregateTerminatedException && ((AggregateTerminatedException) t).isStopped();
    }

    private DispatchResult executePlain(Pipeline pipeline, Route route, List<Middleware> middleware) {
        Map<String, Object> assigns = pipeline.getAssigns();
        Future<Object> execution = router.registry().getConfiguration().executorService()
                .submit(() -> route.getFunction().invoke(pipeline.getCommand(), assigns));
        try {
            Object result = await(execution, pipeline.remainingMillis());
            afterDispatch(pipeline, middleware);
            return pipeline.getResponse().orElseGet(() -> DispatchResult.value(result));
        } catch (TimeoutException e) {
            logger.warn("Plain handler of {} timed out", pipeline.getCommand());
            return fail(pipeline, middleware, DispatchFailure.executionTimeout(pipeline.getTimeoutMillis()));
        } catch (ExecutionException e) {
            return fail(pipeline, middleware, DispatchFailure.executionFailed(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(pipeline, middleware, DispatchFailure.executionFailed(e));
        }
    }

    private static <T> T await(Future<T> future, long timeoutMillis)
            throws InterruptedException, ExecutionException, TimeoutException {
        if (timeoutMillis == DispatchOptions.INFINITY) {
            return future.get();
        }
        return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    private static DispatchResult shape(ExecutionResult result, DispatchOptions options) {
        if (options.isIncludeExecutionResult()) {
            return DispatchResult.ok(result);
        } else if (options.isIncludeAggregateVersion()) {
            return DispatchResult.ok(result.getAggregateVersion());
        } else {
            return DispatchResult.ok();
        }
    }

    private DispatchResult fail(Pipeline pipeline, List<Middleware> middleware, DispatchFailure failure) {
        logger.debug("Dispatch of {} failed: {}", pipeline, failure, failure.getCause().orElse(null));
        pipeline.failed(failure);
        afterFailure(pipeline, middleware);
        return pipeline.getResponse().orElseGet(() -> DispatchResult.failed(failure));
    }

    private static void afterDispatch(Pipeline pipeline, List<Middleware> middleware) {
        ListIterator<Middleware> it = middleware.listIterator(middleware.size());
        while (it.hasPrevious()) {
            it.previous().afterDispatch(pipeline);
        }
    }

    private static void afterFailure(Pipeline pipeline, List<Middleware> middleware) {
        ListIterator<Middleware> it = middleware.listIterator(middleware.size());
        while (it.hasPrevious()) {
            it.previous().afterFailure(pipeline);
        }
    }
}
