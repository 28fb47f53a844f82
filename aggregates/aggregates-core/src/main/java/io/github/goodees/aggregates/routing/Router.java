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

import io.github.goodees.aggregates.Aggregate;
import io.github.goodees.aggregates.dispatch.Consistency;
import io.github.goodees.aggregates.dispatch.DispatchOptions;
import io.github.goodees.aggregates.dispatch.DispatchResult;
import io.github.goodees.aggregates.dispatch.Dispatcher;
import io.github.goodees.aggregates.instance.AggregateLifespan;
import io.github.goodees.aggregates.instance.AggregateRegistry;
import io.github.goodees.aggregates.instance.DefaultLifespan;
import io.github.goodees.aggregates.instance.HandlerFunction;
import io.github.goodees.aggregates.middleware.ConsistencyGuarantee;
import io.github.goodees.aggregates.middleware.ExtractAggregateIdentity;
import io.github.goodees.aggregates.middleware.Middleware;
import io.github.goodees.aggregates.subscription.ProgressTracker;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Routes commands to aggregates and plain handlers. The router is built once, all routes are validated when
 * they are registered or when the router is built.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Router router = Router.builder(registry)
 *     .middleware(new CommandLogger())
 *     .identify(bankAccount, "accountNumber", "bank-account-")
 *     .dispatch(OpenAccount.class, route -> route.to(bankAccount))
 *     .dispatch(DepositMoney.class, route -> route.to(new DepositMoneyHandler()).aggregate(bankAccount))
 *     .build();
 *
 * DispatchResult result = router.dispatch(openAccount);
 * }</pre>
 *
 * <p>Command routed directly to an aggregate is executed by the aggregate's method {@code execute(state, command)}.
 * Commands routed to a handler for an aggregate are executed by the handler's method {@code handle(state, command)}.
 * Commands routed to a handler {@linkplain RouteBuilder#withoutAggregate() without aggregate} are executed by its
 * method {@code handle(command, assigns)}. Function name can be changed with {@link RouteBuilder#function(String)}.</p>
 *
 * <p>Commands are matched by their class. When there is no route for the class, its superclasses and interfaces are
 * looked up, so routes can be registered for abstract value types.</p>
 */
public final class Router {
    public static final long DEFAULT_TIMEOUT = 5000;
    public static final Consistency DEFAULT_CONSISTENCY = Consistency.EVENTUAL;

    private final Map<Class<?>, Route> routes;
    private final ConcurrentMap<Class<?>, Optional<Route>> resolvedRoutes = new ConcurrentHashMap<>();
    private final List<Middleware> middleware;
    private final AggregateRegistry registry;
    private final Dispatcher dispatcher;

    private Router(Map<Class<?>, Route> routes, List<Middleware> middleware, AggregateRegistry registry) {
        this.routes = Collections.unmodifiableMap(routes);
        this.middleware = Collections.unmodifiableList(middleware);
        this.registry = registry;
        this.dispatcher = new Dispatcher(this);
    }

    public static Builder builder(AggregateRegistry registry) {
        return new Builder(registry);
    }

    /**
     * Dispatch command with route defaults.
     * @param command the command
     * @return result of the dispatch
     * @see Dispatcher#dispatch(Object, DispatchOptions)
     */
    public DispatchResult dispatch(Object command) {
        return dispatcher.dispatch(command, DispatchOptions.defaults());
    }

    /**
     * Dispatch command with specific timeout.
     * @param command the command
     * @param timeoutMillis timeout in milliseconds or {@link DispatchOptions#INFINITY}
     * @return result of the dispatch
     */
    public DispatchResult dispatch(Object command, long timeoutMillis) {
        return dispatcher.dispatch(command, DispatchOptions.timeout(timeoutMillis));
    }

    public DispatchResult dispatch(Object command, DispatchOptions options) {
        return dispatcher.dispatch(command, options);
    }

    /**
     * Find route for a command type.
     * @param commandType type of command
     * @return the route registered for the type or its nearest supertype
     */
    public Optional<Route> route(Class<?> commandType) {
        return resolvedRoutes.computeIfAbsent(commandType, this::lookup);
    }

    private Optional<Route> lookup(Class<?> commandType) {
        Deque<Class<?>> types = new ArrayDeque<>();
        types.add(commandType);
        while (!types.isEmpty()) {
            Class<?> type = types.poll();
            Route route = routes.get(type);
            if (route != null) {
                return Optional.of(route);
            }
            if (type.getSuperclass() != null) {
                types.add(type.getSuperclass());
            }
            Collections.addAll(types, type.getInterfaces());
        }
        return Optional.empty();
    }

    public Map<Class<?>, Route> routes() {
        return routes;
    }

    /**
     * Middleware of the router, registered ones followed by {@link ExtractAggregateIdentity} and
     * {@link ConsistencyGuarantee}.
     * @return all middleware in order of before-dispatch hooks
     */
    public List<Middleware> middleware() {
        return middleware;
    }

    public AggregateRegistry registry() {
        return registry;
    }

    public static class Builder {
        private final AggregateRegistry registry;
        private final List<Middleware> middleware = new ArrayList<>();
        private final Map<String, Identification> identities = new HashMap<>();
        private final Map<Class<?>, RouteBuilder> routes = new LinkedHashMap<>();
        private ProgressTracker progressTracker = ProgressTracker.NONE;
        private long consistencyPollInterval = ConsistencyGuarantee.DEFAULT_POLL_INTERVAL;

        private Builder(AggregateRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "Registry must be specified");
        }

        /**
         * Add middleware. Middleware run in order they are added.
         * @param middleware the middleware
         * @return this
         */
        public Builder middleware(Middleware middleware) {
            this.middleware.add(Objects.requireNonNull(middleware));
            return this;
        }

        public Builder identify(Aggregate<?> aggregate, String by) {
            return identify(aggregate, by, null);
        }

        /**
         * Define identity of an aggregate for all routes to it, that do not define identity themselves.
         * @param aggregate the aggregate
         * @param by name of the identity property of the commands
         * @param prefix prefix of stream identity, may be null
         * @return this
         * @throws RouterConfigurationException when the aggregate already has been identified
         */
        public Builder identify(Aggregate<?> aggregate, String by, String prefix) {
            Objects.requireNonNull(by, "Identity field must be specified");
            if (identities.putIfAbsent(aggregate.aggregateType(), new Identification(by, prefix)) != null) {
                throw new RouterConfigurationException("Aggregate " + aggregate.aggregateType()
                        + " has already been identified");
            }
            return this;
        }

        /**
         * Progress tracker the strongly consistent dispatches wait on.
         * @param progressTracker the tracker
         * @return this
         */
        public Builder progressTracker(ProgressTracker progressTracker) {
            this.progressTracker = Objects.requireNonNull(progressTracker);
            return this;
        }

        public Builder consistencyPollInterval(long millis) {
            this.consistencyPollInterval = millis;
            return this;
        }

        /**
         * Register a route for a command type.
         * @param commandType type of command
         * @param definition configures the route
         * @return this
         * @throws RouterConfigurationException when the command type is already registered or the handler does not
         *          have the handler function
         */
        public Builder dispatch(Class<?> commandType, Consumer<RouteBuilder> definition) {
            if (routes.containsKey(commandType)) {
                throw new RouterConfigurationException("Duplicate command registration for: " + commandType.getName());
            }
            RouteBuilder route = new RouteBuilder(commandType);
            definition.accept(route);
            route.resolveFunction();
            routes.put(commandType, route);
            return this;
        }

        /**
         * Register same route for multiple command types.
         * @param commandTypes types of command
         * @param definition configures the route, called once per command type
         * @return this
         */
        public Builder dispatch(List<Class<?>> commandTypes, Consumer<RouteBuilder> definition) {
            commandTypes.forEach(type -> dispatch(type, definition));
            return this;
        }

        public Router build() {
            Map<Class<?>, Route> built = new LinkedHashMap<>();
            routes.forEach((type, route) -> built.put(type, route.build(identities)));
            List<Middleware> chain = new ArrayList<>(middleware);
            chain.add(new ExtractAggregateIdentity());
            chain.add(new ConsistencyGuarantee(progressTracker, consistencyPollInterval));
            return new Router(built, chain, registry);
        }
    }

    static class Identification {
        final String by;
        final String prefix;

        Identification(String by, String prefix) {
            this.by = by;
            this.prefix = prefix;
        }
    }

    /**
     * Definition of single route.
     */
    public static class RouteBuilder {
        private final Class<?> commandType;
        private Object handler;
        private Aggregate<?> aggregate;
        private boolean plain;
        private String functionName;
        private HandlerFunction function;
        private String identityField;
        private IdentityExtractor identityExtractor;
        private String identityPrefix;
        private Consistency consistency = DEFAULT_CONSISTENCY;
        private long timeout = DEFAULT_TIMEOUT;
        private AggregateLifespan lifespan = DefaultLifespan.INSTANCE;
        private final Map<String, Object> assigns = new LinkedHashMap<>();

        RouteBuilder(Class<?> commandType) {
            this.commandType = commandType;
        }

        /**
         * Target of the command, either an {@link Aggregate}, or a handler when combined with
         * {@link #aggregate(Aggregate)} or {@link #withoutAggregate()}.
         * @param handlerOrAggregate the target
         * @return this
         */
        public RouteBuilder to(Object handlerOrAggregate) {
            this.handler = Objects.requireNonNull(handlerOrAggregate);
            return this;
        }

        public RouteBuilder aggregate(Aggregate<?> aggregate) {
            this.aggregate = Objects.requireNonNull(aggregate);
            this.plain = false;
            return this;
        }

        public RouteBuilder withoutAggregate() {
            this.aggregate = null;
            this.plain = true;
            return this;
        }

        public RouteBuilder function(String name) {
            this.functionName = Objects.requireNonNull(name);
            return this;
        }

        public RouteBuilder identity(String field) {
            this.identityField = Objects.requireNonNull(field);
            this.identityExtractor = null;
            return this;
        }

        public <C> RouteBuilder identity(Function<C, ?> extractor) {
            Objects.requireNonNull(extractor);
            this.identityExtractor = command -> extractor.apply((C) command);
            this.identityField = null;
            return this;
        }

        public RouteBuilder identityPrefix(String prefix) {
            this.identityPrefix = Objects.requireNonNull(prefix);
            return this;
        }

        public RouteBuilder consistency(Consistency consistency) {
            this.consistency = Objects.requireNonNull(consistency);
            return this;
        }

        public RouteBuilder timeout(long timeoutMillis) {
            if (timeoutMillis < 0 && timeoutMillis != DispatchOptions.INFINITY) {
                throw new RouterConfigurationException("Invalid timeout " + timeoutMillis + " for "
                        + commandType.getName());
            }
            this.timeout = timeoutMillis;
            return this;
        }

        public RouteBuilder lifespan(AggregateLifespan lifespan) {
            this.lifespan = Objects.requireNonNull(lifespan);
            return this;
        }

        public RouteBuilder assign(String key, Object value) {
            this.assigns.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
            return this;
        }

        void resolveFunction() {
            if (handler == null) {
                throw new RouterConfigurationException("Route for " + commandType.getName() + " has no target");
            }
            if (plain) {
                String name = functionName != null ? functionName : "handle";
                function = HandlerMethods.plainFunction(handler, name, commandType);
                functionName = name;
            } else if (aggregate != null) {
                String name = functionName != null ? functionName : "handle";
                function = HandlerMethods.aggregateFunction(handler, name, commandType);
                functionName = name;
            } else if (handler instanceof Aggregate) {
                aggregate = (Aggregate<?>) handler;
                String name = functionName != null ? functionName : "execute";
                function = HandlerMethods.aggregateFunction(handler, name, commandType);
                functionName = name;
            } else {
                throw new RouterConfigurationException("Handler " + handler.getClass().getName() + " for "
                        + commandType.getName() + " is not an aggregate, and does not specify aggregate");
            }
        }

        Route build(Map<String, Identification> identities) {
            if (plain) {
                return new Route(commandType, handler, functionName, function, null, null, "",
                        consistency, timeout, lifespan, assigns);
            }
            Identification identification = identities.get(aggregate.aggregateType());
            IdentityExtractor extractor = identityExtractor;
            if (extractor == null) {
                String field = identityField != null ? identityField
                        : identification != null ? identification.by : null;
                if (field == null) {
                    throw new RouterConfigurationException("Route for " + commandType.getName()
                            + " defines no identity, and aggregate " + aggregate.aggregateType()
                            + " is not identified");
                }
                extractor = IdentityExtractor.forField(commandType, field);
            }
            String prefix = identityPrefix != null ? identityPrefix
                    : identification != null && identification.prefix != null ? identification.prefix : "";
            return new Route(commandType, handler, functionName, function, aggregate, extractor, prefix,
                    consistency, timeout, lifespan, assigns);
        }
    }
}
