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

import java.util.Optional;

/**
 * Reason of unsuccessful dispatch.
 */
public final class DispatchFailure {
    public enum Kind {
        /**
         * No route is registered for the type of command.
         */
        UNREGISTERED_COMMAND,
        /**
         * Aggregate identity could not be extracted from the command.
         */
        INVALID_AGGREGATE_IDENTITY,
        /**
         * Handler failed, store rejected the events, or the aggregate could not be loaded. Cause is attached.
         */
        EXECUTION_FAILED,
        EXECUTION_TIMEOUT,
        /**
         * Events were persisted, but strongly consistent handlers did not process them in time.
         */
        CONSISTENCY_TIMEOUT,
        /**
         * A middleware halted the dispatch. The reason is the one given by the middleware.
         */
        HALTED
    }

    private final Kind kind;
    private final Object reason;
    private final Throwable cause;

    private DispatchFailure(Kind kind, Object reason, Throwable cause) {
        this.kind = kind;
        this.reason = reason;
        this.cause = cause;
    }

    public static DispatchFailure unregisteredCommand(Object command) {
        return new DispatchFailure(Kind.UNREGISTERED_COMMAND, "Unregistered command " + command.getClass().getName(),
                null);
    }

    public static DispatchFailure invalidAggregateIdentity(Object command) {
        return new DispatchFailure(Kind.INVALID_AGGREGATE_IDENTITY, "No aggregate identity in " + command, null);
    }

    public static DispatchFailure executionFailed(Throwable cause) {
        return new DispatchFailure(Kind.EXECUTION_FAILED, String.valueOf(cause.getMessage()), cause);
    }

    public static DispatchFailure executionTimeout(long timeoutMillis) {
        return new DispatchFailure(Kind.EXECUTION_TIMEOUT, "Execution did not complete within " + timeoutMillis
                + " ms", null);
    }

    public static DispatchFailure consistencyTimeout(String handlerName) {
        return new DispatchFailure(Kind.CONSISTENCY_TIMEOUT, "Handler " + handlerName
                + " did not process the events in time", null);
    }

    public static DispatchFailure halted(Object reason) {
        return new DispatchFailure(Kind.HALTED, reason, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Description of the failure. For halted dispatches it is exactly the reason the middleware halted with.
     * @return the reason
     */
    public Object getReason() {
        return reason;
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return "DispatchFailure[" + kind + ": " + reason + "]";
    }
}
