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

/**
 * Consistency of command dispatch.
 */
public enum Consistency {
    /**
     * Dispatch returns as soon as the produced events are persisted.
     */
    EVENTUAL,
    /**
     * Dispatch returns after all strongly consistent event handlers processed the produced events.
     */
    STRONG
}
