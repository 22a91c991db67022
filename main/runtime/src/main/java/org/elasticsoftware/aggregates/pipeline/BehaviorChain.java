/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.aggregates.pipeline;

import java.util.List;
import java.util.function.Consumer;

public class BehaviorChain {
    private final List<Behavior> behaviors;

    public BehaviorChain(List<Behavior> behaviors) {
        this.behaviors = List.copyOf(behaviors);
    }

    public void invoke(IncomingContext context, Consumer<IncomingContext> handler) {
        invoke(0, context, handler);
    }

    private void invoke(int index, IncomingContext context, Consumer<IncomingContext> handler) {
        if (index == behaviors.size()) {
            handler.accept(context);
        } else {
            behaviors.get(index).invoke(context, () -> invoke(index + 1, context, handler));
        }
    }
}
