/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.convoy.workflow.action;

import dev.mars.convoy.variables.ValueConversions;
import dev.mars.convoy.workflow.ExecutionContext;

import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * {@code wait-time}: pauses for {@code duration} seconds, varied by up to
 * {@code randomVariation} seconds either way. Never waits less than 100ms when varied.
 * The wait ends early if the run is cancelled.
 */
public class WaitTimeAction implements Action {

    public static final String TYPE = "wait-time";

    private static final long MIN_VARIED_MS = 100;
    private static final long SLICE_MS = 50;

    @Override
    public ActionResult execute(ExecutionContext context, Map<String, Object> config) throws InterruptedException {
        double seconds = ValueConversions.toNumber(config.get("duration")).orElse(1.0);
        double variation = ValueConversions.toNumber(config.get("randomVariation")).orElse(0.0);

        long durationMs = Math.round(seconds * 1000);
        if (variation > 0) {
            long variationMs = Math.round(variation * 1000);
            durationMs += ThreadLocalRandom.current().nextLong(-variationMs, variationMs + 1);
            durationMs = Math.max(MIN_VARIED_MS, durationMs);
        }

        long deadline = System.currentTimeMillis() + durationMs;
        long remaining = durationMs;
        while (remaining > 0 && !context.isCancelled()) {
            TimeUnit.MILLISECONDS.sleep(Math.min(SLICE_MS, remaining));
            remaining = deadline - System.currentTimeMillis();
        }
        return ActionResult.success(Map.of("duration", durationMs));
    }
}
