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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@code random-number}: draws a number in [{@code min}, {@code max}) rounded to
 * {@code decimals} places and stores it under {@code variable} (or {@code saveAs}).
 */
public class RandomNumberAction implements Action {

    public static final String TYPE = "random-number";

    @Override
    public ActionResult execute(ExecutionContext context, Map<String, Object> config) {
        double min = ValueConversions.toNumber(config.get("min")).orElse(0.0);
        double max = ValueConversions.toNumber(config.get("max")).orElse(100.0);
        int decimals = Math.max(0, ValueConversions.toInt(config.get("decimals"), 0));
        if (max < min) {
            return ActionResult.failure("max must not be less than min");
        }

        double draw = max > min ? ThreadLocalRandom.current().nextDouble(min, max) : min;
        Number number;
        if (decimals == 0) {
            number = (long) Math.floor(draw);
        } else {
            number = BigDecimal.valueOf(draw).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
        }

        Object target = config.containsKey("variable") ? config.get("variable") : config.get("saveAs");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("number", number);
        if (target != null && !target.toString().isBlank()) {
            context.getVariables().set(target.toString(), number);
            data.put("variable", target.toString());
        }
        return ActionResult.success(data);
    }
}
