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

package dev.mars.convoy.variables;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Position of the current iteration, visible to templates as {@code loop.index},
 * {@code loop.count}, {@code loop.first}, {@code loop.last} and {@code loop.item}.
 *
 * @param index zero-based iteration index
 * @param count total iterations planned, or -1 when unknown (while loops)
 * @param item current element for array and element loops, otherwise {@code null}
 */
public record LoopContext(int index, int count, Object item) {

    public boolean first() {
        return index == 0;
    }

    public boolean last() {
        return count >= 0 && index == count - 1;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("index", index);
        map.put("count", count);
        map.put("first", first());
        map.put("last", last());
        map.put("item", item);
        return map;
    }
}
