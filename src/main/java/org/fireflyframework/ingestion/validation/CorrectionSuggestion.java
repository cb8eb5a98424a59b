/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.ingestion.validation;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Advisory correction hints for a field value. Never applied automatically.
 */
@Data
@Builder
public class CorrectionSuggestion {

    private final String field;
    private final Object originalValue;
    @Builder.Default
    private final List<String> suggestions = List.of();
    @Builder.Default
    private final Map<String, Object> context = Map.of();

    public boolean hasSuggestions() {
        return !suggestions.isEmpty();
    }
}
