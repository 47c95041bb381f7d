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

package dev.mars.sequor.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a step returns when it finishes: a success flag, an output map and,
 * for failures, a message. Throwing from {@link Step#execute} is equivalent to
 * returning {@link #failure(String)} with the exception message.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-28
 */
public final class StepOutput {

    private final boolean success;
    private final Map<String, Object> data;
    private final String message;

    private StepOutput(boolean success, Map<String, Object> data, String message) {
        this.success = success;
        this.data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
        this.message = message;
    }

    public static StepOutput success(Map<String, Object> data) {
        return new StepOutput(true, data, null);
    }

    public static StepOutput success() {
        return new StepOutput(true, Map.of(), null);
    }

    public static StepOutput failure(String message) {
        return new StepOutput(false, Map.of(), message);
    }

    public static StepOutput failure(String message, Map<String, Object> data) {
        return new StepOutput(false, data, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "StepOutput{success=" + success + ", data=" + data + (message != null ? ", message='" + message + '\'' : "") + '}';
    }
}
