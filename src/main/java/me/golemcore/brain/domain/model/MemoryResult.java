package me.golemcore.brain.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a brain operation: either a value or a categorized failure.
 * Validation and integrity problems are returned here rather than thrown.
 */
@Data
@Builder
public class MemoryResult<T> {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private T value;
    private MemoryFailureKind failureKind;
    private String error;

    public static <T> MemoryResult<T> success(T value) {
        return MemoryResult.<T>builder()
                .success(true)
                .value(value)
                .build();
    }

    public static <T> MemoryResult<T> failure(MemoryFailureKind kind, String error) {
        return MemoryResult.<T>builder()
                .success(false)
                .failureKind(kind)
                .error(error)
                .build();
    }

    public static <T> MemoryResult<T> validation(String error) {
        return failure(MemoryFailureKind.VALIDATION, error);
    }

    public static <T> MemoryResult<T> integrity(String error) {
        return failure(MemoryFailureKind.INTEGRITY, error);
    }

    /**
     * Re-type a failed result.
     */
    public <R> MemoryResult<R> asFailure() {
        if (success) {
            throw new IllegalStateException("Result is not a failure");
        }
        return failure(failureKind, error);
    }
}
