package dev.mars.packsync.core.exceptions;

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

/**
 * Raised when a caller invokes an operation the runner or chain cannot accept in its
 * current state, for example {@code start} while a run is in flight or {@code retryFailed}
 * with nothing to retry. The rejected call leaves all state untouched.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class InvalidOperationStateException extends PackSyncException {

    private final String operation;
    private final Enum<?> currentState;
    private final String requestedAction;

    public InvalidOperationStateException(String operation, Enum<?> currentState, String requestedAction) {
        this(operation, currentState, requestedAction, null);
    }

    public InvalidOperationStateException(String operation, Enum<?> currentState, String requestedAction,
                                          String detail) {
        super(formatMessage(operation, currentState, requestedAction, detail));
        this.operation = operation;
        this.currentState = currentState;
        this.requestedAction = requestedAction;
    }

    public String getOperation() {
        return operation;
    }

    public Enum<?> getCurrentState() {
        return currentState;
    }

    public String getRequestedAction() {
        return requestedAction;
    }

    private static String formatMessage(String operation, Enum<?> currentState, String requestedAction,
                                        String detail) {
        String message = String.format("Cannot %s '%s' while %s", requestedAction, operation, currentState);
        return detail == null ? message : message + ": " + detail;
    }
}
