package me.golemcore.robots.domain.model;

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

/**
 * Raised when a robot operation is rejected. The registry state is unchanged
 * when this is thrown.
 */
public class RobotOperationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final RobotFailureKind kind;

    public RobotOperationException(RobotFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RobotFailureKind getKind() {
        return kind;
    }

    public static RobotOperationException notFound(String robotId) {
        return new RobotOperationException(RobotFailureKind.NOT_FOUND, "Robot not found: " + robotId);
    }

    public static RobotOperationException invalidArgument(String message) {
        return new RobotOperationException(RobotFailureKind.INVALID_ARGUMENT, message);
    }
}
