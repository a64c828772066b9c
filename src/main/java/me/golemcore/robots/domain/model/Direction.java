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

import java.util.Locale;

/**
 * Unit movement directions. {@code UP} increases {@code y}, {@code RIGHT}
 * increases {@code x}.
 */
public enum Direction {

    UP(0, 1), DOWN(0, -1), LEFT(-1, 0), RIGHT(1, 0);

    private final int dx;
    private final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public int getDx() {
        return dx;
    }

    public int getDy() {
        return dy;
    }

    /**
     * Lower-case name used on the wire and in action records.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value ({@code up}, {@code down}, {@code left},
     * {@code right}). Matching is exact and case-sensitive.
     *
     * @throws RobotOperationException
     *             with {@link RobotFailureKind#INVALID_ARGUMENT} for any other
     *             value
     */
    public static Direction fromValue(String value) {
        if (value != null) {
            for (Direction direction : values()) {
                if (direction.value().equals(value)) {
                    return direction;
                }
            }
        }
        throw new RobotOperationException(RobotFailureKind.INVALID_ARGUMENT,
                "direction must be one of [up, down, left, right], got: " + value);
    }
}
