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
 * Integer grid coordinate of a robot. The grid is unbounded.
 */
public record Position(int x, int y) {

    public static final Position ORIGIN = new Position(0, 0);

    /**
     * @throws ArithmeticException
     *             when the step would leave the {@code int} range
     */
    public Position step(Direction direction) {
        return new Position(Math.addExact(x, direction.getDx()), Math.addExact(y, direction.getDy()));
    }
}
