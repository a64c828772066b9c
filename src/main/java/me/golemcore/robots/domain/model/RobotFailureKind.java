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
 * Classification of robot operation failures. Every failure is detected before
 * any state is mutated.
 */
public enum RobotFailureKind {

    /**
     * Unknown robot reference.
     */
    NOT_FOUND,

    /**
     * Malformed direction, non-positive pagination, self-targeted attack, blank
     * identifiers.
     */
    INVALID_ARGUMENT,

    /**
     * The robot cannot pay the energy cost of the action.
     */
    INSUFFICIENT_ENERGY,

    /**
     * A robot with zero energy tried to initiate an action.
     */
    INCAPACITATED_ACTOR,

    /**
     * Item already held by a robot, or robot id already registered.
     */
    CONFLICT,

    /**
     * Putdown of an item the robot does not hold.
     */
    NOT_HELD
}
