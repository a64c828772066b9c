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
 * Kinds of completed transitions recorded in a robot's action log.
 */
public enum ActionKind {

    MOVE("move"),
    PATCH("patch"),
    PICKUP("pickup"),
    PUTDOWN("putdown"),
    ATTACK_OUTGOING("attack-outgoing"),
    ATTACK_INCOMING("attack-incoming");

    private final String value;

    ActionKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
