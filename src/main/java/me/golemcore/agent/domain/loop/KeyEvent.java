package me.golemcore.agent.domain.loop;

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
 * Key press delivered by a terminal front end.
 */
public record KeyEvent(String key, boolean control) {

    public static final String ESCAPE = "Escape";

    public static KeyEvent escape() {
        return new KeyEvent(ESCAPE, false);
    }

    public static KeyEvent ctrl(String key) {
        return new KeyEvent(key, true);
    }

    public boolean isCancel() {
        return ESCAPE.equalsIgnoreCase(key) || (control && "c".equalsIgnoreCase(key));
    }
}
