/**
 * Copyright (C) 2024  Wikimedia Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.wikimedia.analytics.pvstream.core.domain;

import java.util.HashMap;
import java.util.Map;

/**
 * Projects hosted under wikimedia.org. Their domain code starts with the
 * project name instead of a language code, e.g. {@code commons.m}.
 */
public enum WikimediaProject {

    COMMONS("commons"),
    META("meta"),
    INCUBATOR("incubator"),
    SPECIES("species"),
    STRATEGY("strategy"),
    OUTREACH("outreach"),
    USABILITY("usability"),
    QUALITY("quality");

    private static final Map<String, WikimediaProject> BY_NAME = new HashMap<>();

    static {
        for (WikimediaProject project : values()) {
            BY_NAME.put(project.name, project);
        }
    }

    private final String name;

    WikimediaProject(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public String getDomain() {
        return name + ".wikimedia.org";
    }

    public static WikimediaProject fromName(String name) {
        return BY_NAME.get(name);
    }
}
