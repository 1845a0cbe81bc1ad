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
 * Suffixes a domain code can carry after its language prefix, and the
 * project each of them selects.
 * <p>
 * {@link #NONE} stands for a bare language code such as {@code en}, which is
 * the desktop site of the main encyclopedia. {@code m} is the mobile marker
 * of that same site. The other suffixes select a companion project.
 * <p>
 * See https://wikitech.wikimedia.org/wiki/Data_Platform/Data_Lake/Traffic/Pageviews
 */
public enum ProjectSuffix {

    NONE(null, "wikipedia.org", false),
    MOBILE("m", "wikipedia.org", true),

    WIKIBOOKS("b", "wikibooks.org", false),
    WIKTIONARY("d", "wiktionary.org", false),
    WIKIMEDIA_FOUNDATION("f", "wikimediafoundation.org", false),
    WIKINEWS("n", "wikinews.org", false),
    WIKIQUOTE("q", "wikiquote.org", false),
    WIKISOURCE("s", "wikisource.org", false),
    WIKIVERSITY("v", "wikiversity.org", false),
    WIKIVOYAGE("voy", "wikivoyage.org", false),
    MEDIAWIKI("w", "mediawiki.org", false),
    WIKIDATA("wd", "wikidata.org", false);

    private static final Map<String, ProjectSuffix> BY_CODE = new HashMap<>();

    static {
        for (ProjectSuffix suffix : values()) {
            if (suffix.code != null) {
                BY_CODE.put(suffix.code, suffix);
            }
        }
    }

    private final String code;
    private final String domain;
    private final boolean mobile;

    ProjectSuffix(String code, String domain, boolean mobile) {
        this.code = code;
        this.domain = domain;
        this.mobile = mobile;
    }

    public String getCode() {
        return code;
    }

    public String getDomain() {
        return domain;
    }

    public boolean isMobile() {
        return mobile;
    }

    /**
     * Looks up the suffix written after the separator of a domain code.
     *
     * @param code the suffix, or null when the domain code has no separator
     * @return the matching suffix, or null if the code is not a known one
     */
    public static ProjectSuffix fromCode(String code) {
        if (code == null) {
            return NONE;
        }
        return BY_CODE.get(code);
    }
}
