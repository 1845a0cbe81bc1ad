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

package org.wikimedia.analytics.pvstream.orc;

import org.apache.orc.TypeDescription;

/**
 * Column layout of a pageview ORC file. Column order matches the fields of
 * {@link org.wikimedia.analytics.pvstream.core.PageviewRow}.
 */
public final class PageviewOrcSchema {

    public static final String DOMAIN_CODE = "domain_code";
    public static final String PAGE_TITLE = "page_title";
    public static final String VIEWS = "views";
    public static final String LANGUAGE = "language";
    public static final String DOMAIN = "domain";
    public static final String MOBILE = "mobile";

    static final int DOMAIN_CODE_COLUMN = 0;
    static final int PAGE_TITLE_COLUMN = 1;
    static final int VIEWS_COLUMN = 2;
    static final int LANGUAGE_COLUMN = 3;
    static final int DOMAIN_COLUMN = 4;
    static final int MOBILE_COLUMN = 5;

    /**
     * ORC has no unsigned integers: views are stored as a non-negative
     * bigint. Only domain is ever null.
     */
    public static final TypeDescription SCHEMA = TypeDescription.createStruct()
        .addField(DOMAIN_CODE, TypeDescription.createString())
        .addField(PAGE_TITLE, TypeDescription.createString())
        .addField(VIEWS, TypeDescription.createLong())
        .addField(LANGUAGE, TypeDescription.createString())
        .addField(DOMAIN, TypeDescription.createString())
        .addField(MOBILE, TypeDescription.createBoolean());

    private PageviewOrcSchema() {
    }

    /**
     * @return a fresh copy of the schema, safe to hand to ORC
     */
    public static TypeDescription create() {
        return SCHEMA.clone();
    }
}
