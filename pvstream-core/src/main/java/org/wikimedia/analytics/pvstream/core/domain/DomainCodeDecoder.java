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

/**
 * Decodes the domain code token of a pageview dump line into language,
 * project domain and mobile flag.
 * <p>
 * A token is a language (or Wikimedia project) prefix, optionally followed by
 * a single {@code .} and a {@link ProjectSuffix} code:
 * <ul>
 *   <li>{@code en}: English Wikipedia, desktop</li>
 *   <li>{@code en.m}: English Wikipedia, mobile</li>
 *   <li>{@code fr.b}: French Wikibooks</li>
 *   <li>{@code commons}, {@code commons.m}: commons.wikimedia.org, language en</li>
 *   <li>{@code ""}: the quoted empty token, used for wikifunctions.org</li>
 * </ul>
 * Any other token, including tokens with more than one separator, an empty
 * prefix or an unknown suffix, decodes to the raw prefix as language, no
 * domain and {@code mobile = false}. Decoding never fails.
 */
public class DomainCodeDecoder {

    static final String QUOTED_EMPTY_CODE = "\"\"";

    static final DomainCode WIKIFUNCTIONS = new DomainCode("en", "wikifunctions.org", false);

    private static final String WIKIMEDIA_PROJECT_LANGUAGE = "en";

    private static final char SEPARATOR = '.';

    private DomainCodeDecoder() {}

    public static DomainCode decode(String domainCode) {
        if (QUOTED_EMPTY_CODE.equals(domainCode)) {
            return WIKIFUNCTIONS;
        }

        int separator = domainCode.indexOf(SEPARATOR);
        String prefix = separator < 0 ? domainCode : domainCode.substring(0, separator);
        if (prefix.isEmpty()) {
            return unknown(prefix);
        }
        if (separator >= 0 && domainCode.indexOf(SEPARATOR, separator + 1) >= 0) {
            return unknown(prefix);
        }

        ProjectSuffix suffix = ProjectSuffix.fromCode(
            separator < 0 ? null : domainCode.substring(separator + 1));
        if (suffix == null) {
            return unknown(prefix);
        }

        WikimediaProject project = WikimediaProject.fromName(prefix);
        if (project != null) {
            if (suffix != ProjectSuffix.NONE && suffix != ProjectSuffix.MOBILE) {
                return unknown(prefix);
            }
            return new DomainCode(WIKIMEDIA_PROJECT_LANGUAGE, project.getDomain(), suffix.isMobile());
        }

        return new DomainCode(prefix, suffix.getDomain(), suffix.isMobile());
    }

    static DomainCode unknown(String prefix) {
        return new DomainCode(prefix, null, false);
    }
}
