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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * The attributes a domain code token stands for.
 */
@Immutable
public class DomainCode {

    private final String language;

    @Nullable
    private final String domain;

    private final boolean mobile;

    public DomainCode(String language, @Nullable String domain, boolean mobile) {
        this.language = language;
        this.domain = domain;
        this.mobile = mobile;
    }

    public String getLanguage() {
        return language;
    }

    /**
     * @return the project domain, e.g. {@code wikipedia.org}, or null if the
     *   token could not be decoded
     */
    @Nullable
    public String getDomain() {
        return domain;
    }

    public boolean isMobile() {
        return mobile;
    }

    public boolean isKnown() {
        return domain != null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DomainCode)) return false;
        DomainCode other = (DomainCode) obj;
        return mobile == other.mobile
            && Objects.equal(language, other.language)
            && Objects.equal(domain, other.domain);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(language, domain, mobile);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("language", language)
            .add("domain", domain)
            .add("mobile", mobile)
            .toString();
    }
}
