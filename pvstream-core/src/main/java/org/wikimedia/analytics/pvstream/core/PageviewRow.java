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

package org.wikimedia.analytics.pvstream.core;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import org.wikimedia.analytics.pvstream.core.domain.DomainCode;

/**
 * One line of an hourly pageview dump: the view count of one page of one
 * site for that hour, along with the attributes decoded from its domain code.
 */
@Immutable
public class PageviewRow {

    public static final long MAX_VIEWS = 0xFFFFFFFFL;

    private final String domainCode;
    private final String pageTitle;
    private final long views;
    private final String language;
    @Nullable
    private final String domain;
    private final boolean mobile;

    public PageviewRow(String domainCode, String pageTitle, long views, DomainCode decoded) {
        this(domainCode, pageTitle, views, decoded.getLanguage(), decoded.getDomain(), decoded.isMobile());
    }

    public PageviewRow(
        String domainCode,
        String pageTitle,
        long views,
        String language,
        @Nullable String domain,
        boolean mobile
    ) {
        Preconditions.checkArgument(views >= 0 && views <= MAX_VIEWS, "views out of range: %s", views);
        this.domainCode = Preconditions.checkNotNull(domainCode);
        this.pageTitle = Preconditions.checkNotNull(pageTitle);
        this.views = views;
        this.language = Preconditions.checkNotNull(language);
        this.domain = domain;
        this.mobile = mobile;
    }

    public String getDomainCode() {
        return domainCode;
    }

    public String getPageTitle() {
        return pageTitle;
    }

    public long getViews() {
        return views;
    }

    public String getLanguage() {
        return language;
    }

    @Nullable
    public String getDomain() {
        return domain;
    }

    public boolean isMobile() {
        return mobile;
    }

    /**
     * @return false if the domain code could not be decoded; the language
     *   is then only the raw prefix of the token
     */
    public boolean isKnown() {
        return domain != null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PageviewRow)) return false;
        PageviewRow other = (PageviewRow) obj;
        return views == other.views
            && mobile == other.mobile
            && domainCode.equals(other.domainCode)
            && pageTitle.equals(other.pageTitle)
            && language.equals(other.language)
            && Objects.equal(domain, other.domain);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(domainCode, pageTitle, views, language, domain, mobile);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("domainCode", domainCode)
            .add("pageTitle", pageTitle)
            .add("views", views)
            .add("language", language)
            .add("domain", domain)
            .add("mobile", mobile)
            .toString();
    }
}
