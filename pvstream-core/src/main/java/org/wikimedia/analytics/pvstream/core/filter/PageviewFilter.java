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

package org.wikimedia.analytics.pvstream.core.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import org.apache.log4j.Logger;
import org.wikimedia.analytics.pvstream.core.FilterConfigException;
import org.wikimedia.analytics.pvstream.core.PageviewRow;

/**
 * The filters applied to one pipeline run.
 * <p>
 * Every criterion is optional and they combine with a logical AND. The line
 * regex is matched against raw lines before they are parsed; the other
 * criteria are compiled into a {@link FilterChain} evaluated on parsed rows.
 * Patterns are compiled and bounds checked once, in {@link Builder#build()}.
 */
@Immutable
public class PageviewFilter {

    private static final Logger LOG = Logger.getLogger(PageviewFilter.class.getName());

    private static final PageviewFilter ACCEPT_ALL = new PageviewFilter(
        null, new FilterChain(new ArrayList<RowPredicate>()));

    @Nullable
    private final Pattern linePattern;

    private final FilterChain chain;

    private PageviewFilter(@Nullable Pattern linePattern, FilterChain chain) {
        this.linePattern = linePattern;
        this.chain = chain;
    }

    public static PageviewFilter acceptAll() {
        return ACCEPT_ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param line a raw, unparsed line
     * @return false if a line regex is configured and has no match in the line
     */
    public boolean acceptsLine(String line) {
        return linePattern == null || linePattern.matcher(line).find();
    }

    /**
     * @return true if the row meets every configured criterion
     */
    public boolean accepts(PageviewRow row) {
        return chain.accepts(row);
    }

    public boolean hasLineFilter() {
        return linePattern != null;
    }

    public FilterChain getChain() {
        return chain;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("lineRegex", linePattern == null ? null : linePattern.pattern())
            .add("chain", chain)
            .toString();
    }

    /**
     * Collects the filter criteria. Nothing is validated before
     * {@link #build()}.
     */
    public static class Builder {

        private String lineRegex;
        private Set<String> domainCodes;
        private String pageTitle;
        private Long minViews;
        private Long maxViews;
        private Set<String> languages;
        private Set<String> domains;
        private Boolean mobile;

        private Builder() {}

        /** Regex matched against the raw line, before any parsing. */
        public Builder lineRegex(String lineRegex) {
            this.lineRegex = lineRegex;
            return this;
        }

        public Builder domainCodes(String... domainCodes) {
            return domainCodes(Arrays.asList(domainCodes));
        }

        public Builder domainCodes(Collection<String> domainCodes) {
            this.domainCodes = ImmutableSet.copyOf(domainCodes);
            return this;
        }

        /** Regex searched for in the page title. */
        public Builder pageTitle(String pageTitle) {
            this.pageTitle = pageTitle;
            return this;
        }

        public Builder minViews(long minViews) {
            this.minViews = minViews;
            return this;
        }

        public Builder maxViews(long maxViews) {
            this.maxViews = maxViews;
            return this;
        }

        public Builder languages(String... languages) {
            return languages(Arrays.asList(languages));
        }

        public Builder languages(Collection<String> languages) {
            this.languages = ImmutableSet.copyOf(languages);
            return this;
        }

        public Builder domains(String... domains) {
            return domains(Arrays.asList(domains));
        }

        public Builder domains(Collection<String> domains) {
            this.domains = ImmutableSet.copyOf(domains);
            return this;
        }

        public Builder mobile(boolean mobile) {
            this.mobile = mobile;
            return this;
        }

        /**
         * Validates the criteria and assembles the filter.
         *
         * @throws FilterConfigException if a pattern does not compile or a
         *   view bound is negative
         */
        public PageviewFilter build() throws FilterConfigException {
            Pattern linePattern = compile("line_regex", lineRegex);
            Pattern pageTitlePattern = compile("page_title", pageTitle);
            checkBound("min_views", minViews);
            checkBound("max_views", maxViews);

            // Cheapest predicates first, the title regex last.
            List<RowPredicate> predicates = new ArrayList<>();
            if (mobile != null) {
                predicates.add(new MobilePredicate(mobile));
            }
            if (minViews != null || maxViews != null) {
                ViewRangePredicate range = new ViewRangePredicate(minViews, maxViews);
                if (range.isEmpty()) {
                    LOG.warn("min_views " + minViews + " > max_views " + maxViews + ", no row will pass");
                }
                predicates.add(range);
            }
            if (domainCodes != null) {
                predicates.add(new AllowedValuesPredicate(
                    AllowedValuesPredicate.Attribute.DOMAIN_CODE, domainCodes));
            }
            if (languages != null) {
                predicates.add(new AllowedValuesPredicate(
                    AllowedValuesPredicate.Attribute.LANGUAGE, languages));
            }
            if (domains != null) {
                predicates.add(new AllowedValuesPredicate(
                    AllowedValuesPredicate.Attribute.DOMAIN, domains));
            }
            if (pageTitlePattern != null) {
                predicates.add(new PageTitlePredicate(pageTitlePattern));
            }

            return new PageviewFilter(linePattern, new FilterChain(predicates));
        }

        private static Pattern compile(String name, String regex) throws FilterConfigException {
            if (regex == null) {
                return null;
            }
            try {
                return Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new FilterConfigException("Invalid " + name + " pattern '" + regex + "'", e);
            }
        }

        private static void checkBound(String name, Long bound) throws FilterConfigException {
            if (bound != null && bound < 0) {
                throw new FilterConfigException(name + " must not be negative, got " + bound);
            }
        }
    }
}
