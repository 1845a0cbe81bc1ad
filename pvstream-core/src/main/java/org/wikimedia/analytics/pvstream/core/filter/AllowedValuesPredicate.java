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

import java.util.Set;

import com.google.common.collect.ImmutableSet;
import org.wikimedia.analytics.pvstream.core.PageviewRow;

/**
 * Accepts rows whose domain code, language or domain is one of a set of
 * allowed values. Language and domain only exist for decoded domain codes:
 * a row whose domain code could not be decoded never matches them.
 */
public class AllowedValuesPredicate implements RowPredicate {

    public enum Attribute {
        DOMAIN_CODE {
            @Override
            String valueOf(PageviewRow row) {
                return row.getDomainCode();
            }
        },
        LANGUAGE {
            @Override
            String valueOf(PageviewRow row) {
                return row.isKnown() ? row.getLanguage() : null;
            }
        },
        DOMAIN {
            @Override
            String valueOf(PageviewRow row) {
                return row.getDomain();
            }
        };

        abstract String valueOf(PageviewRow row);
    }

    private final Attribute attribute;
    private final Set<String> allowed;

    public AllowedValuesPredicate(Attribute attribute, Set<String> allowed) {
        this.attribute = attribute;
        this.allowed = ImmutableSet.copyOf(allowed);
    }

    @Override
    public boolean accepts(PageviewRow row) {
        String value = attribute.valueOf(row);
        return value != null && allowed.contains(value);
    }

    @Override
    public String toString() {
        return attribute + " in " + allowed;
    }
}
