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

import junitparams.FileParameters;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.mappers.CsvWithHeaderMapper;
import org.junit.Test;
import org.junit.runner.RunWith;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@RunWith(JUnitParamsRunner.class)
public class TestDomainCodeDecoder {

    private static final String NO_DOMAIN = "-";

    @Test
    @FileParameters(
            value = "src/test/resources/domain_code_test_data.csv",
            mapper = CsvWithHeaderMapper.class
    )
    public void testDecode(
            String test_description,
            String domainCode,
            String expectedLanguage,
            String expectedDomain,
            boolean expectedMobile
    ) {
        DomainCode decoded = DomainCodeDecoder.decode(domainCode);

        assertEquals(test_description + " - language", expectedLanguage, decoded.getLanguage());
        assertEquals(test_description + " - domain",
                NO_DOMAIN.equals(expectedDomain) ? null : expectedDomain, decoded.getDomain());
        assertEquals(test_description + " - mobile", expectedMobile, decoded.isMobile());
    }

    @Test
    @Parameters({"en", "en.m", "commons.m", "fr.b", "xx.unknown", "a.b.c", ".m"})
    public void testDecodeIsDeterministic(String domainCode) {
        assertEquals(DomainCodeDecoder.decode(domainCode), DomainCodeDecoder.decode(domainCode));
    }

    @Test
    @Parameters({"en", "de", "zh-min-nan", "simple", "be-tarask"})
    public void testMobileSuffixMeansMobileWikipedia(String language) {
        DomainCode decoded = DomainCodeDecoder.decode(language + ".m");

        assertEquals(language, decoded.getLanguage());
        assertEquals("wikipedia.org", decoded.getDomain());
        assertTrue(decoded.isMobile());
    }

    @Test
    public void testQuotedEmptyCodeIsWikifunctions() {
        DomainCode decoded = DomainCodeDecoder.decode("\"\"");

        assertSame(DomainCodeDecoder.WIKIFUNCTIONS, decoded);
        assertEquals("wikifunctions.org", decoded.getDomain());
    }

    @Test
    public void testEmptyPrefix() {
        DomainCode decoded = DomainCodeDecoder.decode(".m");

        assertEquals("", decoded.getLanguage());
        assertNull(decoded.getDomain());
        assertFalse(decoded.isMobile());
        assertFalse(decoded.isKnown());
    }

    @Test
    public void testEmptyToken() {
        assertEquals(DomainCodeDecoder.unknown(""), DomainCodeDecoder.decode(""));
    }

    @Test
    public void testUnknownTokenKeepsPrefixBeforeFirstSeparator() {
        assertEquals(new DomainCode("aa", null, false), DomainCodeDecoder.decode("aa.bb.cc"));
    }

    @Test
    public void testSuffixLookup() {
        assertSame(ProjectSuffix.NONE, ProjectSuffix.fromCode(null));
        assertSame(ProjectSuffix.MOBILE, ProjectSuffix.fromCode("m"));
        assertSame(ProjectSuffix.WIKIVOYAGE, ProjectSuffix.fromCode("voy"));
        assertNull(ProjectSuffix.fromCode("zero"));
        assertNull(ProjectSuffix.fromCode(""));
    }

    @Test
    public void testEveryCompanionSuffixDecodes() {
        for (ProjectSuffix suffix : ProjectSuffix.values()) {
            if (suffix == ProjectSuffix.NONE) {
                continue;
            }
            DomainCode decoded = DomainCodeDecoder.decode("en." + suffix.getCode());
            assertEquals(suffix.name(), suffix.getDomain(), decoded.getDomain());
            assertEquals(suffix.name(), suffix == ProjectSuffix.MOBILE, decoded.isMobile());
        }
    }

    @Test
    public void testWikimediaProjectLookup() {
        assertSame(WikimediaProject.COMMONS, WikimediaProject.fromName("commons"));
        assertEquals("meta.wikimedia.org", WikimediaProject.META.getDomain());
        assertNull(WikimediaProject.fromName("en"));
    }
}
