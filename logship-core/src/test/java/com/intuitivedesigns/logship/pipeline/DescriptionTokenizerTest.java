/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.pipeline;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DescriptionTokenizerTest {

    @Test
    void testPlainSplit() {
        assertEquals(List.of("init_txt", "add_timestamp", "add_source_host"),
                DescriptionTokenizer.split("init_txt,add_timestamp,add_source_host", ','));
    }

    @Test
    void testQuotedFieldKeepsDelimiters() {
        assertEquals(List.of("add_tags:\"a,b\"", "x"), DescriptionTokenizer.split("\"add_tags:\"\"a,b\"\"\",x", ','));
        assertEquals(List.of("add_fields", "url=http://h:80"), DescriptionTokenizer.split("add_fields:\"url=http://h:80\"", ':'));
    }

    @Test
    void testQuoteInsideFieldIsLiteral() {
        assertEquals(List.of("say=\"hi\""), DescriptionTokenizer.split("say=\"hi\"", ','));
    }

    @Test
    void testEmptyFieldsSurvive() {
        assertEquals(List.of(""), DescriptionTokenizer.split("", ','));
        assertEquals(List.of("a", "", "b", ""), DescriptionTokenizer.split("a,,b,", ','));
    }

    @Test
    void testUnterminatedQuoteRunsToEnd() {
        assertEquals(List.of("a,b"), DescriptionTokenizer.split("\"a,b", ','));
    }
}
