package com.graphid.adapter;

import com.graphid.adapter.id.ContentHashHints;
import com.graphid.adapter.id.ContentHasher;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContentHasherTest {

    @Test
    void emptyHintsHashTheEmptyString() {
        // FNV-1a offset basis 0x811c9dc5, low 16 bits
        assertEquals("9dc5", ContentHasher.hash(ContentHashHints.EMPTY));
    }

    @Test
    void hashIsFourLowercaseHexChars() {
        String hash = ContentHasher.hash(ContentHashHints.builder().arity(2).firstLiteralArg("start").build());
        assertTrue(hash.matches("[0-9a-f]{4}"), hash);
    }

    @Test
    void hashIsDeterministic() {
        ContentHashHints a = ContentHashHints.builder().declaredType("String").rhsType("LITERAL").rhsToken("x").build();
        ContentHashHints b = ContentHashHints.builder().declaredType("String").rhsType("LITERAL").rhsToken("x").build();
        assertEquals(ContentHasher.hash(a), ContentHasher.hash(b));
    }

    @Test
    void differentLiteralsGiveDifferentHashes() {
        String start = ContentHasher.hash(ContentHashHints.builder().arity(1).firstLiteralArg("start").build());
        String end = ContentHasher.hash(ContentHashHints.builder().arity(1).firstLiteralArg("end").build());
        assertNotEquals(start, end);
    }

    @Test
    void fieldPrefixesKeepValuesApart() {
        // same text in two different fields must not hash alike
        String asParam = ContentHasher.hash(ContentHashHints.builder().firstParamName("id").build());
        String asToken = ContentHasher.hash(ContentHashHints.builder().rhsToken("id").build());
        assertNotEquals(asParam, asToken);
    }

    @Test
    void emptyHintsReportEmpty() {
        assertTrue(ContentHashHints.EMPTY.isEmpty());
        assertFalse(ContentHashHints.builder().arity(0).build().isEmpty());
    }
}
