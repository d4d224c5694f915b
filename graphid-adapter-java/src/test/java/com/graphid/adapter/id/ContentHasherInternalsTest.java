package com.graphid.adapter.id;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContentHasherInternalsTest {

    @Test
    void knownFnvVector() {
        // FNV-1a 32("a") = 0xe40c292c
        assertEquals("292c", ContentHasher.fnv1a16("a"));
    }

    @Test
    void hintStringUsesFixedFieldOrder() {
        ContentHashHints hints = ContentHashHints.builder()
            .signature("int,String")
            .declaredType("Foo")
            .objectChain("this.repo")
            .rhsToken("1")
            .rhsType("LITERAL")
            .firstParamName("id")
            .firstLiteralArg("x")
            .arity(2)
            .build();
        assertEquals("a:2|l:x|p:id|r:LITERAL|t:1|o:this.repo|d:Foo|s:int,String",
                ContentHasher.hintString(hints));
    }

    @Test
    void absentFieldsAreSkipped() {
        assertEquals("a:0|d:int", ContentHasher.hintString(
                ContentHashHints.builder().arity(0).declaredType("int").build()));
        assertEquals("", ContentHasher.hintString(ContentHashHints.EMPTY));
    }
}
