package com.roomchat.contentpolicy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ContentPolicyTest {

    @Test
    public void normalizeFoldsWidthAndStripsSeparators() {
        assertEquals("fuck", ContentPolicy.normalizeContentText("\uFF26 u-c\u200Bk"));
        assertEquals("hello", ContentPolicy.normalizeContentText("  H.e.l.l.o!! "));
        assertEquals("", ContentPolicy.normalizeContentText("  ... "));
        assertEquals("", ContentPolicy.normalizeContentText(null));
    }

    @Test
    public void compileDedupesAfterNormalization() {
        CompiledDenylist compiled = ContentPolicy.compileDenylist(List.of("\uFF26\uFF35\uFF23\uFF2B", "fuck", "  "));
        assertEquals(List.of("fuck"), compiled.terms());
    }

    @Test
    public void allowlistRemovesNormalizedTerms() {
        CompiledDenylist compiled = ContentPolicy.buildCompiledDenylist(
                List.of("Evil", "bad word"), List.of("E v i l"), List.of("BAD-WORD"));
        assertEquals(List.of("evil"), compiled.terms());
    }

    @Test
    public void violationUsesSubstringMatchOnNormalizedText() {
        CompiledDenylist compiled = ContentPolicy.compileDenylist(List.of("badword"));

        assertTrue(ContentPolicy.violatesDenylist("this is a b.a.d w o r d!", compiled));
        assertTrue(ContentPolicy.violatesDenylist("\uFF42\uFF41\uFF44\uFF57\uFF4F\uFF52\uFF44\uFF53", compiled));
        assertFalse(ContentPolicy.violatesDenylist("perfectly fine", compiled));
        assertFalse(ContentPolicy.violatesDenylist("anything", CompiledDenylist.empty()));
    }

    @Test
    public void presetResourcesLoadForBundledLanguages() {
        List<String> english = PresetDenylists.load(ContentPolicyLanguage.EN);
        assertFalse(english.isEmpty());
        assertTrue(english.contains("fuck"));
        english.forEach(term -> assertFalse(term.startsWith("#")));
    }
}
