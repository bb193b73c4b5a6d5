package com.memsearch.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TermDictionaryTest {

    @Test
    @DisplayName("按首次出现顺序分配稠密ID")
    void testAddIfAbsent() {
        TermDictionary vocabulary = new TermDictionary();

        assertEquals(0, vocabulary.addIfAbsent("foo"));
        assertEquals(1, vocabulary.addIfAbsent("bar"));
        assertEquals(0, vocabulary.addIfAbsent("foo"));

        assertEquals(2, vocabulary.size());
        assertEquals(0, vocabulary.getTermId("foo"));
        assertEquals(1, vocabulary.getTermId("bar"));
        assertEquals(TermDictionary.NOT_FOUND, vocabulary.getTermId("wtf"));
    }

    @Test
    @DisplayName("查找不修改词典")
    void testLookupDoesNotMutate() {
        TermDictionary vocabulary = new TermDictionary();
        vocabulary.addIfAbsent("foo");

        vocabulary.getTermId("bar");
        vocabulary.getTermId("baz");

        assertEquals(1, vocabulary.size());
    }

    @Test
    @DisplayName("ID覆盖 [0, size) 且无空洞")
    void testIdsAreDenseAndUnique() {
        TermDictionary vocabulary = new TermDictionary();
        String[] stream = {"c", "a", "c", "b", "a", "d", "b", "e"};
        for (String term : stream) {
            vocabulary.addIfAbsent(term);
        }

        List<String> terms = new ArrayList<>();
        List<Integer> ids = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : vocabulary) {
            terms.add(entry.getKey());
            ids.add(entry.getValue());
        }

        assertEquals(List.of("c", "a", "b", "d", "e"), terms);
        assertEquals(List.of(0, 1, 2, 3, 4), ids);
        for (int termId = 0; termId < vocabulary.size(); termId++) {
            assertEquals(termId, vocabulary.getTermId(vocabulary.getTerm(termId)));
        }
    }

    @Test
    void testEmptyStringIsAValidTerm() {
        TermDictionary vocabulary = new TermDictionary();

        assertEquals(0, vocabulary.addIfAbsent(""));
        assertEquals(0, vocabulary.getTermId(""));
    }

    @Test
    void testToString() {
        TermDictionary vocabulary = new TermDictionary();
        vocabulary.addIfAbsent("foo");
        vocabulary.addIfAbsent("bar");

        assertEquals("{foo=0, bar=1}", vocabulary.toString());
    }

    @Test
    void testRejectNullTermAndOutOfRangeId() {
        TermDictionary vocabulary = new TermDictionary();

        assertThrows(IllegalArgumentException.class, () -> vocabulary.addIfAbsent(null));
        assertThrows(IllegalArgumentException.class, () -> vocabulary.getTermId(null));
        assertThrows(IllegalArgumentException.class, () -> vocabulary.getTerm(0));
        assertThrows(IllegalArgumentException.class, () -> vocabulary.getTerm(TermDictionary.NOT_FOUND));
    }
}
