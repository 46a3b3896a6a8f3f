package com.ai.guardrails.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SignatureTableTest {

    private final SignatureTable table = SignatureTable.compile("\\bfoo\\b", "ba[rz]");

    @Test
    void firstMatch_returnsTextOfFirstSignatureInTableOrder() {
        assertThat(table.firstMatch("baz then FOO")).contains("FOO");
        assertThat(table.firstMatch("nothing here")).isEmpty();
    }

    @Test
    void allMatches_collectsEveryOccurrence() {
        assertThat(table.allMatches("bar baz foo")).containsExactly("foo", "bar", "baz");
    }

    @Test
    void matchingSignatures_listsEachHitSignatureOnce() {
        assertThat(table.matchingSignatures("bar bar bar")).containsExactly("ba[rz]");
        assertThat(table.size()).isEqualTo(2);
    }

    @Test
    void matching_isUnicodeCaseInsensitive() {
        SignatureTable unicode = SignatureTable.compile("école");

        assertThat(unicode.firstMatch("L'ÉCOLE est fermée")).contains("ÉCOLE");
    }
}
