package com.pagewright.core.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SlugsTest {

    @ParameterizedTest
    @CsvSource({
        "'Getting Started', getting-started",
        "'  Hello, World!  ', hello-world",
        "'Café au lait', cafe-au-lait",
        "'API v2.0', api-v2-0",
        "'---', ''"
    })
    void slugify_text_producesUrlFragment(String text, String expected) {
        assertThat(Slugs.slugify(text)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "getting-started, 'Getting Started'",
        "user_docs, 'User Docs'",
        "README, 'Readme'",
        "index, 'Index'"
    })
    void titleCase_stem_capitalizesWords(String stem, String expected) {
        assertThat(Slugs.titleCase(stem)).isEqualTo(expected);
    }
}
