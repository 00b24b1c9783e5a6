package de.bwaldvogel.docstore.backend;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import nl.jqno.equalsverifier.EqualsVerifier;

class IndexKeyTest {

    @Test
    void testEqualsAndHashCode() {
        EqualsVerifier.forClass(IndexKey.class)
            .usingGetClass()
            .withNonnullFields("key")
            .verify();
    }

    @Test
    void testToString() {
        assertThat(new IndexKey("a", true)).hasToString("IndexKey[key=a ASC]");
        assertThat(new IndexKey("b", false)).hasToString("IndexKey[key=b DESC]");
    }

}
