package de.bwaldvogel.docstore.backend.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import de.bwaldvogel.docstore.DocumentDatabase;
import de.bwaldvogel.docstore.backend.CollectionOptions;
import de.bwaldvogel.docstore.backend.Constants;
import de.bwaldvogel.docstore.backend.DocumentWithPosition;
import de.bwaldvogel.docstore.bson.Document;

class MemoryCollectionTest {

    private DocumentDatabase database;

    @BeforeEach
    void setUp() {
        database = mock(DocumentDatabase.class);
        when(database.getDatabaseName()).thenReturn("testdb");
    }

    @Test
    void testCappedCollectionDoesNotGrowWithEvictedDocuments() {
        MemoryCollection collection = new MemoryCollection(database, "capped", CollectionOptions.capped(1024, 2L),
            Constants.MAX_BSON_OBJECT_SIZE);

        for (int i = 0; i < 10_000; i++) {
            collection.addDocument(new Document("_id", Integer.valueOf(i)));
        }

        assertThat(collection.count()).isEqualTo(2);
        assertThat(collection.getNumberOfSlots()).isEqualTo(2);
        assertThat(collection.streamAllDocumentsWithPosition()
            .map(DocumentWithPosition::getDocument)
            .collect(Collectors.toList()))
            .containsExactly(new Document("_id", 9998), new Document("_id", 9999));
    }

    @Test
    void testRemovedCappedDocumentFreesItsSlot() {
        MemoryCollection collection = new MemoryCollection(database, "capped", CollectionOptions.capped(1024, 10L),
            Constants.MAX_BSON_OBJECT_SIZE);
        Document first = new Document("_id", 1);
        collection.addDocument(first);
        collection.addDocument(new Document("_id", 2));

        collection.removeDocument(first);
        collection.addDocument(new Document("_id", 3));

        assertThat(collection.getNumberOfSlots()).isEqualTo(2);
        assertThat(collection.streamAllDocumentsWithPosition()
            .map(DocumentWithPosition::getPosition)
            .collect(Collectors.toList()))
            .containsExactly(1, 2);
    }

}
