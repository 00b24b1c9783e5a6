package de.bwaldvogel.docstore.backend.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import de.bwaldvogel.docstore.DocumentDatabase;
import de.bwaldvogel.docstore.backend.AbstractSynchronizedDocumentCollection;
import de.bwaldvogel.docstore.backend.CollectionOptions;
import de.bwaldvogel.docstore.backend.DocumentWithPosition;
import de.bwaldvogel.docstore.bson.Document;

public class MemoryCollection extends AbstractSynchronizedDocumentCollection<Integer> {

    private final List<Document> documents = new ArrayList<>();
    private final Queue<Integer> emptyPositions = new LinkedList<>();

    // capped collections keep their documents in insertion order; positions are never reused
    private final Map<Integer, Document> cappedDocuments = new LinkedHashMap<>();
    private int nextCappedPosition;

    private final AtomicLong dataSize = new AtomicLong();

    public MemoryCollection(DocumentDatabase database, String collectionName, CollectionOptions options,
                            int maxDocumentSize) {
        super(database, collectionName, options, maxDocumentSize);
    }

    @Override
    protected void updateDataSize(long sizeDelta) {
        dataSize.addAndGet(sizeDelta);
    }

    @Override
    public long getDataSize() {
        return dataSize.get();
    }

    @Override
    protected Integer addDocumentInternal(Document document) {
        if (options.isCapped()) {
            Integer position = Integer.valueOf(nextCappedPosition++);
            cappedDocuments.put(position, document);
            return position;
        }

        Integer position = emptyPositions.poll();
        if (position == null) {
            position = Integer.valueOf(documents.size());
        }

        if (position.intValue() == documents.size()) {
            documents.add(document);
        } else {
            documents.set(position.intValue(), document);
        }
        return position;
    }

    @Override
    public synchronized int count() {
        if (options.isCapped()) {
            return cappedDocuments.size();
        }
        return documents.size() - emptyPositions.size();
    }

    @Override
    public synchronized boolean isEmpty() {
        return count() == 0;
    }

    synchronized int getNumberOfSlots() {
        return documents.size() + cappedDocuments.size();
    }

    @Override
    protected Integer findDocumentPosition(Document document) {
        if (options.isCapped()) {
            return super.findDocumentPosition(document);
        }
        int position = documents.indexOf(document);
        if (position < 0) {
            return null;
        }
        return Integer.valueOf(position);
    }

    @Override
    protected Stream<DocumentWithPosition<Integer>> streamAllDocumentsWithPosition() {
        if (options.isCapped()) {
            return cappedDocuments.entrySet().stream()
                .map(entry -> new DocumentWithPosition<>(entry.getValue(), entry.getKey()));
        }
        return IntStream.range(0, documents.size())
            .filter(position -> documents.get(position) != null)
            .mapToObj(position -> new DocumentWithPosition<>(documents.get(position), Integer.valueOf(position)));
    }

    @Override
    protected void removeDocument(Integer position) {
        if (options.isCapped()) {
            cappedDocuments.remove(position);
            return;
        }
        documents.set(position.intValue(), null);
        emptyPositions.add(position);
    }

    @Override
    protected void handleUpdate(Integer position, Document oldDocument, Document newDocument) {
        // the stored document was changed in place
    }

    @Override
    public synchronized void drop() {
        super.drop();
        documents.clear();
        emptyPositions.clear();
        cappedDocuments.clear();
        nextCappedPosition = 0;
        dataSize.set(0);
    }

}
