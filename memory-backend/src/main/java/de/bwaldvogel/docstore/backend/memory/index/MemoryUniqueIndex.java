package de.bwaldvogel.docstore.backend.memory.index;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import de.bwaldvogel.docstore.backend.AbstractUniqueIndex;
import de.bwaldvogel.docstore.backend.IndexKey;
import de.bwaldvogel.docstore.backend.KeyValue;
import de.bwaldvogel.docstore.backend.Utils;
import de.bwaldvogel.docstore.bson.Document;

public class MemoryUniqueIndex extends AbstractUniqueIndex<Integer> {

    private final Map<KeyValue, Integer> index = new ConcurrentHashMap<>();

    public MemoryUniqueIndex(String name, List<IndexKey> keys) {
        super(name, keys);
    }

    @Override
    public long getCount() {
        return index.size();
    }

    @Override
    public long getDataSize() {
        return index.keySet().stream()
            .mapToLong(MemoryUniqueIndex::estimateSize)
            .sum();
    }

    private static long estimateSize(KeyValue keyValue) {
        Document document = new Document();
        int position = 0;
        for (Object value : keyValue) {
            document.put(String.valueOf(position++), value);
        }
        return Utils.calculateSize(document);
    }

    @Override
    protected Integer removeDocument(KeyValue keyValue) {
        return index.remove(keyValue);
    }

    @Override
    protected boolean containsKey(KeyValue keyValue) {
        return index.containsKey(keyValue);
    }

    @Override
    protected boolean putKeyPosition(KeyValue keyValue, Integer position) {
        Integer oldValue = index.putIfAbsent(keyValue, position);
        return oldValue == null;
    }

    @Override
    protected Integer getPosition(KeyValue keyValue) {
        return index.get(keyValue);
    }

    @Override
    public void drop() {
        index.clear();
    }

}
