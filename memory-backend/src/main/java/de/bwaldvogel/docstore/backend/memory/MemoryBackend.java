package de.bwaldvogel.docstore.backend.memory;

import de.bwaldvogel.docstore.backend.AbstractDocumentBackend;

public class MemoryBackend extends AbstractDocumentBackend {

    @Override
    public MemoryDatabase openOrCreateDatabase(String databaseName) {
        return new MemoryDatabase(databaseName, this);
    }

}
