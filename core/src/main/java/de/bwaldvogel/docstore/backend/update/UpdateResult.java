package de.bwaldvogel.docstore.backend.update;

import de.bwaldvogel.docstore.bson.Document;

/**
 * The document after an update and whether the update changed anything.
 */
public final class UpdateResult {

    private final Document document;
    private final boolean modified;

    UpdateResult(Document document, boolean modified) {
        this.document = document;
        this.modified = modified;
    }

    public Document getDocument() {
        return document;
    }

    public boolean isModified() {
        return modified;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[modified=" + modified + ", document=" + document + "]";
    }

}
