package de.bwaldvogel.docstore.backend;

/**
 * How an explicit {@code create} of an existing collection is answered.
 */
public enum CreateCollectionSemantics {

    /**
     * The command succeeds, the existing collection is kept. Racing creators all succeed.
     */
    IDEMPOTENT,

    /**
     * The command fails with {@code NamespaceExists}.
     */
    LEGACY_NAMESPACE_EXISTS,

}
