package de.bwaldvogel.docstore.backend;

import de.bwaldvogel.docstore.bson.Document;

public class QueryParameters {
    private final Document querySelector;
    private final Document orderBy;
    private final int numberToSkip;
    private final int limit;
    private final Document projection;
    private final CancellationSignal cancellationSignal;

    public QueryParameters(Document querySelector, Document orderBy, int numberToSkip, int limit, Document projection,
                           CancellationSignal cancellationSignal) {
        this.querySelector = querySelector;
        this.orderBy = orderBy;
        this.numberToSkip = numberToSkip;
        this.limit = limit;
        this.projection = projection;
        this.cancellationSignal = cancellationSignal;
    }

    public QueryParameters(Document querySelector, int numberToSkip, int limit) {
        this(querySelector, null, numberToSkip, limit, null, CancellationSignal.none());
    }

    public Document getQuerySelector() {
        return querySelector;
    }

    public Document getOrderBy() {
        return orderBy;
    }

    public int getNumberToSkip() {
        return numberToSkip;
    }

    public int getLimit() {
        return limit;
    }

    public Document getProjection() {
        return projection;
    }

    public CancellationSignal getCancellationSignal() {
        return cancellationSignal;
    }

}
