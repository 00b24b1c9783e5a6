package de.bwaldvogel.docstore.exception;

public class OperationCancelledException extends ServerError {

    private static final long serialVersionUID = 1L;

    public OperationCancelledException() {
        super(ErrorCode.Interrupted, "operation was interrupted");
    }

}
