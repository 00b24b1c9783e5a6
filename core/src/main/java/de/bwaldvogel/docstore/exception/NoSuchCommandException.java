package de.bwaldvogel.docstore.exception;

public class NoSuchCommandException extends ServerError {

    private static final long serialVersionUID = 1L;

    public NoSuchCommandException(String command) {
        super(ErrorCode.CommandNotFound, "no such command: '" + command + "'");
    }

}
