package de.bwaldvogel.docstore.exception;

public class ServerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ServerException(String message) {
        super(validateMessage(message));
    }

    public ServerException(String message, Throwable cause) {
        super(validateMessage(message), cause);
    }

    private static String validateMessage(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("illegal error message");
        }
        return message;
    }

    public String getMessageWithoutErrorCode() {
        return getMessage();
    }

}
