package de.bwaldvogel.docstore.exception;

import java.util.Arrays;

public class ServerError extends ServerException {

    private static final long serialVersionUID = 1L;

    private final String message;
    private final int errorCode;
    private final String codeName;

    public ServerError(int errorCode, String message) {
        this(errorCode, "Location" + errorCode, message);
    }

    public ServerError(ErrorCode errorCode, String message) {
        this(errorCode.getValue(), errorCode.getName(), message);
    }

    public ServerError(int errorCode, String codeName, String message) {
        this(errorCode, codeName, message, null);
    }

    public ServerError(int errorCode, String codeName, String message, Throwable cause) {
        super("[Error " + errorCode + "] " + message, cause);
        this.errorCode = errorCode;
        this.codeName = codeName;
        this.message = message;
    }

    public int getCode() {
        return errorCode;
    }

    public String getCodeName() {
        return codeName;
    }

    @Override
    public String getMessageWithoutErrorCode() {
        return message;
    }

    public boolean hasCode(ErrorCode... errorCodes) {
        return Arrays.stream(errorCodes).anyMatch(code -> getCode() == code.getValue());
    }

}
