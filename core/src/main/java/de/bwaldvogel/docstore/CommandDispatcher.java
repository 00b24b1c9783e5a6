package de.bwaldvogel.docstore;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.bwaldvogel.docstore.backend.CancellationSignal;
import de.bwaldvogel.docstore.bson.Document;
import de.bwaldvogel.docstore.exception.ErrorCode;
import de.bwaldvogel.docstore.exception.FailedToParseException;
import de.bwaldvogel.docstore.exception.ServerError;
import de.bwaldvogel.docstore.exception.ServerException;

/**
 * Entry point for the transport layer: routes a decoded command document to the backend and turns failures into
 * error replies. A reply is always returned, exceptions never escape.
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final DocumentBackend backend;

    public CommandDispatcher(DocumentBackend backend) {
        this.backend = Objects.requireNonNull(backend);
    }

    public Document dispatch(String databaseName, Document command) {
        return dispatch(databaseName, command, CancellationSignal.none());
    }

    public Document dispatch(String databaseName, Document command, CancellationSignal cancellationSignal) {
        try {
            if (command.isEmpty()) {
                throw new FailedToParseException("Command document must not be empty");
            }
            String commandName = command.keySet().iterator().next();
            log.debug("dispatching '{}' on database '{}'", commandName, databaseName);
            return backend.handleCommand(databaseName, commandName, command, cancellationSignal);
        } catch (ServerError e) {
            log.debug("command {} failed: {}", command, e.getMessage());
            return errorResponse(e.getCode(), e.getCodeName(), e.getMessageWithoutErrorCode());
        } catch (ServerException e) {
            log.debug("command {} failed: {}", command, e.getMessage());
            return errorResponse(ErrorCode.InternalError.getValue(), ErrorCode.InternalError.getName(),
                e.getMessageWithoutErrorCode());
        } catch (RuntimeException e) {
            log.error("failed to handle {}", command, e);
            return errorResponse(ErrorCode.InternalError.getValue(), ErrorCode.InternalError.getName(),
                "Unknown error: " + e.getMessage());
        }
    }

    static Document errorResponse(int code, String codeName, String message) {
        Document response = new Document();
        response.put("ok", Double.valueOf(0.0));
        response.put("errmsg", message);
        response.put("code", Integer.valueOf(code));
        response.putIfNotNull("codeName", codeName);
        return response;
    }

}
