package de.bwaldvogel.docstore.backend;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import de.bwaldvogel.docstore.exception.NoSuchCommandException;

public enum Command {
    // Query and write operation
    COUNT("count"),
    DELETE("delete"),
    FIND("find"),
    INSERT("insert"),
    UPDATE("update"),

    //  Administration
    CREATE("create"),
    CREATE_INDEXES("createIndexes"),
    DROP("drop"),
    DROP_DATABASE("dropDatabase"),
    DROP_INDEXES("dropIndexes"),
    LIST_COLLECTIONS("listCollections"),
    LIST_INDEXES("listIndexes"),

    // Diagnostic
    COLL_STATS("collStats"),
    DATA_SIZE("dataSize"),
    DB_STATS("dbStats"),
    EXPLAIN("explain"),
    PING("ping");

    private final String name;
    private static final Map<String, Command> LOOKUP;

    static {
        LOOKUP = Arrays.stream(Command.values())
            .collect(Collectors.toMap(
                c -> c.name.toLowerCase(Locale.ROOT),
                Function.identity()
            ));
    }

    Command(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    static Command lookup(String commandName) {
        return LOOKUP.get(commandName.toLowerCase(Locale.ROOT));
    }

    public static Command parseString(String commandName) {
        Command command = lookup(commandName);
        if (command == null) {
            throw new NoSuchCommandException(commandName);
        }
        return command;
    }
}
