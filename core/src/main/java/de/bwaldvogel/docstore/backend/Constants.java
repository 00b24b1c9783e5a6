package de.bwaldvogel.docstore.backend;

public interface Constants {

    String PRIMARY_KEY_INDEX_NAME = "_id_";
    String ID_FIELD = "_id";

    int MAX_NS_LENGTH = 235;

    int MAX_BSON_OBJECT_SIZE = 16 * 1024 * 1024;

    int CANCELLATION_CHECK_INTERVAL = 100;

}
