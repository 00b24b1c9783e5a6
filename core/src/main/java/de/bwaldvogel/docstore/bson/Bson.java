package de.bwaldvogel.docstore.bson;

import java.io.Serializable;

public interface Bson extends Serializable {
}
