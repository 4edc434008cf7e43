package com.pgfga.reconciler.session;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Makes a TLS client key usable by the driver, which refuses keys readable by group or others.
 */
public interface CredentialMaterializer {

    MaterializedCredential materialize(Path keyFile) throws IOException;

    /**
     * Destroys a temporary copy. Does nothing for a key that was used in place.
     */
    void cleanup(MaterializedCredential credential);
}
