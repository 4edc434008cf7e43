package com.pgfga.reconciler.session;

import lombok.Value;

import java.nio.file.Path;

/**
 * A client key file ready to hand to the driver. {@code temporary} copies must be cleaned up.
 */
@Value
public class MaterializedCredential {

    Path path;
    boolean temporary;
}
