package com.pgfga.reconciler.session;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Copies a client key with loose permissions (e.g. a mounted secret) into an owner-only
 * temporary file, and shreds that copy once the connection is established.
 */
@Slf4j
public class SecureKeyFileMaterializer implements CredentialMaterializer {

    static final Set<PosixFilePermission> OWNER_ONLY =
            EnumSet.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE);

    private static final int OVERWRITE_PASSES = 5;

    @Override
    public MaterializedCredential materialize(Path keyFile) throws IOException {
        Path source = keyFile.toAbsolutePath().normalize();
        Set<PosixFilePermission> current = Files.getPosixFilePermissions(source);
        if (current.equals(OWNER_ONLY)) {
            return new MaterializedCredential(source, false);
        }

        log.info("Fixing permissions on key file {} ({})", source, PosixFilePermissions.toString(current));
        byte[] key = Files.readAllBytes(source);
        Path copy = createOwnerOnlyFile();
        try {
            Files.write(copy, key, StandardOpenOption.TRUNCATE_EXISTING);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
        log.debug("New key file {} is created with owner-only permissions", copy);
        return new MaterializedCredential(copy, true);
    }

    @Override
    public void cleanup(MaterializedCredential credential) {
        if (credential == null || !credential.isTemporary()) {
            return;
        }
        Path keyFile = credential.getPath();
        log.debug("Cleaning key file {}", keyFile);
        try {
            int length = (int) Files.size(keyFile);
            byte[] zeros = new byte[length];
            byte[] ones = new byte[length];
            Arrays.fill(ones, (byte) 0xFF);
            for (int pass = 0; pass < OVERWRITE_PASSES; pass++) {
                overwrite(keyFile, zeros);
                overwrite(keyFile, ones);
            }
            Files.delete(keyFile);
        } catch (IOException e) {
            log.error("Failed to clean key file {}. Remove it manually: {}", keyFile, e.getMessage());
        }
    }

    private void overwrite(Path file, byte[] content) throws IOException {
        Files.write(file, content, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.SYNC);
    }

    private Path createOwnerOnlyFile() throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return Files.createTempFile("pgfga-", ".key", PosixFilePermissions.asFileAttribute(OWNER_ONLY));
        }
        Path file = Files.createTempFile("pgfga-", ".key");
        file.toFile().setReadable(false, false);
        file.toFile().setReadable(true, true);
        file.toFile().setWritable(false, false);
        file.toFile().setWritable(true, true);
        return file;
    }
}
