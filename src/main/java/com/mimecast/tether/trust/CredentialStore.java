package com.mimecast.tether.trust;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Credential set persisted in the application private directory.
 *
 * <p>Layout under <i>&lt;privateAppDirectory&gt;/&lt;product&gt;/</i>:
 * <ul>
 *     <li><b>app.csr</b> - certificate signing request, written locally.</li>
 *     <li><b>&lt;product&gt;CA.crt</b> - root of trust, written by the desktop.</li>
 *     <li><b>device.crt</b> - signed client certificate, written by the desktop.</li>
 *     <li><b>privateKey.pem</b> - client private key, written locally.</li>
 * </ul>
 * <p>Files are read fresh on every call.
 * <br>The desktop writes its two files out-of-band so a partial set is an expected state.
 */
public class CredentialStore {
    private static final Logger log = LogManager.getLogger(CredentialStore.class);

    public static final String CSR_FILE_NAME = "app.csr";
    public static final String CLIENT_CERT_FILE_NAME = "device.crt";
    public static final String PRIVATE_KEY_FILE_NAME = "privateKey.pem";
    public static final String CA_FILE_SUFFIX = "CA.crt";

    private static final String OWNER_ONLY = "rwx------";

    private final Path directory;
    private final String rootCertificateName;

    /**
     * Constructs a new CredentialStore instance.
     *
     * @param privateAppDirectory Application private directory.
     * @param product             Product name.
     */
    public CredentialStore(String privateAppDirectory, String product) {
        this.directory = Paths.get(privateAppDirectory, product);
        this.rootCertificateName = product + CA_FILE_SUFFIX;
    }

    /**
     * Gets credential directory.
     *
     * @return Path.
     */
    public Path getDirectory() {
        return directory;
    }

    /**
     * Gets credential directory as sent to the desktop.
     * <p>Ends with the file separator so the desktop can append file names.
     *
     * @return Path string.
     */
    public String getDestination() {
        return directory.toAbsolutePath() + File.separator;
    }

    public String getRootCertificateName() {
        return rootCertificateName;
    }

    public Path getCsrFile() {
        return resolve(CSR_FILE_NAME);
    }

    public Path getRootCertificateFile() {
        return resolve(rootCertificateName);
    }

    public Path getClientCertificateFile() {
        return resolve(CLIENT_CERT_FILE_NAME);
    }

    public Path getPrivateKeyFile() {
        return resolve(PRIVATE_KEY_FILE_NAME);
    }

    /**
     * Resolves file name within the credential directory.
     *
     * @param name File name.
     * @return Path.
     */
    public Path resolve(String name) {
        return directory.resolve(name);
    }

    /**
     * Checks all three credentials are present and non-empty.
     *
     * @return Boolean.
     */
    public boolean isUsable() {
        return read(rootCertificateName).length > 0
                && read(CLIENT_CERT_FILE_NAME).length > 0
                && read(PRIVATE_KEY_FILE_NAME).length > 0;
    }

    /**
     * Reads credential file.
     * <p>Absence is an expected state and yields an empty array.
     *
     * @param name File name.
     * @return Byte array, empty if absent or unreadable.
     */
    public byte[] read(String name) {
        Path file = resolve(name);
        if (!Files.isRegularFile(file)) {
            return new byte[0];
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            log.error("Unable to read credential file: {} error: {}", file, e.getMessage());
            return new byte[0];
        }
    }

    /**
     * Reads credential file as UTF-8 text.
     *
     * @param name File name.
     * @return String, empty if absent or unreadable.
     */
    public String readString(String name) {
        return new String(read(name), StandardCharsets.UTF_8);
    }

    /**
     * Ensures the credential directory exists.
     * <p>Creates it with owner only permissions where the file system supports them.
     *
     * @return True if the directory exists or was created.
     */
    public boolean ensureDirectory() {
        if (Files.isDirectory(directory)) {
            return true;
        }
        if (Files.exists(directory)) {
            log.error("Credential path exists but is not a directory: {}", directory);
            return false;
        }

        try {
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                Files.createDirectories(directory, PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString(OWNER_ONLY)));
            } else {
                Files.createDirectories(directory);
            }
            log.debug("Created credential directory: {}", directory);
            return true;
        } catch (IOException e) {
            log.error("Unable to create credential directory: {} error: {}", directory, e.getMessage());
            return false;
        }
    }
}
