package com.mimecast.tether.trust;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.jcajce.JcaPKCS10CertificationRequestBuilder;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.Security;

/**
 * BouncyCastle certificate signing request generator.
 *
 * <p>Generates an RSA 2048-bit key pair and a SHA256withRSA PKCS#10 request.
 * <br>The request is written as a PEM <i>CERTIFICATE REQUEST</i>.
 * <br>The private key is written as a PEM PKCS#8 <i>PRIVATE KEY</i> readable only by the owner.
 */
public class BouncyCastleRequestGenerator implements CertificateRequestGenerator {
    private static final Logger log = LogManager.getLogger(BouncyCastleRequestGenerator.class);

    private static final String BC_PROVIDER = "BC";
    private static final String SIGNATURE_ALGORITHM = "SHA256withRSA";
    private static final int KEY_SIZE = 2048;
    private static final SecureRandom RANDOM = new SecureRandom();

    static {
        if (Security.getProvider(BC_PROVIDER) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    @Override
    public void generate(String identity, Path csrPath, Path keyPath) throws CertificateRequestException {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA", BC_PROVIDER);
            generator.initialize(KEY_SIZE, RANDOM);
            KeyPair keyPair = generator.generateKeyPair();

            X500Name subject = new X500NameBuilder(BCStyle.INSTANCE)
                    .addRDN(BCStyle.CN, identity)
                    .build();
            ContentSigner signer = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM)
                    .setProvider(BC_PROVIDER)
                    .build(keyPair.getPrivate());
            PKCS10CertificationRequest csr = new JcaPKCS10CertificationRequestBuilder(subject, keyPair.getPublic())
                    .build(signer);

            writePem(csrPath, csr);
            writePem(keyPath, new JcaPKCS8Generator(keyPair.getPrivate(), null));
            restrictToOwner(keyPath);

            log.debug("Generated CSR for {} at {}", identity, csrPath);
        } catch (GeneralSecurityException | OperatorCreationException e) {
            throw new CertificateRequestException("Failed to generate certificate signing request", e);
        } catch (IOException e) {
            throw new CertificateRequestException("Failed to write certificate signing request", e);
        }
    }

    private static void writePem(Path path, Object object) throws IOException {
        try (JcaPEMWriter writer = new JcaPEMWriter(new OutputStreamWriter(Files.newOutputStream(path), StandardCharsets.US_ASCII))) {
            if (object instanceof JcaPKCS8Generator) {
                writer.writeObject((JcaPKCS8Generator) object);
            } else {
                writer.writeObject(object);
            }
        }
    }

    private static void restrictToOwner(Path path) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
        }
    }
}
