package com.wpanther.documentsigning.config;

import java.nio.file.Path;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.wpanther.documentsigning.exception.TrustMaterialException;
import com.wpanther.documentsigning.model.TrustMaterial;
import com.wpanther.documentsigning.util.TrustMaterialFactory;
import com.wpanther.documentsigning.util.TrustMaterialFactory.KeyStoreLocation;

import lombok.extern.slf4j.Slf4j;

/**
 * Loads the certifier, internal CA and TSA identities once at startup.
 * Missing files or a missing passphrase stop the application.
 */
@Configuration
@Slf4j
public class TrustMaterialConfig {

    @Value("${app.trust.mode:keystore}")
    private String mode;

    @Value("${app.trust.keystore-dir:./certificates}")
    private String keystoreDir;

    @Value("${app.trust.passphrase:}")
    private String passphrase;

    @Value("${app.trust.certifier.file:certifier.p12}")
    private String certifierFile;

    @Value("${app.trust.certifier.alias:}")
    private String certifierAlias;

    @Value("${app.trust.ca.file:ca.p12}")
    private String caFile;

    @Value("${app.trust.ca.alias:}")
    private String caAlias;

    @Value("${app.trust.ca.required:true}")
    private boolean caRequired;

    @Value("${app.trust.tsa.file:tsa.p12}")
    private String tsaFile;

    @Value("${app.trust.tsa.alias:}")
    private String tsaAlias;

    @Value("${app.signing.organization:Document Signing Service}")
    private String organization;

    @Value("${app.signing.country:FR}")
    private String country;

    @Bean
    public TrustMaterial trustMaterial() {
        if ("generated".equalsIgnoreCase(mode)) {
            log.warn("Using generated in-memory trust material, signatures will not chain to a deployed CA");
            return TrustMaterialFactory.generate(organization, country);
        }
        if (!"keystore".equalsIgnoreCase(mode)) {
            throw new TrustMaterialException("Unknown trust material mode: " + mode);
        }

        Path dir = Path.of(keystoreDir);
        KeyStoreLocation ca = new KeyStoreLocation(dir.resolve(caFile), caAlias);
        if (!caRequired && !ca.getPath().toFile().isFile()) {
            log.warn("Internal CA key store {} not present, ephemeral signer certificates will be self-signed",
                    ca.getPath());
            ca = null;
        }

        TrustMaterial trustMaterial = TrustMaterialFactory.load(
                new KeyStoreLocation(dir.resolve(certifierFile), certifierAlias),
                ca,
                new KeyStoreLocation(dir.resolve(tsaFile), tsaAlias),
                passphrase.toCharArray());
        log.info("Trust material ready: {} validation certificates", trustMaterial.getValidationCertificates().size());
        return trustMaterial;
    }
}
