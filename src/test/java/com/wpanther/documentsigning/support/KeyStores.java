package com.wpanther.documentsigning.support;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.X509Certificate;

import com.wpanther.documentsigning.model.SigningIdentity;

/**
 * Writes identities to PKCS#12 files so the loading path can be tested.
 */
public final class KeyStores {

    private KeyStores() {
    }

    public static Path writePkcs12(SigningIdentity identity, String alias, Path target, char[] passphrase) {
        try (OutputStream out = Files.newOutputStream(target)) {
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(null, null);
            keyStore.setKeyEntry(alias, identity.getPrivateKey(), passphrase,
                    identity.getChain().toArray(new X509Certificate[0]));
            keyStore.store(out, passphrase);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Could not write key store " + target, e);
        }
    }
}
