package com.libragraph.chatvault.api;

import com.libragraph.chatvault.core.chat.ChatStore;
import com.libragraph.chatvault.core.crypto.KeyDerivation;
import com.libragraph.chatvault.core.store.SqlCipherExporter;
import com.libragraph.chatvault.core.store.StoreDecryptor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Duration;

@ApplicationScoped
public class ChatStoreProducer {
    private static final Logger log = Logger.getLogger(ChatStoreProducer.class);

    @ConfigProperty(name = "chatvault.container-dir")
    String containerDir;

    @ConfigProperty(name = "chatvault.passphrase", defaultValue = KeyDerivation.DEFAULT_PASSPHRASE)
    String passphrase;

    @ConfigProperty(name = "chatvault.sqlcipher.binary", defaultValue = SqlCipherExporter.DEFAULT_BINARY)
    String sqlcipherBinary;

    @ConfigProperty(name = "chatvault.sqlcipher.timeout", defaultValue = "PT5M")
    Duration sqlcipherTimeout;

    @Produces
    @Singleton
    public ChatStore chatStore() {
        ChatStore store = ChatStore.forContainer(
                Path.of(containerDir),
                new KeyDerivation(passphrase),
                new StoreDecryptor(new SqlCipherExporter(sqlcipherBinary, sqlcipherTimeout)));
        if (store.isAvailable()) {
            log.infof("Chat archive found under %s", containerDir);
        } else {
            log.warnf("No chat archive under %s", containerDir);
        }
        return store;
    }

    /** Deletes the decrypted copy at shutdown. */
    public void close(@Disposes ChatStore store) {
        store.close();
    }
}
