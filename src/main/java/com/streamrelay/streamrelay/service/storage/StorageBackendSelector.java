package com.streamrelay.streamrelay.service.storage;

import com.google.cloud.storage.Storage;
import com.streamrelay.streamrelay.config.StorageProperties;
import com.streamrelay.streamrelay.model.StorageBackendType;
import com.streamrelay.streamrelay.service.gcs.CloudStorageBootstrap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Function;

/**
 * Chooses the storage backend from configuration. Unknown or absent values fall back to local
 * storage with a warning; selection itself never fails. Constructing the remote backend may still
 * fail fast when the bucket is unreachable.
 */
@Component
public class StorageBackendSelector {

    private static final Logger logger = LoggerFactory.getLogger(StorageBackendSelector.class);

    private final Function<StorageProperties.Remote, Storage> storageFactory;

    @Autowired
    public StorageBackendSelector(CloudStorageBootstrap bootstrap) {
        this(bootstrap::storageFor);
    }

    StorageBackendSelector(Function<StorageProperties.Remote, Storage> storageFactory) {
        this.storageFactory = storageFactory;
    }

    public StorageBackend select(StorageProperties properties) {
        Optional<StorageBackendType> type = StorageBackendType.fromConfig(properties.getBackend());
        if (type.isEmpty()) {
            logger.warn("Unknown storage type: {}, defaulting to local", properties.getBackend());
            return new LocalStorageBackend(properties);
        }

        switch (type.get()) {
            case REMOTE:
                logger.info("Using Cloud Storage (bucket={})", properties.getRemote().getBucket());
                return new RemoteStorageBackend(storageFactory.apply(properties.getRemote()), properties);
            case LOCAL:
            default:
                logger.info("Using Local Storage");
                return new LocalStorageBackend(properties);
        }
    }
}
