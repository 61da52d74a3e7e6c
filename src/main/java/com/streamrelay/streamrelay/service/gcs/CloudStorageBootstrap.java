package com.streamrelay.streamrelay.service.gcs;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.storage.Storage;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.cloud.StorageClient;
import com.streamrelay.streamrelay.config.StorageProperties;
import com.streamrelay.streamrelay.exception.StorageConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Initializes the Firebase Admin SDK for the recordings bucket and hands out its Cloud Storage
 * client. Only used when the remote backend is selected.
 */
@Component
public class CloudStorageBootstrap {

    private static final Logger log = LoggerFactory.getLogger(CloudStorageBootstrap.class);
    static final String APP_NAME = "streamrelay-recordings";

    private final ResourceLoader resourceLoader;

    public CloudStorageBootstrap(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * @throws StorageConfigurationException if credentials cannot be loaded or the bucket is not
     *         accessible
     */
    public Storage storageFor(StorageProperties.Remote remote) {
        FirebaseApp app = firebaseApp(remote);
        try {
            // bucket() looks the bucket up and rejects a missing one
            return StorageClient.getInstance(app).bucket(remote.getBucket()).getStorage();
        } catch (RuntimeException e) {
            throw new StorageConfigurationException(
                    "Cloud Storage bucket not accessible: " + remote.getBucket() + " (" + e.getMessage() + ")", e);
        }
    }

    private FirebaseApp firebaseApp(StorageProperties.Remote remote) {
        for (FirebaseApp existing : FirebaseApp.getApps()) {
            if (APP_NAME.equals(existing.getName())) {
                log.info("Firebase Admin SDK already initialized for recordings.");
                return existing;
            }
        }

        FirebaseOptions.Builder options = FirebaseOptions.builder()
                .setCredentials(loadCredentials(remote.getCredentialsPath()))
                .setStorageBucket(remote.getBucket());
        if (remote.getProjectId() != null && !remote.getProjectId().isBlank()) {
            options.setProjectId(remote.getProjectId());
        }

        FirebaseApp app = FirebaseApp.initializeApp(options.build(), APP_NAME);
        log.info("Firebase Admin SDK initialized for bucket {}", remote.getBucket());
        return app;
    }

    private GoogleCredentials loadCredentials(String credentialsPath) {
        try {
            if (credentialsPath == null || credentialsPath.isBlank()) {
                log.info("No 'storage.remote.credentials-path' set, using application default credentials.");
                return GoogleCredentials.getApplicationDefault();
            }

            Resource resource = resourceLoader.getResource(credentialsPath);
            if (!resource.exists()) {
                throw new StorageConfigurationException("Credentials file not found: " + credentialsPath);
            }
            try (InputStream in = resource.getInputStream()) {
                return GoogleCredentials.fromStream(in);
            }
        } catch (IOException e) {
            throw new StorageConfigurationException("Failed to load Cloud Storage credentials: " + e.getMessage(), e);
        }
    }
}
