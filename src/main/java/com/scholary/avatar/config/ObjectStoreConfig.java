package com.scholary.avatar.config;

import com.scholary.avatar.storage.ObjectStoreClient;
import com.scholary.avatar.storage.ObjectStoreProperties;
import com.scholary.avatar.storage.ObjectStoreStorageRelay;
import com.scholary.avatar.storage.S3ObjectStoreClient;
import com.scholary.avatar.storage.StorageRelay;
import java.nio.file.Paths;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>This wires up the ObjectStoreClient and the relay that copies provider videos into it, using
 * properties from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  public StorageRelay storageRelay(
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties properties,
      GenerationProperties generationProperties) {
    return new ObjectStoreStorageRelay(
        objectStoreClient,
        properties,
        Paths.get(generationProperties.tempDir()),
        generationProperties.downloadTimeout());
  }
}
