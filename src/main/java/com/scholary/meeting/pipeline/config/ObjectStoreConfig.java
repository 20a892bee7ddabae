package com.scholary.meeting.pipeline.config;

import com.scholary.meeting.pipeline.objectstore.ObjectStoreClient;
import com.scholary.meeting.pipeline.objectstore.ObjectStoreProperties;
import com.scholary.meeting.pipeline.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the ObjectStoreClient from "objectstore.*" in application.yml. */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
