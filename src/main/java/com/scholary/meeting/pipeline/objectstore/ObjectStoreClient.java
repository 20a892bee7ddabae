package com.scholary.meeting.pipeline.objectstore;

import java.io.InputStream;

/**
 * Read access to the object storage holding meeting recordings.
 *
 * <p>Works against S3 or any S3-compatible service such as MinIO.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller closes it.
   *
   * @throws ObjectNotFoundException if the object does not exist
   * @throws ObjectStoreException if retrieval fails for any other reason
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Get object metadata without downloading the content.
   *
   * @throws ObjectNotFoundException if the object does not exist
   * @throws ObjectStoreException if the lookup fails for any other reason
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
