package com.switchyard.sdk.server;

import com.switchyard.sdk.internal.http.HttpErrors.HttpErrorException;

import java.io.Closeable;
import java.io.IOException;

/**
 * Internal abstraction for the sync endpoints. The only implementation is {@link DefaultSpecsRequestor},
 * but using an interface lets tests drive {@link SyncProcessor} without HTTP.
 */
interface SpecsRequestor extends Closeable {
  /**
   * Downloads the spec document.
   * 
   * @param sinceTime the server time of the document currently held, or 0 for a full document
   * @return the raw JSON document
   * @throws IOException for network errors
   * @throws HttpErrorException for HTTP error responses
   */
  String getConfigSpecs(long sinceTime) throws IOException, HttpErrorException;
  
  /**
   * Downloads the id list manifest.
   * 
   * @return the raw JSON manifest
   * @throws IOException for network errors
   * @throws HttpErrorException for HTTP error responses
   */
  String getIdListManifest() throws IOException, HttpErrorException;
  
  /**
   * Downloads an id list file starting at a byte offset.
   * 
   * @param url the list's URL from the manifest
   * @param offset the first byte to fetch
   * @return the downloaded chunk
   * @throws IOException for network errors
   * @throws HttpErrorException for HTTP error responses
   */
  IdListChunk getIdList(String url, long offset) throws IOException, HttpErrorException;
  
  /**
   * A downloaded range of an id list file.
   */
  static final class IdListChunk {
    final String body;
    final long byteCount;
    final long declaredLength;
    
    IdListChunk(String body, long byteCount, long declaredLength) {
      this.body = body;
      this.byteCount = byteCount;
      this.declaredLength = declaredLength;
    }
    
    /**
     * True if the server declared a length and the received byte count differs from it.
     */
    boolean isTruncated() {
      return declaredLength >= 0 && declaredLength != byteCount;
    }
  }
}
