package com.switchyard.sdk.server;

import com.google.common.collect.ImmutableSet;

import java.util.HashSet;
import java.util.Set;

/**
 * An immutable snapshot of one named id list. Updates produce a new instance, which the store swaps
 * in atomically, so an evaluation holding an old instance keeps a consistent view.
 */
final class IdList {
  private final String name;
  private final long size;
  private final long creationTime;
  private final String url;
  private final String fileID;
  private final ImmutableSet<String> ids;
  
  IdList(String name, long size, long creationTime, String url, String fileID, ImmutableSet<String> ids) {
    this.name = name;
    this.size = size;
    this.creationTime = creationTime;
    this.url = url;
    this.fileID = fileID;
    this.ids = ids;
  }
  
  static IdList empty(String name, long creationTime, String url, String fileID) {
    return new IdList(name, 0, creationTime, url, fileID, ImmutableSet.<String>of());
  }
  
  String getName() {
    return name;
  }
  
  /**
   * The number of bytes of the list file consumed so far; the next download starts at this offset.
   */
  long getSize() {
    return size;
  }
  
  long getCreationTime() {
    return creationTime;
  }
  
  String getUrl() {
    return url;
  }
  
  String getFileID() {
    return fileID;
  }
  
  Set<String> getIds() {
    return ids;
  }
  
  boolean contains(String hashedId) {
    return ids.contains(hashedId);
  }
  
  /**
   * Applies a chunk of newline-delimited {@code +id} / {@code -id} records.
   * 
   * @param body the downloaded chunk
   * @param byteCount the number of bytes the chunk occupied in the file
   * @return the updated list
   * @throws IllegalArgumentException if the chunk does not start with a record marker
   */
  IdList applyChanges(String body, long byteCount) {
    if (body.isEmpty()) {
      return this;
    }
    char first = body.charAt(0);
    if (first != '+' && first != '-') {
      throw new IllegalArgumentException("id list \"" + name + "\" chunk does not start with a record marker");
    }
    Set<String> updated = new HashSet<>(ids);
    for (String line: body.split("\\r?\\n")) {
      if (line.length() < 2) {
        continue;
      }
      String id = line.substring(1);
      if (line.charAt(0) == '+') {
        updated.add(id);
      } else if (line.charAt(0) == '-') {
        updated.remove(id);
      }
    }
    return new IdList(name, size + byteCount, creationTime, url, fileID, ImmutableSet.copyOf(updated));
  }
}
