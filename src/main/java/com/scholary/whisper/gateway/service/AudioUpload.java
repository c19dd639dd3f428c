package com.scholary.whisper.gateway.service;

/** An uploaded audio file, held in memory until it has been handed to the backend. */
public record AudioUpload(String filename, byte[] data) {

  public AudioUpload {
    if (data == null) {
      throw new IllegalArgumentException("upload data must not be null");
    }
    filename = filename == null || filename.isBlank() ? "audio" : filename;
  }

  public int size() {
    return data.length;
  }

  /** File extension including the dot, or empty. Kept so the backend can sniff the container. */
  public String extension() {
    int dot = filename.lastIndexOf('.');
    if (dot < 0 || dot == filename.length() - 1) {
      return "";
    }
    String extension = filename.substring(dot);
    return extension.matches("\\.[A-Za-z0-9]{1,8}") ? extension : "";
  }
}
