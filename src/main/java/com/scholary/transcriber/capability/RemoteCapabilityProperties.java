package com.scholary.transcriber.capability;

/** Settings every remote model server shares. */
public interface RemoteCapabilityProperties {

  boolean enabled();

  String baseUrl();

  int connectTimeout();

  int readTimeout();

  String model();

  String device();

  boolean serializeCalls();
}
