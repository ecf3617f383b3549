package com.example.cyberprobe.util;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class BigQueryClients {

  static final String BIGQUERY_SCOPE = "https://www.googleapis.com/auth/bigquery";

  public static BigQuery open(String keyFile, String project) throws IOException {
    GoogleCredentials credentials;
    try (InputStream in = Files.newInputStream(Path.of(keyFile))) {
      credentials = ServiceAccountCredentials.fromStream(in).createScoped(List.of(BIGQUERY_SCOPE));
    }
    return BigQueryOptions.newBuilder()
        .setProjectId(project)
        .setCredentials(credentials)
        .build()
        .getService();
  }
}
