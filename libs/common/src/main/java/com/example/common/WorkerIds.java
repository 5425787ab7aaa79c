/*
 * どこで: 共通ユーティリティ
 * 何を: lease の所有者として使うワーカー識別子を生成する
 * なぜ: 同一ホストで複数ワーカーを動かしても claim 所有者が衝突しないようにするため
 */
package com.example.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class WorkerIds {

  private static final Logger logger = LoggerFactory.getLogger(WorkerIds.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  private static final int SUFFIX_LENGTH = 8;

  private WorkerIds() {}

  public static String newWorkerId() {
    return resolveHostname() + ":" + UUID.randomUUID().toString().substring(0, SUFFIX_LENGTH);
  }

  static String resolveHostname() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
