package io.caresync.sync;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user access token cache. Tokens are only ever used by the user's serialized
 * sync pass, so a plain concurrent map is enough.
 */
final class TokenCache {
  private final Map<String, AccessToken> tokens = new ConcurrentHashMap<>();

  AccessToken get(String userId, Instant now) {
    AccessToken token = tokens.get(userId);
    if (token == null || token.isExpired(now)) {
      return null;
    }
    return token;
  }

  void put(String userId, AccessToken token) {
    tokens.put(userId, token);
  }

  void invalidate(String userId) {
    tokens.remove(userId);
  }
}
