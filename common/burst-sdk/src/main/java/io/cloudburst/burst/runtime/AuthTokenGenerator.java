package io.cloudburst.burst.runtime;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Issues readiness tokens handed to VMs at provisioning time.
 * <p>
 * A token is never issued twice by the same generator, so a consumed token can never be
 * handed to a second VM.
 */
public final class AuthTokenGenerator {

  private static final int TOKEN_BYTES = 24;

  private final Supplier<String> source;
  private final Set<String> issued = ConcurrentHashMap.newKeySet();

  public AuthTokenGenerator() {
    this(randomSource(new SecureRandom()));
  }

  AuthTokenGenerator(Supplier<String> source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  public String next() {
    String token = source.get();
    while (token == null || token.isBlank() || !issued.add(token)) {
      token = source.get();
    }
    return token;
  }

  private static Supplier<String> randomSource(SecureRandom random) {
    Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
    return () -> {
      byte[] bytes = new byte[TOKEN_BYTES];
      random.nextBytes(bytes);
      return encoder.encodeToString(bytes);
    };
  }
}
