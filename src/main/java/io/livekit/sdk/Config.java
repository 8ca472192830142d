package io.livekit.sdk;

import io.livekit.sdk.signing.ClaimsSigner;
import io.livekit.sdk.signing.HmacJwtSigner;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Immutable configuration container used to bootstrap token codecs.
 *
 * <p>The API key and secret are optional here; a token without them is rejected when it is signed.
 */
public final class Config {

    public static final Duration DEFAULT_TTL = Duration.ofHours(6);
    public static final String ENV_API_KEY = "LIVEKIT_API_KEY";
    public static final String ENV_API_SECRET = "LIVEKIT_API_SECRET";

    private final String apiKey;
    private final String apiSecret;
    private final Duration defaultTtl;
    private final Clock clock;
    private final ClaimsSigner signer;

    private Config(Builder builder) {
        this.apiKey = builder.apiKey;
        this.apiSecret = builder.apiSecret;
        this.defaultTtl = builder.defaultTtl;
        this.clock = builder.clock;
        this.signer = builder.signer;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with credentials taken from {@value #ENV_API_KEY} and {@value #ENV_API_SECRET}.
     */
    public static Config fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    public static Config fromEnvironment(UnaryOperator<String> env) {
        return builder()
            .apiKey(env.apply(ENV_API_KEY))
            .apiSecret(env.apply(ENV_API_SECRET))
            .build();
    }

    public Config withDefaults() {
        Duration resolvedTtl = Optional.ofNullable(defaultTtl).orElse(DEFAULT_TTL);
        if (resolvedTtl.isNegative() || resolvedTtl.isZero()) {
            throw new IllegalArgumentException("DefaultTtl must be positive");
        }

        return new Builder()
            .apiKey(trimToNull(apiKey))
            .apiSecret(blankToNull(apiSecret))
            .defaultTtl(resolvedTtl)
            .clock(Optional.ofNullable(clock).orElseGet(Clock::systemUTC))
            .signer(Optional.ofNullable(signer).orElseGet(HmacJwtSigner::new))
            .buildInternal();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getApiSecret() {
        return apiSecret;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public Clock getClock() {
        return clock;
    }

    public ClaimsSigner getSigner() {
        return signer;
    }

    public static final class Builder {
        private String apiKey;
        private String apiSecret;
        private Duration defaultTtl;
        private Clock clock;
        private ClaimsSigner signer;

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder apiSecret(String apiSecret) {
            this.apiSecret = apiSecret;
            return this;
        }

        /**
         * Validity of tokens that do not set their own ttl.
         */
        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder signer(ClaimsSigner signer) {
            this.signer = signer;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
