package io.livekit.sdk.grants;

/**
 * Webhook notified about egress progress. {@code signingKey} is treated as a credential.
 */
public record WebhookConfig(
    String url,
    String signingKey,
    FilterParams filterParams
) {
}
