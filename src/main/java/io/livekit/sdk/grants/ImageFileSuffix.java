package io.livekit.sdk.grants;

public enum ImageFileSuffix {
    IMAGE_SUFFIX_INDEX,
    IMAGE_SUFFIX_TIMESTAMP,
    IMAGE_SUFFIX_NONE_OVERWRITE
}
