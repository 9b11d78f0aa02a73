package com.newsrelay.model;

public record PublishResult(
    Destination destination,
    boolean success,
    String postId,
    String errorDetail,
    int attempts
) {
    public static PublishResult ok(Destination destination, String postId, int attempts) {
        return new PublishResult(destination, true, postId, null, attempts);
    }

    public static PublishResult failed(Destination destination, String errorDetail, int attempts) {
        return new PublishResult(destination, false, null, errorDetail, attempts);
    }
}
