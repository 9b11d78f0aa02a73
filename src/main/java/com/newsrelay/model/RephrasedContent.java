package com.newsrelay.model;

public record RephrasedContent(
    String text,
    String sourceItemId
) {}
