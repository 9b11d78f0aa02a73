package com.newsrelay.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FeedText")
class FeedTextTest {

    @Nested
    @DisplayName("toPlainText")
    class ToPlainText {

        @Test
        @DisplayName("should return empty string for null")
        void shouldReturnEmptyForNull() {
            assertThat(FeedText.toPlainText(null)).isEmpty();
        }

        @Test
        @DisplayName("should strip tags and decode entities")
        void shouldStripMarkup() {
            assertThat(FeedText.toPlainText("<p>Tom &amp; <b>Jerry</b></p>")).isEqualTo("Tom & Jerry");
        }

        @Test
        @DisplayName("should collapse whitespace in plain text")
        void shouldCollapseWhitespace() {
            assertThat(FeedText.toPlainText("  one\n\n  two  ")).isEqualTo("one two");
        }
    }

    @Nested
    @DisplayName("firstLink")
    class FirstLink {

        @Test
        @DisplayName("should prefer anchor href")
        void shouldPreferAnchor() {
            String html = "See https://plain.example.com or <a href=\"https://anchor.example.com/a\">here</a>";
            assertThat(FeedText.firstLink(html)).isEqualTo("https://anchor.example.com/a");
        }

        @Test
        @DisplayName("should fall back to a URL in the text")
        void shouldFindUrlInText() {
            assertThat(FeedText.firstLink("More at https://example.com/story.")).isEqualTo("https://example.com/story");
        }

        @Test
        @DisplayName("should return null when there is no link")
        void shouldReturnNullWithoutLink() {
            assertThat(FeedText.firstLink("no links here")).isNull();
        }
    }

    @Test
    @DisplayName("firstImage should return the first absolute img src")
    void firstImage() {
        assertThat(FeedText.firstImage("<p><img src=\"/rel.png\"><img src=\"https://cdn.example.com/a.png\"></p>"))
                .isEqualTo("https://cdn.example.com/a.png");
    }

    @Test
    @DisplayName("looksLikeImage should ignore query strings and case")
    void looksLikeImage() {
        assertThat(FeedText.looksLikeImage("https://cdn.example.com/A.JPG?w=200")).isTrue();
        assertThat(FeedText.looksLikeImage("https://example.com/article")).isFalse();
    }

    @Test
    @DisplayName("firstNonBlank should skip null and blank values")
    void firstNonBlank() {
        assertThat(FeedText.firstNonBlank(null, "  ", " x ")).isEqualTo("x");
        assertThat(FeedText.firstNonBlank(null, "")).isEmpty();
    }

    @Test
    @DisplayName("truncate should append an ellipsis when cutting")
    void truncate() {
        assertThat(FeedText.truncate("abcdef", 4)).isEqualTo("abc…");
        assertThat(FeedText.truncate("abc", 4)).isEqualTo("abc");
    }
}
