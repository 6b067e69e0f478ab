package com.eainde.langextract.chunk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextChunkerTest {

    private static String words(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append("word").append(i % 10);
        }
        return sb.toString();
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("defaults are 8000 chars with 200 overlap")
        void defaults() {
            TextChunker chunker = TextChunker.builder().build();

            assertThat(chunker.getMaxChars()).isEqualTo(8000);
            assertThat(chunker.getOverlapChars()).isEqualTo(200);
        }

        @Test
        @DisplayName("rejects non-positive size and overlap not below size")
        void invalid() {
            assertThatThrownBy(() -> TextChunker.builder().maxChars(0).build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> TextChunker.builder().maxChars(100).overlapChars(100).build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> TextChunker.builder().maxChars(100).overlapChars(-1).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Chunking")
    class Chunking {

        @Test
        @DisplayName("short text is a single chunk")
        void shortText() {
            TextChunker chunker = TextChunker.builder().maxChars(100).overlapChars(10).build();

            List<TextChunk> chunks = chunker.chunk("short text");

            assertThat(chunker.needsChunking("short text")).isFalse();
            assertThat(chunks).singleElement().satisfies(c -> {
                assertThat(c.start()).isZero();
                assertThat(c.end()).isEqualTo(10);
                assertThat(c.isLast()).isTrue();
            });
        }

        @Test
        @DisplayName("long text is covered completely by overlapping chunks that match the source")
        void coverage() {
            String text = words(200);
            TextChunker chunker = TextChunker.builder().maxChars(100).overlapChars(20).build();

            List<TextChunk> chunks = chunker.chunk(text);

            assertThat(chunker.needsChunking(text)).isTrue();
            assertThat(chunks.size()).isGreaterThan(1);
            assertThat(chunks.get(0).start()).isZero();
            assertThat(chunks.get(chunks.size() - 1).end()).isEqualTo(text.length());
            for (int i = 0; i < chunks.size(); i++) {
                TextChunk chunk = chunks.get(i);
                assertThat(chunk.index()).isEqualTo(i);
                assertThat(chunk.totalChunks()).isEqualTo(chunks.size());
                assertThat(chunk.length()).isLessThanOrEqualTo(100);
                assertThat(chunk.text()).isEqualTo(text.substring(chunk.start(), chunk.end()));
                if (i > 0) {
                    TextChunk previous = chunks.get(i - 1);
                    assertThat(chunk.start()).isGreaterThan(previous.start()).isLessThanOrEqualTo(previous.end());
                }
            }
        }

        @Test
        @DisplayName("chunks end after whitespace so words stay whole")
        void breaksOnWhitespace() {
            String text = words(200);
            TextChunker chunker = TextChunker.builder().maxChars(100).overlapChars(20).build();

            List<TextChunk> chunks = chunker.chunk(text);

            chunks.subList(0, chunks.size() - 1)
                    .forEach(c -> assertThat(text.charAt(c.end() - 1)).isEqualTo(' '));
        }

        @Test
        @DisplayName("text without whitespace is cut at the hard limit")
        void hardCut() {
            String text = "x".repeat(250);
            TextChunker chunker = TextChunker.builder().maxChars(100).overlapChars(10).build();

            List<TextChunk> chunks = chunker.chunk(text);

            assertThat(chunks).extracting(TextChunk::start).containsExactly(0, 90, 180);
            assertThat(chunks).extracting(TextChunk::end).containsExactly(100, 190, 250);
        }
    }
}
