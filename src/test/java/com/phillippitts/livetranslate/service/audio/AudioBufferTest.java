package com.phillippitts.livetranslate.service.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioBufferTest {

    @Test
    void appendsInOrderAndGrowsPastInitialCapacity() {
        AudioBuffer buffer = new AudioBuffer();
        byte[] big = new byte[100_000];
        big[99_999] = 7;

        buffer.append(new byte[]{1, 2});
        buffer.append(big);

        assertThat(buffer.size()).isEqualTo(100_002);
        byte[] snapshot = buffer.snapshot();
        assertThat(snapshot[0]).isEqualTo((byte) 1);
        assertThat(snapshot[100_001]).isEqualTo((byte) 7);
    }

    @Test
    void ignoresNullAndEmptyChunks() {
        AudioBuffer buffer = new AudioBuffer();
        buffer.append(null);
        buffer.append(new byte[0]);
        assertThat(buffer.isEmpty()).isTrue();
    }

    @Test
    void snapshotLeavesContentsInPlace() {
        AudioBuffer buffer = new AudioBuffer();
        buffer.append(new byte[]{1, 2, 3});

        byte[] snapshot = buffer.snapshot();
        snapshot[0] = 9;

        assertThat(buffer.size()).isEqualTo(3);
        assertThat(buffer.snapshot()).containsExactly(1, 2, 3);
    }

    @Test
    void discardPrefixKeepsBytesAppendedAfterSnapshot() {
        AudioBuffer buffer = new AudioBuffer();
        buffer.append(new byte[]{1, 2, 3});
        int submitted = buffer.snapshot().length;
        buffer.append(new byte[]{4, 5});

        buffer.discardPrefix(submitted);

        assertThat(buffer.snapshot()).containsExactly(4, 5);
    }

    @Test
    void discardPrefixRejectsOutOfRangeCounts() {
        AudioBuffer buffer = new AudioBuffer();
        buffer.append(new byte[]{1, 2});

        assertThatThrownBy(() -> buffer.discardPrefix(3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> buffer.discardPrefix(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(buffer.size()).isEqualTo(2);
    }

    @Test
    void drainAllReturnsEverythingAndEmptiesBuffer() {
        AudioBuffer buffer = new AudioBuffer();
        buffer.append(new byte[]{1, 2, 3});

        assertThat(buffer.drainAll()).containsExactly(1, 2, 3);
        assertThat(buffer.isEmpty()).isTrue();
        assertThat(buffer.drainAll()).isEmpty();
    }
}
