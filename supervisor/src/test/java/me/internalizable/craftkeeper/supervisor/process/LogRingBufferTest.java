package me.internalizable.craftkeeper.supervisor.process;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogRingBufferTest {

    @Test
    void keepsLinesInArrivalOrder() {
        LogRingBuffer buffer = new LogRingBuffer(5);
        buffer.append("a");
        buffer.append("b");
        buffer.append("c");

        assertThat(buffer.tail(10)).containsExactly("a", "b", "c");
        assertThat(buffer.size()).isEqualTo(3);
    }

    @Test
    void evictsOldestWhenFull() {
        LogRingBuffer buffer = new LogRingBuffer(3);
        for (int i = 1; i <= 7; i++) {
            buffer.append("line " + i);
        }

        assertThat(buffer.size()).isEqualTo(3);
        assertThat(buffer.tail(3)).containsExactly("line 5", "line 6", "line 7");
    }

    @Test
    void tailReturnsMostRecentLines() {
        LogRingBuffer buffer = new LogRingBuffer(10);
        for (int i = 1; i <= 6; i++) {
            buffer.append(String.valueOf(i));
        }

        assertThat(buffer.tail(2)).containsExactly("5", "6");
    }

    @Test
    void nonPositiveTailIsEmpty() {
        LogRingBuffer buffer = new LogRingBuffer(4);
        buffer.append("x");

        assertThat(buffer.tail(0)).isEmpty();
        assertThat(buffer.tail(-3)).isEmpty();
    }

    @Test
    void clearDropsEverything() {
        LogRingBuffer buffer = new LogRingBuffer(4);
        buffer.append("x");
        buffer.clear();

        assertThat(buffer.size()).isZero();
        assertThat(buffer.tail(4)).isEmpty();
        assertThat(buffer.capacity()).isEqualTo(4);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new LogRingBuffer(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
