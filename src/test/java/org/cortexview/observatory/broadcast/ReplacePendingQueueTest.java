package org.cortexview.observatory.broadcast;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ReplacePendingQueueTest {

    @Test
    void depthOneKeepsOnlyNewest() {
        final ReplacePendingQueue<String> queue = new ReplacePendingQueue<>(1);

        assertThat(queue.offer("a")).isZero();
        assertThat(queue.offer("b")).isEqualTo(1);
        assertThat(queue.offer("c")).isEqualTo(1);

        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.poll()).isEqualTo("c");
        assertThat(queue.poll()).isNull();
        assertThat(queue.replacedCount()).isEqualTo(2);
    }

    @Test
    void deeperQueueDropsOldestFirst() {
        final ReplacePendingQueue<Integer> queue = new ReplacePendingQueue<>(3);
        for (int i = 1; i <= 5; i++) {
            queue.offer(i);
        }

        assertThat(queue.poll()).isEqualTo(3);
        assertThat(queue.poll()).isEqualTo(4);
        assertThat(queue.poll()).isEqualTo(5);
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    void clearDropsPendingButKeepsReplacedCount() {
        final ReplacePendingQueue<String> queue = new ReplacePendingQueue<>(1);
        queue.offer("a");
        queue.offer("b");

        queue.clear();

        assertThat(queue.isEmpty()).isTrue();
        assertThat(queue.replacedCount()).isEqualTo(1);
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> new ReplacePendingQueue<String>(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReplacePendingQueue<String>(1).offer(null)).isInstanceOf(NullPointerException.class);
    }
}
