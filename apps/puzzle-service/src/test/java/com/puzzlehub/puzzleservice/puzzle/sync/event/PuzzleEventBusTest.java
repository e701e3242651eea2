package com.puzzlehub.puzzleservice.puzzle.sync.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class PuzzleEventBusTest {

    @Test
    void failingListenerDoesNotStopOthers() {
        PuzzleEventBus bus = new PuzzleEventBus();
        List<String> hosts = new ArrayList<>();
        bus.add(new PuzzleEventListener() {
            @Override
            public void onHostChanged(String hostId) {
                throw new IllegalStateException("socket closed");
            }
        });
        bus.add(new PuzzleEventListener() {
            @Override
            public void onHostChanged(String hostId) {
                hosts.add(hostId);
            }
        });

        assertThatCode(() -> bus.fire(l -> l.onHostChanged("bob"))).doesNotThrowAnyException();
        assertThat(hosts).containsExactly("bob");
    }

    @Test
    void removedListenerIsNotCalled() {
        PuzzleEventBus bus = new PuzzleEventBus();
        List<String> hosts = new ArrayList<>();
        PuzzleEventListener listener = new PuzzleEventListener() {
            @Override
            public void onHostChanged(String hostId) {
                hosts.add(hostId);
            }
        };
        bus.add(listener);
        bus.remove(listener);

        bus.fire(l -> l.onHostChanged("bob"));

        assertThat(hosts).isEmpty();
    }
}
