package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.Box;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BoxWorkspaceTest {

    @Test
    void awaitNext_returnsEachPublishedBoxOnce() throws Exception {
        BoxWorkspace workspace = new BoxWorkspace();
        Box first = new Box(0, List.of(), 0.0);
        workspace.publish(first);

        BoxWorkspace.BoxSlot slot = workspace.awaitNext(0).orElseThrow();
        assertSame(first, slot.box());

        CompletableFuture<Optional<BoxWorkspace.BoxSlot>> next = CompletableFuture.supplyAsync(() -> {
            try {
                return workspace.awaitNext(slot.sequence());
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        workspace.withdraw();
        Box second = new Box(1, List.of(), 0.0);
        workspace.publish(second);

        assertEquals(1, next.get(5, TimeUnit.SECONDS).orElseThrow().box().getId());
    }

    @Test
    void cancel_releasesWaitingAgents() throws Exception {
        BoxWorkspace workspace = new BoxWorkspace();
        CompletableFuture<Optional<BoxWorkspace.BoxSlot>> waiting = CompletableFuture.supplyAsync(() -> {
            try {
                return workspace.awaitNext(0);
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        workspace.cancel();

        assertTrue(waiting.get(5, TimeUnit.SECONDS).isEmpty());
        assertTrue(workspace.isCancelled());
    }
}
