package com.puzzlehub.puzzleservice.puzzle.application;

import com.puzzlehub.puzzleservice.infrastructure.store.InMemorySharedStore;
import com.puzzlehub.puzzleservice.infrastructure.store.StoreCodec;
import com.puzzlehub.puzzleservice.puzzle.config.PuzzleSyncProperties;
import com.puzzlehub.puzzleservice.puzzle.domain.constants.PuzzleMessages;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.CompletionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.LockResult;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.puzzle.infrastructure.store.PuzzleKeys;
import com.puzzlehub.puzzleservice.puzzle.interfaces.http.dto.ConfigurePuzzleRequest;
import com.puzzlehub.puzzleservice.puzzle.interfaces.http.dto.ParticipantSummary;
import com.puzzlehub.puzzleservice.puzzle.interfaces.http.dto.SessionSnapshot;
import com.puzzlehub.puzzleservice.puzzle.interfaces.ws.dto.PuzzleWsMessages.BroadcastEvent;
import com.puzzlehub.puzzleservice.puzzle.interfaces.ws.dto.PuzzleWsMessages.EventTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class PuzzleSessionServiceTest {

    private static final String SID = "s-1";

    private InMemorySharedStore store;
    private StoreCodec codec;
    private SimpMessagingTemplate messaging;
    private ParticipantClientRegistry registry;
    private PuzzleSessionService service;
    private final List<CompletionRecord> published = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        PuzzleSyncProperties props = new PuzzleSyncProperties();
        store = new InMemorySharedStore(props.getTxMaxAttempts());
        codec = new StoreCodec();
        messaging = mock(SimpMessagingTemplate.class);
        registry = new ParticipantClientRegistry(store, messaging);
        ParticipantClientFactory factory = new ParticipantClientFactory(
                store, codec, props, Clock.systemUTC(), published::add, null);
        service = new PuzzleSessionService(factory, registry, store);
    }

    private static ConfigurePuzzleRequest easyPuzzle() {
        ConfigurePuzzleRequest req = new ConfigurePuzzleRequest();
        req.setImageUrl("https://img.example/cat.png");
        req.setImageWidth(300);
        req.setImageHeight(200);
        req.setDifficulty("easy");
        return req;
    }

    private ParticipantRecord stored(String userId) {
        return codec.fromFields(store.read(PuzzleKeys.participant(SID, userId)), ParticipantRecord.class);
    }

    // ── session lifecycle ──────────────────────────────────────────────────

    @Test
    void creatorBecomesJoinedHostWithConfiguredPuzzle() {
        service.createSession("alice", "Alice", SID, easyPuzzle());

        SessionSnapshot snap = service.snapshot(SID, "alice");

        assertThat(snap.getSession().getPhase()).isEqualTo(SessionPhase.WAITING);
        assertThat(snap.getPuzzle().getTotalPieces()).isEqualTo(6);
        assertThat(snap.getParticipants()).extracting(ParticipantSummary::getParticipantId).containsExactly("alice");
        assertThat(snap.getParticipants().get(0).isHost()).isTrue();
        assertThat(snap.getParticipants().get(0).isOnline()).isTrue();
        assertThat(snap.getSyncStatus()).isEqualTo("CONNECTED");
    }

    @Test
    void blankSessionIdGetsGenerated() {
        String sid = service.createSession("alice", "Alice", " ", null).getSessionId();

        assertThat(sid).isNotBlank();
        assertThat(service.snapshot(sid, "alice").getPuzzle()).isNull();
    }

    @Test
    void joinedParticipantCannotRunHostCommands() {
        service.createSession("alice", "Alice", SID, easyPuzzle());
        service.join(SID, "bob", "Bob");

        assertThatThrownBy(() -> service.start(SID, "bob"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage(PuzzleMessages.ONLY_HOST);
        assertThat(service.snapshot(SID, "bob").getParticipants()).hasSize(2);
    }

    @Test
    void playingThroughTheServiceGrabsPieces() {
        service.createSession("alice", "Alice", SID, easyPuzzle());
        service.join(SID, "bob", "Bob");
        service.start(SID, "alice");

        assertThat(service.grab(SID, "bob", "piece-0-0")).isEqualTo(LockResult.GRANTED);
        assertThat(service.grab(SID, "alice", "piece-0-0")).isEqualTo(LockResult.DENIED);
        assertThat(service.completion(SID, "alice")).isNull();
    }

    @Test
    void eventsAreForwardedToEachUserQueue() {
        service.createSession("alice", "Alice", SID, easyPuzzle());
        service.join(SID, "bob", "Bob");

        service.start(SID, "alice");

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messaging, atLeastOnce()).convertAndSendToUser(eq("bob"), eq("/queue/puzzle." + SID), payload.capture());
        assertThat(payload.getAllValues())
                .extracting(e -> ((BroadcastEvent) e).getType())
                .contains(EventTypes.PHASE, EventTypes.PIECE);
    }

    // ── validation ─────────────────────────────────────────────────────────

    @Test
    void unknownSessionIsRejected() {
        assertThatThrownBy(() -> service.snapshot("nope", "alice"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage(PuzzleMessages.SESSION_NOT_FOUND);
    }

    @Test
    void strangerIsNotAParticipant() {
        service.createSession("alice", "Alice", SID, easyPuzzle());

        assertThatThrownBy(() -> service.grab(SID, "mallory", "piece-0-0"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage(PuzzleMessages.NOT_A_PARTICIPANT);
    }

    @Test
    void blankPieceIdIsRejected() {
        service.createSession("alice", "Alice", SID, easyPuzzle());

        assertThatThrownBy(() -> service.grab(SID, "alice", ""))
                .hasMessage(PuzzleMessages.PIECE_NOT_FOUND);
    }

    // ── reconnect / leave ──────────────────────────────────────────────────

    @Test
    void disconnectedUserIsRestoredOnNextCommand() {
        service.createSession("alice", "Alice", SID, easyPuzzle());
        service.join(SID, "bob", "Bob");

        assertThat(registry.disconnectUser("bob")).isEqualTo(1);
        assertThat(registry.get(SID, "bob")).isNull();
        assertThat(stored("bob").getLastHeartbeat()).isZero();

        assertThat(service.heartbeat(SID, "bob")).isTrue();

        assertThat(registry.get(SID, "bob")).isNotNull();
        assertThat(stored("bob").getLastHeartbeat()).isPositive();
        assertThat(stored("bob").getDisplayName()).isEqualTo("Bob");
    }

    @Test
    void leaveUnregistersClient() {
        service.createSession("alice", "Alice", SID, easyPuzzle());
        service.join(SID, "bob", "Bob");

        service.leave(SID, "bob");

        assertThat(registry.get(SID, "bob")).isNull();
        assertThat(stored("bob")).isNull();
    }

    @Test
    void teardownEndsEveryLocalClient() {
        service.createSession("alice", "Alice", SID, easyPuzzle());
        service.join(SID, "bob", "Bob");

        service.teardown(SID, "alice");

        assertThat(registry.size()).isZero();
        assertThat(store.read(PuzzleKeys.session(SID))).isEmpty();
    }
}
