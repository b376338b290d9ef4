package com.demo.chat.infrastructure;

import com.demo.chat.domain.AuthResult;
import com.demo.chat.domain.CloseReason;
import com.demo.chat.domain.UserStatus;
import com.demo.chat.service.ActionRateLimiter;
import com.demo.chat.service.TypingTracker;
import com.demo.chat.support.BrokerFixture;
import com.demo.chat.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class ChatDispatcherTest {

    private BrokerFixture broker;

    @BeforeEach
    void setUp() {
        broker = new BrokerFixture();
    }

    private JsonNode last(String connectionId) {
        return broker.transport.lastFrame(connectionId);
    }

    private String errorCode(String connectionId) {
        JsonNode frame = last(connectionId);
        assertThat(frame.path("type").asText()).isEqualTo("ERROR");
        return frame.path("payload").path("code").asText();
    }

    private List<JsonNode> ofType(String connectionId, String type) {
        return broker.transport.framesOfType(connectionId, type);
    }

    @Nested
    class Authentication {

        @Test
        void authenticateAndJoinGeneral() {
            broker.connect("c1");
            broker.send("c1", "AUTHENTICATE", Map.of("token", "t", "username", "alice"), "req-1");

            JsonNode success = last("c1");
            assertThat(success.path("type").asText()).isEqualTo("AUTH_SUCCESS");
            assertThat(success.path("requestId").asText()).isEqualTo("req-1");
            assertThat(success.path("payload").path("status").asText()).isEqualTo("online");
            assertThat(success.path("payload").path("username").asText()).isEqualTo("alice");
            assertThat(success.path("payload").path("rooms").findValuesAsText("id")).contains("general", "random");
            String userId = success.path("payload").path("userId").asText();

            broker.join("c1", "general");

            JsonNode joined = last("c1");
            assertThat(joined.path("type").asText()).isEqualTo("ROOM_JOINED");
            assertThat(joined.path("payload").path("room").path("id").asText()).isEqualTo("general");
            assertThat(joined.path("payload").path("messages")).isEmpty();
            assertThat(joined.path("payload").path("members").findValuesAsText("userId")).containsExactly(userId);
            assertThat(broker.presenceStore.get(userId).getStatus()).isEqualTo(UserStatus.ONLINE);
        }

        @Test
        void actionBeforeAuthenticationIsUnauthorized() {
            broker.connect("c1");

            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "hi"), "r1");

            assertThat(errorCode("c1")).isEqualTo("UNAUTHORIZED");
            assertThat(last("c1").path("requestId").asText()).isEqualTo("r1");
            assertThat(broker.registry.find("c1")).isPresent();
            assertThat(broker.transport.closeReason("c1")).isNull();
        }

        @Test
        void pingIsAllowedBeforeAuthentication() {
            broker.connect("c1");

            broker.send("c1", "PING", Map.of(), "p1");

            assertThat(last("c1").path("type").asText()).isEqualTo("PONG");
            assertThat(last("c1").path("requestId").asText()).isEqualTo("p1");
        }

        @Test
        void failedAuthenticationRepliesAndCloses() {
            broker = new BrokerFixture((token, username) -> AuthResult.failure("bad token"), Runnable::run,
                new ActionRateLimiter(false, 10), null, 1000);
            broker.connect("c1");

            broker.send("c1", "AUTHENTICATE", Map.of("token", "t", "username", "alice"));

            assertThat(errorCode("c1")).isEqualTo("AUTHENTICATION_FAILED");
            assertThat(broker.transport.closeReason("c1")).isEqualTo(CloseReason.AUTHENTICATION_FAILED);
            assertThat(broker.registry.count()).isZero();
        }

        @Test
        void validatorExceptionCountsAsFailedAuthentication() {
            broker = new BrokerFixture((token, username) -> {
                throw new IllegalStateException("directory down");
            }, Runnable::run, new ActionRateLimiter(false, 10), null, 1000);
            broker.connect("c1");

            broker.send("c1", "AUTHENTICATE", Map.of("token", "t", "username", "alice"));

            assertThat(errorCode("c1")).isEqualTo("AUTHENTICATION_FAILED");
            assertThat(broker.registry.count()).isZero();
        }

        @Test
        void secondAuthenticateIsForbidden() {
            broker.login("c1", "alice");

            broker.send("c1", "AUTHENTICATE", Map.of("token", "t", "username", "bob"));

            assertThat(errorCode("c1")).isEqualTo("FORBIDDEN");
        }

        @Test
        void pendingAuthenticationRejectsOtherActionsAndLateResultIsDiscarded() {
            List<Runnable> queued = new ArrayList<>();
            broker = new BrokerFixture(null, queued::add, new ActionRateLimiter(false, 10), null, 1000);
            broker.connect("c1");

            broker.send("c1", "AUTHENTICATE", Map.of("token", "t", "username", "alice"));
            broker.send("c1", "JOIN_ROOM", Map.of("roomId", "general"));
            assertThat(errorCode("c1")).isEqualTo("UNAUTHORIZED");

            broker.dispatcher.onClose("c1", CloseReason.NORMAL);
            queued.forEach(Runnable::run);

            assertThat(ofType("c1", "AUTH_SUCCESS")).isEmpty();
            assertThat(broker.registry.count()).isZero();
            assertThat(broker.presenceStore.onlineCount()).isZero();
        }
    }

    @Nested
    class Validation {

        @Test
        void malformedFramesKeepConnectionOpen() {
            broker.login("c1", "alice");

            broker.dispatcher.onFrame("c1", "{not json");
            assertThat(errorCode("c1")).isEqualTo("INVALID_MESSAGE");

            broker.dispatcher.onFrame("c1", "{\"type\":\"DANCE\",\"requestId\":\"x\"}");
            assertThat(errorCode("c1")).isEqualTo("INVALID_MESSAGE");
            assertThat(last("c1").path("requestId").asText()).isEqualTo("x");

            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "hi", "color", "red"));
            assertThat(errorCode("c1")).isEqualTo("INVALID_MESSAGE");

            assertThat(broker.transport.closeReason("c1")).isNull();
        }

        @Test
        void rateLimitAppliesPerActionType() {
            broker = BrokerFixture.withRateLimiter(new ActionRateLimiter(true, 10, new AtomicLong()::get));
            broker.login("c1", "alice");
            broker.join("c1", "general");

            for (int i = 0; i < 10; i++) {
                broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "m" + i));
            }
            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "one too many"));
            assertThat(errorCode("c1")).isEqualTo("RATE_LIMIT_EXCEEDED");

            broker.send("c1", "TYPING_STATUS", Map.of("roomId", "general", "isTyping", true));
            assertThat(ofType("c1", "ERROR")).hasSize(1);
            assertThat(broker.messageLog.size("general")).isEqualTo(10);
        }

        @Test
        void unexpectedHandlerFailureTerminatesOnlyThatConnection() {
            TypingTracker failing = spy(new TypingTracker(new MutableClock(Instant.parse("2024-03-01T10:00:00Z"))));
            doThrow(new IllegalStateException("boom")).when(failing).setTyping(anyString(), anyString(), any(Duration.class));
            broker = new BrokerFixture(null, Runnable::run, new ActionRateLimiter(false, 10), failing, 1000);
            broker.login("c1", "alice");
            broker.login("c2", "bob");
            broker.join("c1", "general");
            broker.join("c2", "general");

            broker.send("c1", "TYPING_STATUS", Map.of("roomId", "general", "isTyping", true), "t1");

            assertThat(errorCode("c1")).isEqualTo("INTERNAL_ERROR");
            assertThat(broker.transport.closeReason("c1")).isEqualTo(CloseReason.SERVER_ERROR);
            assertThat(broker.registry.find("c1")).isEmpty();
            assertThat(broker.registry.find("c2")).isPresent();
        }
    }

    @Nested
    class Messaging {

        private String alice;
        private String bob;

        @BeforeEach
        void joinBoth() {
            alice = broker.login("c1", "alice");
            bob = broker.login("c2", "bob");
            broker.join("c1", "general");
            broker.join("c2", "general");
        }

        @Test
        void messageReachesEveryMemberIncludingSender() {
            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "hi"), "m-1");

            JsonNode echoed = last("c1");
            JsonNode delivered = last("c2");
            assertThat(echoed.path("type").asText()).isEqualTo("NEW_MESSAGE");
            assertThat(echoed.path("requestId").asText()).isEqualTo("m-1");
            assertThat(delivered.path("payload").path("content").asText()).isEqualTo("hi");
            assertThat(delivered.path("payload").path("senderId").asText()).isEqualTo(alice);
            assertThat(delivered.path("payload").path("kind").asText()).isEqualTo("text");
            assertThat(delivered.path("payload").path("id").asLong()).isEqualTo(echoed.path("payload").path("id").asLong());
        }

        @Test
        void fanOutPreservesAppendOrder() {
            for (int i = 0; i < 50; i++) {
                broker.send(i % 2 == 0 ? "c1" : "c2", "SEND_MESSAGE", Map.of("roomId", "general", "content", "m" + i));
            }

            List<Long> seen = new ArrayList<>();
            ofType("c2", "NEW_MESSAGE").forEach(frame -> seen.add(frame.path("payload").path("id").asLong()));
            assertThat(seen).hasSize(50).isSorted();
            List<Long> logged = new ArrayList<>();
            broker.messageLog.tail("general", 100).forEach(m -> logged.add(m.getId()));
            assertThat(seen).isEqualTo(logged);
        }

        @Test
        void concurrentSendersAreDeliveredInIdOrder() throws InterruptedException {
            List<String> senders = List.of("c1", "c2", "c3", "c4");
            broker.login("c3", "carol");
            broker.login("c4", "dave");
            broker.join("c3", "general");
            broker.join("c4", "general");
            ExecutorService pool = Executors.newFixedThreadPool(senders.size());
            CountDownLatch start = new CountDownLatch(1);
            try {
                for (String sender : senders) {
                    pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < 100; i++) {
                            broker.send(sender, "SEND_MESSAGE", Map.of("roomId", "general", "content", sender + "-" + i));
                        }
                        return null;
                    });
                }
                start.countDown();
                pool.shutdown();
                assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
            } finally {
                pool.shutdownNow();
            }

            for (String member : senders) {
                List<Long> seen = new ArrayList<>();
                ofType(member, "NEW_MESSAGE").forEach(frame -> seen.add(frame.path("payload").path("id").asLong()));
                assertThat(seen).hasSize(400).isSorted();
            }
        }

        @Test
        void nonMemberCannotSend() {
            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "random", "content", "hi"));
            assertThat(errorCode("c1")).isEqualTo("NOT_A_MEMBER");

            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "nowhere", "content", "hi"));
            assertThat(errorCode("c1")).isEqualTo("ROOM_NOT_FOUND");
        }

        @Test
        void joinReplaysRecentHistory() {
            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "before carol"));
            String carolConn = "c3";
            broker.login(carolConn, "carol");

            broker.join(carolConn, "general");

            JsonNode joined = last(carolConn);
            assertThat(joined.path("payload").path("messages").findValuesAsText("content")).containsExactly("before carol");
            assertThat(joined.path("payload").path("members").findValuesAsText("username"))
                .containsExactlyInAnyOrder("alice", "bob", "carol");
        }

        @Test
        void joinIsIdempotent() {
            broker.transport.clear();

            broker.join("c2", "general");
            broker.join("c2", "general");

            assertThat(ofType("c1", "USER_JOINED")).isEmpty();
            assertThat(ofType("c2", "ROOM_JOINED")).hasSize(2);
            assertThat(broker.roomStore.members("general")).containsExactlyInAnyOrder(alice, bob);
        }

        @Test
        void newMemberIsAnnouncedToOthersOnly() {
            broker.transport.clear();
            String carol = broker.login("c3", "carol");

            broker.join("c3", "general");

            JsonNode announced = ofType("c1", "USER_JOINED").get(0);
            assertThat(announced.path("payload").path("userId").asText()).isEqualTo(carol);
            assertThat(announced.path("payload").path("roomId").asText()).isEqualTo("general");
            assertThat(ofType("c3", "USER_JOINED")).isEmpty();
        }

        @Test
        void editByAuthorIsBroadcast() {
            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "helo"));
            long id = last("c1").path("payload").path("id").asLong();

            broker.send("c1", "EDIT_MESSAGE", Map.of("roomId", "general", "messageId", id, "content", "hello"));

            JsonNode updated = last("c2");
            assertThat(updated.path("type").asText()).isEqualTo("MESSAGE_UPDATED");
            assertThat(updated.path("payload").path("content").asText()).isEqualTo("hello");
            assertThat(updated.path("payload").path("editedAt").asText()).isEqualTo("2024-03-01T10:00:00Z");
            assertThat(broker.messageLog.find("general", id).orElseThrow().getContent()).isEqualTo("hello");
        }

        @Test
        void editByOtherUserIsForbidden() {
            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "mine"));
            long id = last("c1").path("payload").path("id").asLong();

            broker.send("c2", "EDIT_MESSAGE", Map.of("roomId", "general", "messageId", id, "content", "yours"));

            assertThat(errorCode("c2")).isEqualTo("FORBIDDEN");
            assertThat(broker.messageLog.find("general", id).orElseThrow().getContent()).isEqualTo("mine");
        }

        @Test
        void deleteLeavesTombstone() {
            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "oops"));
            long id = last("c1").path("payload").path("id").asLong();

            broker.send("c1", "DELETE_MESSAGE", Map.of("roomId", "general", "messageId", id));

            JsonNode deleted = last("c2");
            assertThat(deleted.path("type").asText()).isEqualTo("MESSAGE_DELETED");
            assertThat(deleted.path("payload").path("messageId").asLong()).isEqualTo(id);
            assertThat(broker.messageLog.size("general")).isEqualTo(1);
            assertThat(broker.messageLog.find("general", id).orElseThrow().isDeleted()).isTrue();

            broker.send("c1", "EDIT_MESSAGE", Map.of("roomId", "general", "messageId", id, "content", "again"));
            assertThat(errorCode("c1")).isEqualTo("MESSAGE_NOT_FOUND");
        }

        @Test
        void reactionsToggle() {
            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "nice"));
            long id = last("c1").path("payload").path("id").asLong();

            broker.send("c2", "REACT_MESSAGE", Map.of("roomId", "general", "messageId", id, "emoji", "👍"));
            assertThat(last("c1").path("payload").path("reactions").findValuesAsText("userId")).containsExactly(bob);

            broker.send("c2", "REACT_MESSAGE", Map.of("roomId", "general", "messageId", id, "emoji", "👍"));
            assertThat(last("c1").path("payload").path("reactions")).isEmpty();
        }

        @Test
        void unknownMessageIdIsReported() {
            broker.send("c1", "REACT_MESSAGE", Map.of("roomId", "general", "messageId", 777, "emoji", "x"));

            assertThat(errorCode("c1")).isEqualTo("MESSAGE_NOT_FOUND");
        }

        @Test
        void historyPagesWithHasMore() {
            for (int i = 1; i <= 5; i++) {
                broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "m" + i));
            }
            long fourth = broker.messageLog.tail("general", 2).get(0).getId();

            broker.send("c2", "GET_ROOM_HISTORY", Map.of("roomId", "general", "beforeId", fourth, "limit", 2), "h1");

            JsonNode page = last("c2");
            assertThat(page.path("type").asText()).isEqualTo("ROOM_HISTORY");
            assertThat(page.path("requestId").asText()).isEqualTo("h1");
            assertThat(page.path("payload").path("messages").findValuesAsText("content")).containsExactly("m2", "m3");
            assertThat(page.path("payload").path("hasMore").asBoolean()).isTrue();

            broker.send("c2", "GET_ROOM_HISTORY", Map.of("roomId", "general", "beforeId", fourth, "limit", 10));
            assertThat(last("c2").path("payload").path("hasMore").asBoolean()).isFalse();
        }

        @Test
        void searchIsCaseInsensitiveAndSkipsDeleted() {
            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "Lunch at noon?"));
            broker.send("c2", "SEND_MESSAGE", Map.of("roomId", "general", "content", "lunch sounds good"));
            long gone = last("c2").path("payload").path("id").asLong();
            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "LUNCH!"));
            broker.send("c2", "DELETE_MESSAGE", Map.of("roomId", "general", "messageId", gone));

            broker.send("c1", "SEARCH_MESSAGES", Map.of("roomId", "general", "query", "lunch", "limit", 1));

            JsonNode results = last("c1");
            assertThat(results.path("type").asText()).isEqualTo("SEARCH_RESULTS");
            assertThat(results.path("payload").path("total").asInt()).isEqualTo(2);
            assertThat(results.path("payload").path("results").findValuesAsText("content")).containsExactly("Lunch at noon?");
        }

        @Test
        void statusUpdateNotifiesRoomPeers() {
            broker.send("c1", "UPDATE_STATUS", Map.of("status", "away"), "s1");

            assertThat(last("c1").path("type").asText()).isEqualTo("STATUS_UPDATED");
            assertThat(last("c1").path("payload").path("status").asText()).isEqualTo("away");
            JsonNode changed = last("c2");
            assertThat(changed.path("type").asText()).isEqualTo("USER_STATUS_CHANGED");
            assertThat(changed.path("payload").path("userId").asText()).isEqualTo(alice);
            assertThat(ofType("c1", "USER_STATUS_CHANGED")).isEmpty();
            assertThat(broker.presenceStore.get(alice).getStatus()).isEqualTo(UserStatus.AWAY);
        }

        @Test
        void failedSendDoesNotAbortFanOut() {
            broker.login("c3", "carol");
            broker.join("c3", "general");
            broker.transport.failSendsTo("c2");

            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "general", "content", "still here"));

            assertThat(ofType("c3", "NEW_MESSAGE")).hasSize(1);
            assertThat(ofType("c1", "NEW_MESSAGE")).hasSize(1);
        }
    }

    @Nested
    class Typing {

        @Test
        void typingIsNotEchoedToAnyOfTheTypersConnections() {
            broker.login("a1", "alice");
            broker.login("a2", "alice");
            broker.login("b1", "bob");
            broker.join("a1", "general");
            broker.join("b1", "general");
            broker.transport.clear();

            broker.send("a1", "TYPING_STATUS", Map.of("roomId", "general", "isTyping", true));

            JsonNode update = last("b1");
            assertThat(update.path("type").asText()).isEqualTo("TYPING_UPDATE");
            assertThat(update.path("payload").path("isTyping").asBoolean()).isTrue();
            assertThat(update.path("payload").path("username").asText()).isEqualTo("alice");
            assertThat(broker.transport.frames("a1")).isEmpty();
            assertThat(broker.transport.frames("a2")).isEmpty();
        }

        @Test
        void expiredTypingIsBroadcastAsStopped() {
            broker.login("a1", "alice");
            broker.login("b1", "bob");
            broker.join("a1", "general");
            broker.join("b1", "general");
            broker.send("a1", "TYPING_STATUS", Map.of("roomId", "general", "isTyping", true));

            broker.clock.advance(Duration.ofSeconds(6));
            broker.dispatcher.expireTyping(broker.clock.instant());

            JsonNode update = last("b1");
            assertThat(update.path("type").asText()).isEqualTo("TYPING_UPDATE");
            assertThat(update.path("payload").path("isTyping").asBoolean()).isFalse();
        }
    }

    @Nested
    class RoomLifecycle {

        @Test
        void leavingLastMemberDeletesRoomAndHistory() {
            broker.login("c1", "alice");
            broker.join("c1", "scratch");
            broker.send("c1", "SEND_MESSAGE", Map.of("roomId", "scratch", "content", "temp"));

            broker.send("c1", "LEAVE_ROOM", Map.of("roomId", "scratch"), "l1");

            assertThat(last("c1").path("type").asText()).isEqualTo("ROOM_LEFT");
            assertThat(broker.roomStore.exists("scratch")).isFalse();
            assertThat(broker.messageLog.isOpen("scratch")).isFalse();

            broker.join("c1", "scratch");
            assertThat(last("c1").path("payload").path("messages")).isEmpty();
        }

        @Test
        void leaveNotifiesRemainingMembers() {
            String alice = broker.login("c1", "alice");
            broker.login("c2", "bob");
            broker.join("c1", "general");
            broker.join("c2", "general");

            broker.send("c1", "LEAVE_ROOM", Map.of("roomId", "general"));

            JsonNode left = last("c2");
            assertThat(left.path("type").asText()).isEqualTo("USER_LEFT");
            assertThat(left.path("payload").path("userId").asText()).isEqualTo(alice);
            assertThat(broker.roomStore.exists("general")).isTrue();
        }

        @Test
        void leaveRequiresMembership() {
            broker.login("c1", "alice");

            broker.send("c1", "LEAVE_ROOM", Map.of("roomId", "random"));
            assertThat(errorCode("c1")).isEqualTo("NOT_A_MEMBER");

            broker.send("c1", "LEAVE_ROOM", Map.of("roomId", "unknown"));
            assertThat(errorCode("c1")).isEqualTo("ROOM_NOT_FOUND");
        }

        @Test
        void createRoomJoinsCreatorAndRejectsDuplicates() {
            String alice = broker.login("c1", "alice");

            broker.send("c1", "CREATE_ROOM", Map.of("roomId", "team", "name", "Team", "visibility", "private"), "cr");

            JsonNode created = last("c1");
            assertThat(created.path("type").asText()).isEqualTo("ROOM_CREATED");
            assertThat(created.path("payload").path("room").path("visibility").asText()).isEqualTo("private");
            assertThat(created.path("payload").path("members").findValuesAsText("userId")).containsExactly(alice);

            broker.login("c2", "bob");
            broker.send("c2", "CREATE_ROOM", Map.of("roomId", "team", "name", "Other"));
            assertThat(errorCode("c2")).isEqualTo("ROOM_ALREADY_EXISTS");
        }
    }

    @Nested
    class Disconnect {

        @Test
        void userStaysOnlineUntilLastConnectionCloses() {
            String alice = broker.login("a1", "alice");
            broker.login("a2", "alice");
            broker.login("b1", "bob");
            broker.join("a1", "general");
            broker.join("b1", "general");
            broker.transport.clear();

            broker.dispatcher.onClose("a1", CloseReason.NORMAL);

            assertThat(ofType("b1", "USER_STATUS_CHANGED")).isEmpty();
            assertThat(broker.presenceStore.get(alice).getStatus()).isEqualTo(UserStatus.ONLINE);
            assertThat(broker.roomStore.members("general")).contains(alice);

            broker.clock.advance(Duration.ofMinutes(1));
            broker.dispatcher.onClose("a2", CloseReason.NORMAL);

            JsonNode offline = ofType("b1", "USER_STATUS_CHANGED").get(0);
            assertThat(offline.path("payload").path("userId").asText()).isEqualTo(alice);
            assertThat(offline.path("payload").path("status").asText()).isEqualTo("offline");
            assertThat(offline.path("payload").path("lastSeenAt").asText()).isEqualTo("2024-03-01T10:01:00Z");
            assertThat(ofType("b1", "USER_LEFT")).hasSize(1);
            assertThat(broker.presenceStore.get(alice).getStatus()).isEqualTo(UserStatus.OFFLINE);
            assertThat(broker.roomStore.members("general")).doesNotContain(alice);
        }

        @Test
        void lastDisconnectDeletesRoomsLeftEmpty() {
            broker.login("c1", "alice");
            broker.join("c1", "side-room");

            broker.dispatcher.onClose("c1", CloseReason.NORMAL);

            assertThat(broker.roomStore.exists("side-room")).isFalse();
            assertThat(broker.messageLog.isOpen("side-room")).isFalse();
        }

        @Test
        void disconnectClearsTypingMarks() {
            broker.login("a1", "alice");
            broker.login("a2", "alice");
            broker.login("b1", "bob");
            broker.join("a1", "general");
            broker.join("b1", "general");
            broker.send("a1", "TYPING_STATUS", Map.of("roomId", "general", "isTyping", true));
            broker.transport.clear();

            broker.dispatcher.onClose("a1", CloseReason.NORMAL);

            JsonNode stopped = last("b1");
            assertThat(stopped.path("type").asText()).isEqualTo("TYPING_UPDATE");
            assertThat(stopped.path("payload").path("isTyping").asBoolean()).isFalse();
            assertThat(broker.typingTracker.activeTypers("general", broker.clock.instant())).isEmpty();
        }

        @Test
        void closeIsIdempotentAndFramesAfterCloseAreIgnored() {
            broker.login("c1", "alice");
            broker.dispatcher.onClose("c1", CloseReason.NORMAL);
            broker.transport.clear();

            broker.dispatcher.onClose("c1", CloseReason.NORMAL);
            broker.send("c1", "PING", Map.of());

            assertThat(broker.transport.frames("c1")).isEmpty();
            assertThat(broker.metricsService.getCounterValue("chat.connections.closed")).isEqualTo(1.0);
        }
    }
}
