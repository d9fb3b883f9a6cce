package com.libragraph.chatvault.core.chat;

import com.libragraph.chatvault.core.archive.ArchiveUnavailableException;
import com.libragraph.chatvault.core.crypto.IntegrityException;
import com.libragraph.chatvault.core.crypto.KeyDerivation;
import com.libragraph.chatvault.core.store.StoreDecryptor;
import com.libragraph.chatvault.core.test.CopyingExporter;
import com.libragraph.chatvault.core.test.TestArchiveBuilder;
import com.libragraph.chatvault.formats.message.MessageKey;
import com.libragraph.chatvault.formats.message.MessageValueWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class ChatStoreTest {

    static final long ALICE = 1_000_001L;
    static final long BOB = 1_000_002L;
    static final long BOOK_CLUB = 1_000_003L;
    static final long CAROL = 1_000_004L;

    @TempDir
    Path tmp;

    private CopyingExporter exporter;
    private ChatStore store;

    @BeforeEach
    void setUp() throws IOException {
        TestArchiveBuilder archive = new TestArchiveBuilder()
                .addPeer(ALICE, "Alice", "Smith", "alice", "+1 (555) 123-4567")
                .addPeer(BOB, "Bob", "", "bobby", "")
                .addGroup(BOOK_CLUB, "Book Club")
                .addPeer(CAROL, "Carol", "Jones", "", "+44 20 7946 0000")
                .addMessage(ALICE, 1_700_000_000, 1, new MessageValueWriter().text("hello alice"))
                .addMessage(ALICE, 1_700_000_100, 2, new MessageValueWriter().incoming(true).text("hi there"))
                .addMessage(ALICE, 1_700_000_200, 3, new MessageValueWriter().incoming(true).text("How are you?"))
                .addMessage(BOB, 1_700_000_050, 1, new MessageValueWriter().incoming(true).text("Bob says hello"))
                .addMessage(BOB, 1_700_000_060, 2, new MessageValueWriter().text("reply to bob"))
                .addMessage(BOOK_CLUB, 1_700_000_300, 1,
                        new MessageValueWriter().incoming(true).authorId(ALICE).text("meeting at noon"))
                .addMessage(BOOK_CLUB, 1_700_000_400, 2, new MessageValueWriter().text(""));

        Path plaintext = archive.writePlaintext(tmp.resolve("fixture.db"));
        exporter = new CopyingExporter(plaintext);
        store = storeOver(exporter);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private ChatStore storeOver(CopyingExporter exporter) throws IOException {
        KeyDerivation derivation = new KeyDerivation();
        Path container = TestArchiveBuilder.writeContainer(Files.createDirectories(tmp.resolve("container")), KeyDerivation.DEFAULT_PASSPHRASE);
        Path work = Files.createDirectories(tmp.resolve("work"));
        return ChatStore.forContainer(container, derivation, new StoreDecryptor(exporter, work));
    }

    @Test
    void shouldReadNewestMessagesFirstForOnePeer() {
        List<MessageRecord> messages = store.readMessages(ALICE, 50);

        assertThat(messages).extracting(MessageRecord::messageId).containsExactly(3, 2, 1);
        assertThat(messages).extracting(MessageRecord::text)
                .containsExactly("How are you?", "hi there", "hello alice");
        assertThat(messages).allMatch(m -> m.peerId() == ALICE);
        assertThat(messages.get(0).timestamp()).isEqualTo(Instant.ofEpochSecond(1_700_000_200));
    }

    @Test
    void shouldResolveMessageSenders() {
        List<MessageRecord> messages = store.readMessages(ALICE, 50);

        assertThat(messages).extracting(MessageRecord::sender)
                .containsExactly("Alice Smith", "Alice Smith", "Me");
        assertThat(store.readMessages(BOOK_CLUB, 50)).singleElement()
                .extracting(MessageRecord::sender).isEqualTo("Alice Smith");
    }

    @Test
    void shouldLimitRowsBeforeDroppingEmptyText() {
        assertThat(store.readMessages(ALICE, 2)).extracting(MessageRecord::messageId).containsExactly(3, 2);
        // newest row has no text, so a limit of one yields nothing
        assertThat(store.readMessages(BOOK_CLUB, 1)).isEmpty();
        assertThat(store.readMessages(999_999_999L, 10)).isEmpty();
    }

    @Test
    void shouldOrderRecentChatsByLatestMessage() {
        List<ChatSummary> recent = store.recentChats(10);

        assertThat(recent).extracting(ChatSummary::peerId).containsExactly(BOOK_CLUB, ALICE, BOB);
        assertThat(recent.get(0).name()).isEqualTo("Book Club");
        assertThat(recent.get(0).lastMessageAt()).isEqualTo(Instant.ofEpochSecond(1_700_000_400));
        assertThat(recent.get(1).username()).isEqualTo("alice");
        assertThat(store.recentChats(2)).extracting(ChatSummary::peerId).containsExactly(BOOK_CLUB, ALICE);
        assertThat(store.recentChats(0)).isEmpty();
    }

    @Test
    void shouldFindChatsByNameUsernameAndTitle() {
        assertThat(store.findChats("ALICE")).extracting(ChatSummary::peerId).containsExactly(ALICE);
        assertThat(store.findChats("bobby")).extracting(ChatSummary::peerId).containsExactly(BOB);
        assertThat(store.findChats("book")).extracting(ChatSummary::peerId).containsExactly(BOOK_CLUB);
        assertThat(store.findChats("nobody by that name")).isEmpty();
    }

    @Test
    void shouldFindChatsByPhoneDigitsIgnoringFormatting() {
        List<ChatSummary> found = store.findChats("5551234567");

        assertThat(found).extracting(ChatSummary::peerId).containsExactly(ALICE);
        assertThat(found.get(0).phone()).isEqualTo("+1 (555) 123-4567");
        assertThat(found.get(0).lastMessageAt()).isNull();
    }

    @Test
    void shouldFindPeerByPhone() {
        assertThat(store.findPeerByPhone("+44 20 7946 0000")).contains(CAROL);
        assertThat(store.findPeerByPhone("555-123")).contains(ALICE);
        assertThat(store.findPeerByPhone("+7 000")).isEmpty();
        assertThat(store.findPeerByPhone("no digits")).isEmpty();
    }

    @Test
    void shouldResolveLargeNumbersAsPeerIds() {
        assertThat(store.resolveIdentifier("  123456789 ")).contains(123_456_789L);
        assertThat(store.isOpen()).isFalse();
        assertThat(exporter.calls()).isZero();
    }

    @Test
    void shouldResolvePeerIdsWithoutArchive() {
        Path empty = tmp.resolve("no-container");
        try (ChatStore unavailable = ChatStore.forContainer(empty, new KeyDerivation(),
                new StoreDecryptor(new CopyingExporter(empty.resolve("none"))))) {
            assertThat(unavailable.isAvailable()).isFalse();
            assertThat(unavailable.resolveIdentifier("123456789")).contains(123_456_789L);
        }
    }

    @Test
    void shouldResolveNineteenDigitPeerIdWithoutArchive() {
        try (ChatStore none = new ChatStore(Optional.empty(), new KeyDerivation(),
                new StoreDecryptor(exporter))) {
            assertThat(none.resolveIdentifier("1000000000000000000")).contains(1_000_000_000_000_000_000L);
            assertThat(none.resolveIdentifier(String.valueOf(Long.MAX_VALUE))).contains(Long.MAX_VALUE);
            // too large for a long, so only a phone or name lookup can match
            assertThatThrownBy(() -> none.resolveIdentifier("99999999999999999999"))
                    .isInstanceOf(ArchiveUnavailableException.class);
        }
        assertThat(exporter.calls()).isZero();
    }

    @Test
    void shouldResolveByPhoneThenName() {
        assertThat(store.resolveIdentifier("+1 555 123 4567")).contains(ALICE);
        assertThat(store.resolveIdentifier("Carol")).contains(CAROL);
        assertThat(store.resolveIdentifier("nobody")).isEmpty();
    }

    @Test
    void shouldResolveSmallNumbersAsPhoneFragments() {
        assertThat(store.resolveIdentifier("4567")).contains(ALICE);
        assertThat(store.resolveIdentifier("99")).isEmpty();
    }

    @Test
    void shouldSearchCaseInsensitivelyInDescendingKeyOrder() {
        List<SearchHit> hits = store.searchMessages("HELLO", 10);

        assertThat(hits).extracting(SearchHit::text).containsExactly("Bob says hello", "hello alice");
        assertThat(hits.get(0).chatName()).isEqualTo("Bob");
        assertThat(hits.get(0).sender()).isEqualTo("Bob");
        assertThat(hits.get(1).sender()).isEqualTo("Me");
    }

    @Test
    void shouldStopSearchAtLimit() {
        assertThat(store.searchMessages("e", 2)).hasSize(2);
        assertThat(store.searchMessages("zzz", 10)).isEmpty();
    }

    @Test
    void shouldSkipMalformedRecords() throws IOException {
        Path other = Files.createDirectories(tmp.resolve("malformed"));
        byte[] truncated = Arrays.copyOf(new MessageValueWriter().text("lost").toByteArray(), 1);
        Path plaintext = new TestArchiveBuilder()
                .addPeer(ALICE, "Alice", "", "", "")
                .addRawPeer(BOB, new byte[]{1, 2})
                .addMessage(ALICE, 1_700_000_000, 1, new MessageValueWriter().text("needle one"))
                .addRawMessage(new MessageKey(ALICE, 0, 1_700_000_100, 2).encode(), truncated)
                .addRawMessage(new byte[]{1, 2, 3}, new MessageValueWriter().text("needle bad key").toByteArray())
                .addMessage(ALICE, 1_700_000_200, 3, new MessageValueWriter().text("needle two"))
                .writePlaintext(other.resolve("malformed.db"));

        KeyDerivation derivation = new KeyDerivation();
        Path container = TestArchiveBuilder.writeContainer(Files.createDirectories(other.resolve("c")), KeyDerivation.DEFAULT_PASSPHRASE);
        try (ChatStore malformed = ChatStore.forContainer(container, derivation,
                new StoreDecryptor(new CopyingExporter(plaintext), other))) {
            assertThat(malformed.searchMessages("needle", 10)).extracting(SearchHit::text)
                    .containsExactly("needle two", "needle one");
            assertThat(malformed.readMessages(ALICE, 10)).extracting(MessageRecord::messageId)
                    .containsExactly(3, 1);
            assertThat(malformed.findChats("")).extracting(ChatSummary::peerId).containsExactly(ALICE);
            assertThat(malformed.recentChats(10)).extracting(ChatSummary::peerId).containsExactly(ALICE);
            assertThat(malformed.exportMessages(0)).extracting(ExportedMessage::messageId).containsExactly(1, 3);
        }
    }

    @Test
    void shouldExportEmptyTextAndFilterBySince() {
        List<ExportedMessage> all = store.exportMessages(0);
        assertThat(all).hasSize(7);
        assertThat(all).extracting(ExportedMessage::peerId)
                .containsExactly(ALICE, ALICE, ALICE, BOB, BOB, BOOK_CLUB, BOOK_CLUB);

        List<ExportedMessage> recent = store.exportMessages(1_700_000_200);
        assertThat(recent).extracting(ExportedMessage::text)
                .containsExactly("How are you?", "meeting at noon", "");

        ExportedMessage outgoing = recent.get(2);
        assertThat(outgoing.fromMe()).isTrue();
        assertThat(outgoing.senderName()).isNull();
        assertThat(outgoing.peerName()).isEqualTo("Book Club");

        ExportedMessage incoming = recent.get(1);
        assertThat(incoming.fromMe()).isFalse();
        assertThat(incoming.senderName()).isEqualTo("Alice Smith");
    }

    @Test
    void shouldCountRows() {
        assertThat(store.stats()).isEqualTo(new ArchiveStats(7, 4));
    }

    @Test
    void shouldFallBackToEmptyPeer() {
        assertThat(store.peer(ALICE).displayName()).isEqualTo("Alice Smith");
        assertThat(store.peer(42L).displayName()).isEqualTo("Unknown");
    }

    @Test
    void shouldDecryptOnceWithUnwrappedKey() {
        store.stats();
        store.recentChats(5);
        store.readMessages(ALICE, 5);

        assertThat(exporter.calls()).isEqualTo(1);
        assertThat(exporter.keys()).containsExactly(TestArchiveBuilder.KEY);
    }

    @Test
    void shouldDeletePlaintextOnCloseIdempotently() {
        store.stats();
        Path plaintext = exporter.targets().get(0);
        assertThat(plaintext).exists();

        store.close();
        store.close();

        assertThat(plaintext).doesNotExist();
        assertThat(plaintext.getParent()).doesNotExist();
        assertThat(store.isOpen()).isFalse();
        assertThatIllegalStateException().isThrownBy(() -> store.stats());
    }

    @Test
    void shouldReportOpenStateWhileAnotherCallHoldsTheStore() throws InterruptedException {
        store.stats();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread longScan = new Thread(() -> {
            synchronized (store) {
                held.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });
        longScan.start();
        try {
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();
            boolean open = assertTimeoutPreemptively(Duration.ofSeconds(5), store::isOpen);
            assertThat(open).isTrue();
        } finally {
            release.countDown();
            longScan.join();
        }
    }

    @Test
    void shouldThrowWhenArchiveUnavailable() {
        Path empty = tmp.resolve("no-container");
        try (ChatStore unavailable = ChatStore.forContainer(empty, new KeyDerivation(),
                new StoreDecryptor(new CopyingExporter(empty.resolve("none"))))) {
            assertThatThrownBy(unavailable::stats).isInstanceOf(ArchiveUnavailableException.class);
            assertThatThrownBy(() -> unavailable.findChats("x")).isInstanceOf(ArchiveUnavailableException.class);
        }
    }

    @Test
    void shouldStopBeforeExportOnIntegrityFailure() throws IOException {
        Path other = Files.createDirectories(tmp.resolve("locked"));
        Path container = Files.createDirectories(other.resolve("c"));
        TestArchiveBuilder.writeContainer(container, "a different passphrase");
        CopyingExporter neverCalled = new CopyingExporter(other.resolve("none"));

        try (ChatStore locked = ChatStore.forContainer(container, new KeyDerivation(),
                new StoreDecryptor(neverCalled, other))) {
            assertThatThrownBy(locked::stats)
                    .isInstanceOf(IntegrityException.class)
                    .hasMessageContaining("passcode");
            assertThat(locked.isOpen()).isFalse();
        }
        assertThat(neverCalled.calls()).isZero();
    }

    @Test
    void shouldAcceptExplicitLocation() {
        try (ChatStore none = new ChatStore(Optional.empty(), new KeyDerivation(),
                new StoreDecryptor(exporter))) {
            assertThat(none.isAvailable()).isFalse();
            assertThat(none.isOpen()).isFalse();
        }
    }
}
