package com.libragraph.chatvault.core.chat;

import com.libragraph.chatvault.core.archive.ArchiveLocation;
import com.libragraph.chatvault.core.archive.ArchiveLocator;
import com.libragraph.chatvault.core.archive.ArchiveUnavailableException;
import com.libragraph.chatvault.core.crypto.KeyDerivation;
import com.libragraph.chatvault.core.dao.MessageDao;
import com.libragraph.chatvault.core.dao.MessageRow;
import com.libragraph.chatvault.core.dao.PeerDao;
import com.libragraph.chatvault.core.dao.PeerRow;
import com.libragraph.chatvault.core.db.StoreJdbi;
import com.libragraph.chatvault.core.store.PlaintextStore;
import com.libragraph.chatvault.core.store.StoreDecryptor;
import com.libragraph.chatvault.formats.ParseResult;
import com.libragraph.chatvault.formats.message.MessageKey;
import com.libragraph.chatvault.formats.message.MessageValue;
import com.libragraph.chatvault.formats.message.MessageValueParser;
import com.libragraph.chatvault.formats.peer.Peer;
import com.libragraph.chatvault.formats.peer.PeerParser;
import com.libragraph.chatvault.util.KeyMaterial;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only view of one encrypted chat archive.
 *
 * <p>The archive is decrypted on the first query that needs it and the
 * plaintext copy is reused until {@link #close()}, which deletes it. Peers
 * are cached for the lifetime of the instance. A record that fails to parse
 * is skipped; it never aborts a scan.
 *
 * <p>Instances are meant to be owned by one caller; methods are synchronized
 * so a shared instance stays consistent, but queries do not run in parallel.
 */
public class ChatStore implements AutoCloseable {
    private static final Logger log = Logger.getLogger(ChatStore.class);

    static final String OUTGOING_SENDER = "Me";
    static final long MIN_DIRECT_PEER_ID = 100_000L;

    private final Optional<ArchiveLocation> location;
    private final KeyDerivation keyDerivation;
    private final StoreDecryptor decryptor;

    private final Map<Long, Peer> peerCache = new HashMap<>();
    private PlaintextStore plaintext;
    // read without the lock by isOpen()
    private volatile Handle handle;
    private PeerDao peers;
    private MessageDao messages;
    private boolean closed;

    public ChatStore(Optional<ArchiveLocation> location, KeyDerivation keyDerivation, StoreDecryptor decryptor) {
        this.location = Objects.requireNonNull(location, "location cannot be null");
        this.keyDerivation = Objects.requireNonNull(keyDerivation, "keyDerivation cannot be null");
        this.decryptor = Objects.requireNonNull(decryptor, "decryptor cannot be null");
    }

    /**
     * Store over whatever archive {@link ArchiveLocator} finds under {@code containerDir}.
     */
    public static ChatStore forContainer(Path containerDir, KeyDerivation keyDerivation, StoreDecryptor decryptor) {
        return new ChatStore(ArchiveLocator.locate(containerDir), keyDerivation, decryptor);
    }

    /** Whether the archive files exist. Does not decrypt anything. */
    public boolean isAvailable() {
        return location.isPresent();
    }

    /** Does not wait for a running query. */
    public boolean isOpen() {
        return handle != null;
    }

    /**
     * Unwraps the key, decrypts the store and connects to the plaintext copy.
     * Does nothing if already open.
     *
     * @throws ArchiveUnavailableException if the archive files are missing
     * @throws com.libragraph.chatvault.core.crypto.IntegrityException if the key cannot be unwrapped
     * @throws com.libragraph.chatvault.core.store.DecryptionException if the export fails
     */
    public synchronized void open() {
        if (closed) {
            throw new IllegalStateException("ChatStore is closed");
        }
        if (handle != null) {
            return;
        }
        ArchiveLocation archive = location.orElseThrow(() -> new ArchiveUnavailableException(
                "Chat archive not found. Is the desktop app installed and logged in?"));

        KeyMaterial key = keyDerivation.deriveFromFile(archive.keyFile());
        PlaintextStore store = decryptor.decrypt(archive.database(), key);
        try {
            Handle opened = StoreJdbi.create(store.file()).open();
            peers = opened.attach(PeerDao.class);
            messages = opened.attach(MessageDao.class);
            handle = opened;
            plaintext = store;
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
        log.infof("Opened chat archive %s", archive.database());
    }

    /**
     * Releases the connection and deletes the plaintext copy. Safe to call repeatedly.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (handle != null) {
                handle.close();
            }
        } finally {
            handle = null;
            peers = null;
            messages = null;
            peerCache.clear();
            if (plaintext != null) {
                plaintext.close();
                plaintext = null;
            }
        }
        log.debug("Chat archive closed");
    }

    // -- peers --

    /**
     * Resolves a peer by id, caching the result. Unknown ids resolve to {@link Peer#EMPTY}.
     */
    public synchronized Peer peer(long peerId) {
        Peer cached = peerCache.get(peerId);
        if (cached != null) {
            return cached;
        }
        open();
        Peer peer = peers.findValue(peerId).map(PeerParser::parse).orElse(Peer.EMPTY);
        peerCache.put(peerId, peer);
        return peer;
    }

    /**
     * Chats ordered by their latest message, newest first.
     */
    public synchronized List<ChatSummary> recentChats(int limit) {
        open();
        Map<Long, Integer> latest = new LinkedHashMap<>();
        try (Stream<byte[]> keys = messages.streamKeys()) {
            keys.map(MessageKey::tryParse)
                    .flatMap(Optional::stream)
                    .forEach(key -> latest.merge(key.peerId(), key.timestamp(), Math::max));
        }

        return latest.entrySet().stream()
                .sorted(Map.Entry.<Long, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(Math.max(limit, 0))
                .map(e -> summary(e.getKey(), peer(e.getKey()), Instant.ofEpochSecond(e.getValue())))
                .collect(Collectors.toList());
    }

    /**
     * Peers whose name, username or phone contains {@code query} (case-insensitive),
     * or whose phone digits contain the digits of {@code query}. Table order.
     */
    public synchronized List<ChatSummary> findChats(String query) {
        Objects.requireNonNull(query, "query cannot be null");
        open();
        String needle = query.toLowerCase(Locale.ROOT);
        String needleDigits = Peer.digitsOf(query);

        List<ChatSummary> results = new ArrayList<>();
        try (Stream<PeerRow> rows = peers.streamAll()) {
            rows.forEach(row -> {
                Optional<Peer> parsed = PeerParser.tryParse(row.value());
                if (parsed.isEmpty()) {
                    return;
                }
                Peer peer = parsed.get();
                peerCache.put(row.peerId(), peer);
                String searchable = (peer.displayName() + " " + peer.username() + " " + peer.phone())
                        .toLowerCase(Locale.ROOT);
                boolean phoneMatch = !needleDigits.isEmpty() && peer.phoneDigits().contains(needleDigits);
                if (searchable.contains(needle) || phoneMatch) {
                    results.add(summary(row.peerId(), peer, null));
                }
            });
        }
        return results;
    }

    /**
     * First peer whose phone digits contain the digits of {@code phone}.
     */
    public synchronized Optional<Long> findPeerByPhone(String phone) {
        String digits = Peer.digitsOf(Objects.requireNonNull(phone, "phone cannot be null"));
        if (digits.isEmpty()) {
            return Optional.empty();
        }
        open();
        try (Stream<PeerRow> rows = peers.streamAll()) {
            Iterator<PeerRow> it = rows.iterator();
            while (it.hasNext()) {
                PeerRow row = it.next();
                Optional<Peer> parsed = PeerParser.tryParse(row.value());
                if (parsed.isEmpty()) {
                    continue;
                }
                peerCache.put(row.peerId(), parsed.get());
                String peerDigits = parsed.get().phoneDigits();
                if (!peerDigits.isEmpty() && peerDigits.contains(digits)) {
                    return Optional.of(row.peerId());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Turns a peer id, phone number or name into a peer id.
     *
     * <p>All-digit input above {@value #MIN_DIRECT_PEER_ID} is taken as a peer id
     * as-is, without touching the archive. Input containing digits is tried as a
     * phone number. Anything else, or a phone with no match, falls back to the
     * first {@link #findChats} match.
     */
    public synchronized Optional<Long> resolveIdentifier(String identifier) {
        String text = Objects.requireNonNull(identifier, "identifier cannot be null").strip();
        if (isAllDigits(text)) {
            try {
                long id = Long.parseLong(text);
                if (id > MIN_DIRECT_PEER_ID) {
                    return Optional.of(id);
                }
            } catch (NumberFormatException e) {
                log.debugf("'%s' does not fit a peer id, trying it as a phone number", text);
            }
        }
        if (containsDigit(text)) {
            Optional<Long> byPhone = findPeerByPhone(text);
            if (byPhone.isPresent()) {
                return byPhone;
            }
        }
        return findChats(text).stream().findFirst().map(ChatSummary::peerId);
    }

    // -- messages --

    /**
     * Newest messages of one chat. Up to {@code limit} rows are read; rows
     * without text are then dropped, so fewer may be returned.
     */
    public synchronized List<MessageRecord> readMessages(long peerId, int limit) {
        open();
        List<MessageRecord> result = new ArrayList<>();
        for (MessageRow row : messages.findByPeerPrefix(MessageKey.peerPrefix(peerId), limit)) {
            Optional<MessageKey> key = MessageKey.tryParse(row.key());
            if (key.isEmpty()) {
                continue;
            }
            Optional<MessageValue> value = parseValue(key.get(), row.value());
            if (value.isEmpty() || !value.get().hasText()) {
                continue;
            }
            MessageKey k = key.get();
            result.add(new MessageRecord(k.sentAt(), sender(k, value.get()), value.get().text(),
                    k.peerId(), k.messageId()));
        }
        return result;
    }

    /**
     * Messages containing {@code query} (case-insensitive) in descending key order,
     * stopping at {@code limit} hits.
     */
    public synchronized List<SearchHit> searchMessages(String query, int limit) {
        Objects.requireNonNull(query, "query cannot be null");
        open();
        String needle = query.toLowerCase(Locale.ROOT);
        List<SearchHit> hits = new ArrayList<>();
        try (Stream<MessageRow> rows = messages.streamNewestFirst()) {
            Iterator<MessageRow> it = rows.iterator();
            while (hits.size() < limit && it.hasNext()) {
                MessageRow row = it.next();
                Optional<MessageKey> key = MessageKey.tryParse(row.key());
                if (key.isEmpty()) {
                    continue;
                }
                Optional<MessageValue> value = parseValue(key.get(), row.value());
                if (value.isEmpty() || !value.get().hasText()
                        || !value.get().text().toLowerCase(Locale.ROOT).contains(needle)) {
                    continue;
                }
                MessageKey k = key.get();
                hits.add(new SearchHit(k.sentAt(), peer(k.peerId()).displayName(),
                        sender(k, value.get()), value.get().text(), k.peerId()));
            }
        }
        return hits;
    }

    /**
     * Every parsable message at or after {@code sinceEpochSeconds}, in key order
     * (grouped by chat, oldest first within a chat). Messages without text are kept.
     */
    public synchronized List<ExportedMessage> exportMessages(long sinceEpochSeconds) {
        open();
        List<ExportedMessage> exported = new ArrayList<>();
        try (Stream<MessageRow> rows = messages.streamOldestFirst()) {
            rows.forEach(row -> {
                Optional<MessageKey> key = MessageKey.tryParse(row.key());
                if (key.isEmpty() || key.get().timestamp() < sinceEpochSeconds) {
                    return;
                }
                MessageKey k = key.get();
                parseValue(k, row.value()).ifPresent(value -> exported.add(new ExportedMessage(
                        k.peerId(),
                        peer(k.peerId()).displayName(),
                        k.messageId(),
                        k.sentAt(),
                        value.text(),
                        !value.incoming(),
                        value.incoming() ? sender(k, value) : null)));
            });
        }
        return exported;
    }

    public synchronized ArchiveStats stats() {
        open();
        return new ArchiveStats(messages.count(), peers.count());
    }

    // -- internals --

    private Optional<MessageValue> parseValue(MessageKey key, byte[] value) {
        ParseResult<MessageValue> result = MessageValueParser.parse(value);
        if (result instanceof ParseResult.Unparsable<MessageValue> unparsable) {
            log.debugf("Skipping message %d/%d: %s", key.peerId(), key.messageId(), unparsable.reason());
            return Optional.empty();
        }
        return result.toOptional();
    }

    /**
     * "Me" for outgoing messages; otherwise the author, or the chat peer when the author is unset.
     */
    private String sender(MessageKey key, MessageValue value) {
        if (!value.incoming()) {
            return OUTGOING_SENDER;
        }
        Long author = value.authorId();
        long authorId = author != null && author != 0L ? author : key.peerId();
        return peer(authorId).displayName();
    }

    private static ChatSummary summary(long peerId, Peer peer, Instant lastMessageAt) {
        return new ChatSummary(peerId, peer.displayName(), peer.username(), peer.phone(), lastMessageAt);
    }

    private static boolean isAllDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static boolean containsDigit(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '0' && c <= '9') {
                return true;
            }
        }
        return false;
    }
}
