package com.libragraph.chatvault.formats.peer;

import com.libragraph.chatvault.formats.postbox.TaggedObject;
import com.libragraph.chatvault.formats.postbox.TaggedStream;
import com.libragraph.chatvault.formats.postbox.TaggedValue;
import com.libragraph.chatvault.types.ValueType;

import java.util.Map;
import java.util.Optional;

/**
 * Parses the value blob of a peer-table row.
 *
 * <p>The blob is a tagged stream whose root object sits under key {@code "_"};
 * the peer fields live in that object's nested stream under short keys
 * ({@code fn}, {@code ln}, {@code un}, {@code t}, {@code p}).
 */
public final class PeerParser {
    public static final String ROOT_KEY = "_";

    static final String FIRST_NAME = "fn";
    static final String LAST_NAME = "ln";
    static final String USERNAME = "un";
    static final String TITLE = "t";
    static final String PHONE = "p";

    // key + tag + type hash + length of an empty root object
    private static final int MIN_ROOTED_LENGTH = 8;

    private PeerParser() {
    }

    /**
     * Returns the peer, or {@link Peer#EMPTY} when the blob has no root object.
     */
    public static Peer parse(byte[] value) {
        return tryParse(value).orElse(Peer.EMPTY);
    }

    /**
     * Returns the peer, or empty when the blob has no root object.
     */
    public static Optional<Peer> tryParse(byte[] value) {
        if (value == null || value.length < MIN_ROOTED_LENGTH) {
            return Optional.empty();
        }
        return new TaggedStream(value).object(ROOT_KEY).map(PeerParser::fromRoot);
    }

    private static Peer fromRoot(TaggedObject root) {
        Map<String, TaggedValue> fields = root.stream().decodeAll();
        return new Peer(
                stringField(fields, FIRST_NAME),
                stringField(fields, LAST_NAME),
                stringField(fields, USERNAME),
                stringField(fields, TITLE),
                stringField(fields, PHONE)
        );
    }

    private static String stringField(Map<String, TaggedValue> fields, String key) {
        TaggedValue value = fields.get(key);
        if (value == null || !value.is(ValueType.STRING)) {
            return "";
        }
        return value.asString();
    }
}
