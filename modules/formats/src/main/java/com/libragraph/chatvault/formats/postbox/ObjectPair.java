package com.libragraph.chatvault.formats.postbox;

/**
 * One key/value entry of an ObjectDictionary field. Both sides are kept as raw objects.
 */
public record ObjectPair(TaggedObject key, TaggedObject value) {
}
