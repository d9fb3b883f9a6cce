/**
 * Low-level helpers shared by the format decoders and the store:
 * a bounds-checked {@link com.libragraph.chatvault.util.ByteReader} and the
 * {@link com.libragraph.chatvault.util.KeyMaterial} value type.
 */
package com.libragraph.chatvault.util;
