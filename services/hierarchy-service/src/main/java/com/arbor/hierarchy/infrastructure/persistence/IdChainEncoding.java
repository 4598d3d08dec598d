package com.arbor.hierarchy.infrastructure.persistence;

import java.util.Arrays;
import java.util.List;

/**
 * Column encoding of an id chain: {@code /id1/id2/.../idN/}.
 * <p>
 * The leading and trailing slashes make every id a delimited token, so "under X" is a prefix match
 * on X's chain and "contains X" is an infix match on {@code /X/}, without false hits on ids that
 * share a prefix.
 */
public final class IdChainEncoding {

    private IdChainEncoding() {
        // utility class
    }

    public static String encode(List<String> ids) {
        if (ids.isEmpty()) {
            return "/";
        }
        return "/" + String.join("/", ids) + "/";
    }

    public static List<String> decode(String encoded) {
        if (encoded == null || encoded.length() <= 1) {
            return List.of();
        }
        return Arrays.asList(encoded.substring(1, encoded.length() - 1).split("/"));
    }

    /** Escapes {@code %}, {@code _} and the escape character itself for {@code LIKE ... ESCAPE '\'}. */
    public static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
