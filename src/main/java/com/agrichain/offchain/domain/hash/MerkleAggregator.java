package com.agrichain.offchain.domain.hash;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;


/**
 * Order-sensitive merkle root over caller-supplied leaf strings.
 *
 * <p>Adjacent leaves are combined left to right by hashing the concatenation
 * of their string forms with {@link Hasher#generalHash(String)}.  A trailing
 * odd element at any level is paired with itself.  Leaves are not sorted, so
 * swapping two distinct leaves changes the root.
 *
 * <ul>
 *   <li>{@code root([])} is {@link #EMPTY_ROOT}</li>
 *   <li>{@code root([x])} is {@code x}, unhashed</li>
 *   <li>{@code root([a,b,c])} is {@code H(H(a+b) + H(c+c))}</li>
 * </ul>
 */
public final class MerkleAggregator {

    /** Root of an empty leaf list. */
    public static final String EMPTY_ROOT = Hasher.generalHash("empty").value();

    private MerkleAggregator() {}

    public static String root(List<String> leaves) {
        Objects.requireNonNull(leaves, "leaves");
        if (leaves.isEmpty()) {
            return EMPTY_ROOT;
        }
        if (leaves.size() == 1) {
            return Objects.requireNonNull(leaves.get(0), "leaf 0");
        }
        List<String> level = new ArrayList<>(leaves);
        while (level.size() > 1) {
            List<String> next = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                String left = level.get(i);
                String right = i + 1 < level.size() ? level.get(i + 1) : left;
                next.add(Hasher.generalHash(left + right).value());
            }
            level = next;
        }
        return level.get(0);
    }
}
