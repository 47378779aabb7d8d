package com.agrichain.offchain.domain.model.stage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/** Absent JSON arrays bind as empty lists. */
final class Lists {
    private Lists() {}

    static <T> List<T> orEmpty(List<T> in) {
        return in == null ? List.of() : copy(in);
    }

    /** Unmodifiable copy that keeps null elements so validation can report them. */
    static <T> List<T> copy(List<T> in) {
        return Collections.unmodifiableList(new ArrayList<>(in));
    }
}
