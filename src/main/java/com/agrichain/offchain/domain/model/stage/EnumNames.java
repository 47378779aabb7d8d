package com.agrichain.offchain.domain.model.stage;

import java.util.Locale;


/** snake_case on the wire, PascalCase in hash inputs. */
final class EnumNames {
    private EnumNames() {}

    static String snake(Enum<?> e) {
        return e.name().toLowerCase(Locale.ROOT);
    }

    static String pascal(Enum<?> e) {
        StringBuilder sb = new StringBuilder(e.name().length());
        boolean upper = true;
        for (char c : e.name().toCharArray()) {
            if (c == '_') {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : Character.toLowerCase(c));
            upper = false;
        }
        return sb.toString();
    }

    static <E extends Enum<E>> E parse(Class<E> type, String value) {
        if (value == null) {
            return null;
        }
        for (E e : type.getEnumConstants()) {
            if (snake(e).equals(value)) {
                return e;
            }
        }
        throw new IllegalArgumentException("unknown " + type.getSimpleName() + ": " + value);
    }
}
