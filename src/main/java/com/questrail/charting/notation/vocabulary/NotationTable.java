package com.questrail.charting.notation.vocabulary;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * NotationTable
 * -----------------------------------------------------------------------------
 * Builds the character lookup used by every vocabulary enum.
 *
 * <p>Each vocabulary axis maps single notation characters to exactly one
 * constant. A table in which two constants claim the same character is a
 * programming error in the vocabulary itself; it is reported when the enum
 * class initializes so that a broken table can never decode anything.</p>
 */
final class NotationTable
{
    private NotationTable() {}

    static <E extends Enum<E>> Map<Character, E> index(E[] values, Function<E, Character> codeOf)
    {
        Map<Character, E> table = new HashMap<>();
        for (E value : values) {
            Character code = codeOf.apply(value);
            if (code == null) {
                continue;
            }
            E previous = table.putIfAbsent(code, value);
            if (previous != null) {
                throw new IllegalStateException(
                        "Notation character '" + code + "' claimed by both "
                                + previous + " and " + value);
            }
        }
        return Collections.unmodifiableMap(table);
    }
}
