package com.questrail.charting.notation.internal.decode;

import com.questrail.charting.notation.vocabulary.ShotType;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * ShotTokenizer
 * -----------------------------------------------------------------------------
 * Splits a rally code into shot tokens, front to back.
 *
 * <p>A token is one shot-type letter followed by every character up to, but
 * excluding, the next shot-type letter. Because no modifier shares a letter
 * with a shot type, this split needs no lookahead beyond one character.</p>
 *
 * <p>The tokenizer is single-use. Every character belongs to exactly one
 * token, so iteration ends only once the whole code has been consumed; a
 * character that cannot start a token fails {@link #next()} instead.</p>
 */
final class ShotTokenizer implements Iterator<String>
{
    private final String code;
    private final String fullCode;
    private int position;

    ShotTokenizer(String code, String fullCode)
    {
        this.code = code;
        this.fullCode = fullCode;
    }

    @Override
    public boolean hasNext()
    {
        return position < code.length();
    }

    /**
     * @throws UnknownCodeException if the remaining code does not start with a
     *         shot-type letter
     */
    @Override
    public String next()
    {
        if (!hasNext()) {
            throw new NoSuchElementException("Rally code exhausted");
        }

        final int start = position;
        if (!ShotType.isShotCode(code.charAt(start))) {
            throw new UnknownCodeException(
                    "Rally shot must begin with a shot-type letter",
                    code.substring(start), fullCode);
        }

        int end = start + 1;
        while (end < code.length() && !ShotType.isShotCode(code.charAt(end))) {
            end++;
        }

        position = end;
        return code.substring(start, end);
    }
}
