package com.questrail.charting.notation.internal.decode;

/**
 * The code is made of known characters arranged in a way the notation does
 * not allow, for example a terminal marker in the middle of a rally or a
 * second serve after a first serve that landed in.
 */
public final class MalformedSequenceException extends ChartingDecodeException
{
    public MalformedSequenceException(String reason, String offendingCode, String fullCode)
    {
        super(reason, offendingCode, fullCode);
    }
}
