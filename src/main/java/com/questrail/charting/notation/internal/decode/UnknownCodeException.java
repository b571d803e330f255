package com.questrail.charting.notation.internal.decode;

/**
 * A character or token does not belong to the charting vocabulary at the
 * position where it was found.
 */
public final class UnknownCodeException extends ChartingDecodeException
{
    public UnknownCodeException(String reason, String offendingCode, String fullCode)
    {
        super(reason, offendingCode, fullCode);
    }
}
