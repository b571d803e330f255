package com.questrail.charting.notation.internal.decode;

/**
 * A serve code the point requires is missing or blank.
 */
public final class MissingServeException extends ChartingDecodeException
{
    public MissingServeException(String reason, String fullCode)
    {
        super(reason, "", fullCode);
    }
}
