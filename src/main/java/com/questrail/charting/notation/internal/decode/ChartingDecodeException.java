package com.questrail.charting.notation.internal.decode;

import java.util.Objects;

/**
 * Indicates that a charting code could not be translated into a valid
 * {@link com.questrail.charting.notation.model.ShotSequence}.
 *
 * <p>Failures are local to one point. Callers decoding many points are expected
 * to catch this exception per point and continue with the next one.</p>
 *
 * Concrete kinds:
 * <ul>
 *   <li>{@link UnknownCodeException} – a character or token outside the vocabulary</li>
 *   <li>{@link MalformedSequenceException} – known characters in an illegal arrangement</li>
 *   <li>{@link MissingServeException} – a serve code required by the point is absent</li>
 * </ul>
 */
public abstract class ChartingDecodeException extends RuntimeException
{
    private final String offendingCode;
    private final String fullCode;

    protected ChartingDecodeException(String reason, String offendingCode, String fullCode)
    {
        super(reason + " (offending: '" + offendingCode + "', code: '" + fullCode + "')");
        this.offendingCode = Objects.requireNonNullElse(offendingCode, "");
        this.fullCode = Objects.requireNonNullElse(fullCode, "");
    }

    /**
     * @return the character, token or substring that could not be decoded
     */
    public String offendingCode()
    {
        return offendingCode;
    }

    /**
     * @return the complete code the offending part was taken from
     */
    public String fullCode()
    {
        return fullCode;
    }
}
