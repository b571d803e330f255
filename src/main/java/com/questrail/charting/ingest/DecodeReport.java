package com.questrail.charting.ingest;

import com.questrail.charting.notation.model.ShotSequence;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a bulk decode. Both lists keep the order of the input rows.
 */
public record DecodeReport(List<ShotSequence> decoded, List<RejectedPoint> rejected)
{
    public DecodeReport
    {
        decoded = List.copyOf(Objects.requireNonNull(decoded, "decoded"));
        rejected = List.copyOf(Objects.requireNonNull(rejected, "rejected"));
    }

    public int total()
    {
        return decoded.size() + rejected.size();
    }

    public boolean hasRejections()
    {
        return !rejected.isEmpty();
    }
}
