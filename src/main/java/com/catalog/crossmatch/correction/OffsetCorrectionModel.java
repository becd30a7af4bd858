package com.catalog.crossmatch.correction;

import com.catalog.crossmatch.core.model.SkyPosition;
import com.catalog.crossmatch.core.model.SourceRecord;
import com.catalog.crossmatch.surface.ConstantSurface;
import com.catalog.crossmatch.surface.SurfaceModel;

import java.util.List;

/**
 * Displacement field (target minus reference) over original target position.
 * Correcting a position subtracts the modelled displacement.
 */
public final class OffsetCorrectionModel {

    public static final OffsetCorrectionModel IDENTITY =
            new OffsetCorrectionModel(ConstantSurface.ZERO, ConstantSurface.ZERO, 0);

    private final SurfaceModel raOffset;
    private final SurfaceModel decOffset;
    private final int matchCount;

    OffsetCorrectionModel(SurfaceModel raOffset, SurfaceModel decOffset, int matchCount) {
        this.raOffset = raOffset;
        this.decOffset = decOffset;
        this.matchCount = matchCount;
    }

    /**
     * Number of accepted matches the model was fitted on.
     */
    public int getMatchCount() {
        return matchCount;
    }

    public SurfaceModel getRaOffset() {
        return raOffset;
    }

    public SurfaceModel getDecOffset() {
        return decOffset;
    }

    public double raOffsetAt(SkyPosition original) {
        return raOffset.evaluate(original);
    }

    public double decOffsetAt(SkyPosition original) {
        return decOffset.evaluate(original);
    }

    public SkyPosition correct(SkyPosition original) {
        return original.shiftedBy(-raOffset.evaluate(original), -decOffset.evaluate(original));
    }

    /**
     * Corrected positions for the given sources, computed from each source's original position.
     */
    public List<SkyPosition> correctAll(List<SourceRecord> originals) {
        return originals.stream().map(s -> correct(s.position())).toList();
    }

    @Override
    public String toString() {
        return "OffsetCorrectionModel{ra=" + raOffset.getName() + ", dec=" + decOffset.getName()
                + ", matches=" + matchCount + '}';
    }
}
