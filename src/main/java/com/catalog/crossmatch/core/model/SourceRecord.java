package com.catalog.crossmatch.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * One source of a target or reference catalogue in canonical form.
 * Optional fields are zero when the input did not provide them.
 */
public final class SourceRecord {
    private final String uuid;
    private final double ra;
    private final double dec;
    private final double errRa;
    private final double errDec;
    private final double psfA;
    private final double psfB;
    private final double a;
    private final double b;
    private final double pa;
    private final double peakFlux;
    private final double errPeakFlux;
    private final double intFlux;
    private final double localRms;

    private SourceRecord(Builder builder) {
        this.uuid = builder.uuid != null ? builder.uuid : UUID.randomUUID().toString();
        this.ra = builder.ra;
        this.dec = builder.dec;
        this.errRa = builder.errRa;
        this.errDec = builder.errDec;
        this.psfA = builder.psfA;
        this.psfB = builder.psfB;
        this.a = builder.a;
        this.b = builder.b;
        this.pa = builder.pa;
        this.peakFlux = builder.peakFlux;
        this.errPeakFlux = builder.errPeakFlux;
        this.intFlux = builder.intFlux;
        this.localRms = builder.localRms;
    }

    public String getUuid() { return uuid; }
    public double getRa() { return ra; }
    public double getDec() { return dec; }
    public double getErrRa() { return errRa; }
    public double getErrDec() { return errDec; }
    public double getPsfA() { return psfA; }
    public double getPsfB() { return psfB; }
    public double getA() { return a; }
    public double getB() { return b; }
    public double getPa() { return pa; }
    public double getPeakFlux() { return peakFlux; }
    public double getErrPeakFlux() { return errPeakFlux; }
    public double getIntFlux() { return intFlux; }
    public double getLocalRms() { return localRms; }

    public SkyPosition position() {
        return new SkyPosition(ra, dec);
    }

    /**
     * Returns the numeric value of a canonical field.
     *
     * @throws IllegalArgumentException for {@link CanonicalField#UUID}
     */
    public double get(CanonicalField field) {
        return switch (field) {
            case RA -> ra;
            case DEC -> dec;
            case ERR_RA -> errRa;
            case ERR_DEC -> errDec;
            case PSF_A -> psfA;
            case PSF_B -> psfB;
            case A -> a;
            case B -> b;
            case PA -> pa;
            case PEAK_FLUX -> peakFlux;
            case ERR_PEAK_FLUX -> errPeakFlux;
            case INT_FLUX -> intFlux;
            case LOCAL_RMS -> localRms;
            case UUID -> throw new IllegalArgumentException("uuid is not a numeric field");
        };
    }

    /**
     * Returns a copy placed at another position; every other field is kept.
     */
    public SourceRecord withPosition(SkyPosition position) {
        return builder(this).ra(position.ra()).dec(position.dec()).build();
    }

    /**
     * Returns a copy with peak flux, its error and integrated flux multiplied by {@code factor}.
     */
    public SourceRecord withFluxScale(double factor) {
        return builder(this)
                .peakFlux(peakFlux * factor)
                .errPeakFlux(errPeakFlux * factor)
                .intFlux(intFlux * factor)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceRecord that = (SourceRecord) o;
        return Objects.equals(uuid, that.uuid)
                && Double.compare(ra, that.ra) == 0
                && Double.compare(dec, that.dec) == 0
                && Double.compare(peakFlux, that.peakFlux) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, ra, dec, peakFlux);
    }

    @Override
    public String toString() {
        return "SourceRecord{" +
                "uuid='" + uuid + '\'' +
                ", ra=" + ra +
                ", dec=" + dec +
                ", peakFlux=" + peakFlux +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(SourceRecord source) {
        return new Builder()
                .uuid(source.uuid)
                .ra(source.ra)
                .dec(source.dec)
                .errRa(source.errRa)
                .errDec(source.errDec)
                .psfA(source.psfA)
                .psfB(source.psfB)
                .a(source.a)
                .b(source.b)
                .pa(source.pa)
                .peakFlux(source.peakFlux)
                .errPeakFlux(source.errPeakFlux)
                .intFlux(source.intFlux)
                .localRms(source.localRms);
    }

    public static class Builder {
        private String uuid;
        private double ra = Double.NaN;
        private double dec = Double.NaN;
        private double errRa;
        private double errDec;
        private double psfA;
        private double psfB;
        private double a;
        private double b;
        private double pa;
        private double peakFlux = Double.NaN;
        private double errPeakFlux;
        private double intFlux;
        private double localRms;

        public Builder uuid(String uuid) { this.uuid = uuid; return this; }
        public Builder ra(double ra) { this.ra = ra; return this; }
        public Builder dec(double dec) { this.dec = dec; return this; }
        public Builder errRa(double errRa) { this.errRa = errRa; return this; }
        public Builder errDec(double errDec) { this.errDec = errDec; return this; }
        public Builder psfA(double psfA) { this.psfA = psfA; return this; }
        public Builder psfB(double psfB) { this.psfB = psfB; return this; }
        public Builder a(double a) { this.a = a; return this; }
        public Builder b(double b) { this.b = b; return this; }
        public Builder pa(double pa) { this.pa = pa; return this; }
        public Builder peakFlux(double peakFlux) { this.peakFlux = peakFlux; return this; }
        public Builder errPeakFlux(double errPeakFlux) { this.errPeakFlux = errPeakFlux; return this; }
        public Builder intFlux(double intFlux) { this.intFlux = intFlux; return this; }
        public Builder localRms(double localRms) { this.localRms = localRms; return this; }

        /**
         * Sets a numeric canonical field by name.
         */
        public Builder set(CanonicalField field, double value) {
            switch (field) {
                case RA -> ra = value;
                case DEC -> dec = value;
                case ERR_RA -> errRa = value;
                case ERR_DEC -> errDec = value;
                case PSF_A -> psfA = value;
                case PSF_B -> psfB = value;
                case A -> a = value;
                case B -> b = value;
                case PA -> pa = value;
                case PEAK_FLUX -> peakFlux = value;
                case ERR_PEAK_FLUX -> errPeakFlux = value;
                case INT_FLUX -> intFlux = value;
                case LOCAL_RMS -> localRms = value;
                case UUID -> throw new IllegalArgumentException("uuid is not a numeric field");
            }
            return this;
        }

        public SourceRecord build() {
            if (!Double.isFinite(ra) || !Double.isFinite(dec)) {
                throw new IllegalArgumentException("ra and dec are required and must be finite");
            }
            if (dec < -90.0 || dec > 90.0) {
                throw new IllegalArgumentException("dec must be between -90 and 90, got " + dec);
            }
            if (!Double.isFinite(peakFlux)) {
                throw new IllegalArgumentException("peakFlux is required and must be finite");
            }
            return new SourceRecord(this);
        }
    }
}
