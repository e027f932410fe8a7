package romantools;

import java.util.Objects;

/**
 * Processing flags shared by every action.
 *
 * <ul>
 *   <li>{@code crumbs}: emit a step-by-step trace of segmentation and conversion.</li>
 *   <li>{@code errorSkip}: tolerate invalid words and keep non-letter text instead of failing the unit.</li>
 *   <li>{@code errorReport}: collect diagnostics for {@link RoManTools#getLastErrors()}.</li>
 * </ul>
 *
 * <p>Instances are immutable; the {@code withX} methods return modified copies.</p>
 */
public final class RoManConfig {
    private static final RoManConfig DEFAULTS = new RoManConfig(false, false, false);

    private final boolean crumbs;
    private final boolean errorSkip;
    private final boolean errorReport;

    private RoManConfig(boolean crumbs, boolean errorSkip, boolean errorReport) {
        this.crumbs = crumbs;
        this.errorSkip = errorSkip;
        this.errorReport = errorReport;
    }

    /**
     * All flags off.
     */
    public static RoManConfig defaults() {
        return DEFAULTS;
    }

    public static RoManConfig of(boolean crumbs, boolean errorSkip, boolean errorReport) {
        return new RoManConfig(crumbs, errorSkip, errorReport);
    }

    public boolean isCrumbs() {
        return crumbs;
    }

    public boolean isErrorSkip() {
        return errorSkip;
    }

    public boolean isErrorReport() {
        return errorReport;
    }

    public RoManConfig withCrumbs(boolean value) {
        return new RoManConfig(value, errorSkip, errorReport);
    }

    public RoManConfig withErrorSkip(boolean value) {
        return new RoManConfig(crumbs, value, errorReport);
    }

    public RoManConfig withErrorReport(boolean value) {
        return new RoManConfig(crumbs, errorSkip, value);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RoManConfig)) return false;
        RoManConfig c = (RoManConfig) o;
        return c.crumbs == crumbs && c.errorSkip == errorSkip && c.errorReport == errorReport;
    }

    @Override
    public int hashCode() {
        return Objects.hash(crumbs, errorSkip, errorReport);
    }

    @Override
    public String toString() {
        return "RoManConfig{crumbs=" + crumbs + ", errorSkip=" + errorSkip + ", errorReport=" + errorReport + "}";
    }
}
