///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import java.util.Objects;

/**
 * An observatory's identity and location.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class Telescope {

    /** The SIGPROC telescope identifier for an unknown ("fake") telescope. */
    public static final int UNKNOWN_SIGPROC_ID = 0;

    private final String name;
    private final int sigprocId;
    private final double itrfX;
    private final double itrfY;
    private final double itrfZ;

    /**
     * Creates a new telescope.
     *
     * @param name
     *     The telescope name as it should appear in a PSRFITS TELESCOP card.
     * @param sigprocId
     *     The SIGPROC {@code telescope_id}.
     * @param itrfX
     *     The ITRF X coordinate of the antenna in meters.
     * @param itrfY
     *     The ITRF Y coordinate of the antenna in meters.
     * @param itrfZ
     *     The ITRF Z coordinate of the antenna in meters.
     *
     * @throws NullPointerException
     *     if {@code name} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code name} is not printable ASCII of at most 68 characters, if {@code sigprocId} is negative, or if a
     *     coordinate is not finite.
     */
    public Telescope(String name, int sigprocId, double itrfX, double itrfY, double itrfZ) {
        ArgumentUtil.checkNotNull(name, "name");
        ArgumentUtil.checkFitsString(name, FitsHeaderUtil.MAX_STRING_LENGTH, "name");
        ArgumentUtil.checkNotNegative(sigprocId, "sigprocId");
        ArgumentUtil.checkFinite(itrfX, "itrfX");
        ArgumentUtil.checkFinite(itrfY, "itrfY");
        ArgumentUtil.checkFinite(itrfZ, "itrfZ");

        this.name = name;
        this.sigprocId = sigprocId;
        this.itrfX = itrfX;
        this.itrfY = itrfY;
        this.itrfZ = itrfZ;
    }

    public String name() {
        return name;
    }

    public int sigprocId() {
        return sigprocId;
    }

    public double itrfX() {
        return itrfX;
    }

    public double itrfY() {
        return itrfY;
    }

    public double itrfZ() {
        return itrfZ;
    }

    /**
     * Gets the geographic (east) longitude of the antenna.
     *
     * @return The longitude in degrees, in the range (-180, 180].
     */
    public double longitude() {
        return Math.toDegrees(Math.atan2(itrfY, itrfX));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Telescope)) {
            return false;
        }
        Telescope that = (Telescope) other;
        return sigprocId == that.sigprocId &&
            Double.compare(itrfX, that.itrfX) == 0 &&
            Double.compare(itrfY, that.itrfY) == 0 &&
            Double.compare(itrfZ, that.itrfZ) == 0 &&
            name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sigprocId, itrfX, itrfY, itrfZ);
    }

    @Override
    public String toString() {
        return "Telescope[" + name + ", id=" + sigprocId + "]";
    }
}
