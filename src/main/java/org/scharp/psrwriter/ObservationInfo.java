///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

/**
 * The observation metadata written to a PSRFITS primary header, derived from a {@link UnifiedHeader} for one
 * conversion.
 * <p>
 * Instances of this class are immutable and are created by {@link ObservationInfoBuilder}.
 * </p>
 */
final class ObservationInfo {

    final String telescopeName;
    final double antennaX;
    final double antennaY;
    final double antennaZ;
    final double longitude;

    final double beamMajor;
    final double beamMinor;
    final double beamPositionAngle;

    final int nchans;
    final double fch1;
    final double channelBandwidth;
    final double observingFrequency;
    final double observingBandwidth;
    final double tsamp;

    final String sourceName;
    final String rightAscension;
    final String declination;
    final double rightAscensionDegrees;
    final double declinationDegrees;

    final String creationDate;
    final String observer;
    final String projectId;

    final double startMjd;
    final long startIntegerMjd;
    final long startSeconds;
    final double startSecondsOffset;
    final double startLst;
    final double scanLength;

    // The fields are grouped as they appear in the primary header.
    ObservationInfo(String telescopeName, double antennaX, double antennaY, double antennaZ, double longitude,
        double beamMajor, double beamMinor, double beamPositionAngle,
        int nchans, double fch1, double channelBandwidth, double observingFrequency, double observingBandwidth,
        double tsamp,
        String sourceName, String rightAscension, String declination, double rightAscensionDegrees,
        double declinationDegrees,
        String creationDate, String observer, String projectId,
        double startMjd, long startIntegerMjd, long startSeconds, double startSecondsOffset, double startLst,
        double scanLength) {
        this.telescopeName = telescopeName;
        this.antennaX = antennaX;
        this.antennaY = antennaY;
        this.antennaZ = antennaZ;
        this.longitude = longitude;
        this.beamMajor = beamMajor;
        this.beamMinor = beamMinor;
        this.beamPositionAngle = beamPositionAngle;
        this.nchans = nchans;
        this.fch1 = fch1;
        this.channelBandwidth = channelBandwidth;
        this.observingFrequency = observingFrequency;
        this.observingBandwidth = observingBandwidth;
        this.tsamp = tsamp;
        this.sourceName = sourceName;
        this.rightAscension = rightAscension;
        this.declination = declination;
        this.rightAscensionDegrees = rightAscensionDegrees;
        this.declinationDegrees = declinationDegrees;
        this.creationDate = creationDate;
        this.observer = observer;
        this.projectId = projectId;
        this.startMjd = startMjd;
        this.startIntegerMjd = startIntegerMjd;
        this.startSeconds = startSeconds;
        this.startSecondsOffset = startSecondsOffset;
        this.startLst = startLst;
        this.scanLength = scanLength;
    }

    /**
     * Gets the local sidereal time at a given offset from the start of the observation.
     *
     * @param secondsSinceStart
     *     The elapsed (solar) time in seconds.
     *
     * @return The local sidereal time in seconds, in {@code [0, 86400)}.
     */
    double lstAt(double secondsSinceStart) {
        return AstroUtil.localSiderealTime(startMjd + secondsSinceStart / AstroUtil.SECONDS_PER_DAY, longitude);
    }
}
