///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.psrwriter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.format.DateTimeFormatter;

/**
 * Derives the PSRFITS observation metadata from a source header and a window.
 */
final class ObservationInfoBuilder {

    private static final Logger LOG = LogManager.getLogger(ObservationInfoBuilder.class);

    private static final DateTimeFormatter FITS_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    // private constructor to prevent anyone from instantiating the class.
    private ObservationInfoBuilder() {
    }

    /**
     * Builds the observation metadata.
     *
     * @param header
     *     The source's header.
     * @param window
     *     The window that is being written.
     * @param config
     *     The conversion's configuration.
     *
     * @return The metadata.
     */
    static ObservationInfo build(UnifiedHeader header, Window window, WriterConfig config) {
        final Telescope telescope = config.telescopeRegistry().find(header.telescope());
        final String telescopeName;
        final double antennaX;
        final double antennaY;
        final double antennaZ;
        final double longitude;
        if (telescope != null) {
            telescopeName = telescope.name();
            antennaX = telescope.itrfX();
            antennaY = telescope.itrfY();
            antennaZ = telescope.itrfZ();
            longitude = telescope.longitude();
        } else {
            LOG.warn("Unknown telescope '{}'; antenna position and sidereal time are written for longitude 0",
                header.telescope());
            telescopeName = header.telescope().isBlank() ? "unknown" : header.telescope();
            antennaX = 0;
            antennaY = 0;
            antennaZ = 0;
            longitude = 0;
        }

        // Frequencies of the selected channels.
        final int nchans = window.nchans();
        final double foff = header.foff();
        final double fch1 = header.fch1() + window.channelMin() * foff;
        final double observingBandwidth = nchans * foff;
        final double observingFrequency = fch1 + foff * (nchans - 1) / 2;

        // The window's first spectrum sets the start time.  The day is split off before the fraction is scaled to
        // seconds; scaling the whole MJD first loses the sub-second part to rounding.
        final double tsamp = header.tsamp();
        final double startMjd = header.tstart() + window.start() * tsamp / AstroUtil.SECONDS_PER_DAY;
        final long integerMjd = AstroUtil.integerDay(startMjd);
        final double secondsOfDay = AstroUtil.secondsOfDay(startMjd);
        final long wholeSeconds = (long) Math.floor(secondsOfDay);
        final double secondsOffset = secondsOfDay - wholeSeconds;

        final double lst = AstroUtil.localSiderealTime(startMjd, longitude);

        return new ObservationInfo(
            telescopeName, antennaX, antennaY, antennaZ, longitude,
            0, 0, 0, // beam size is unknown
            nchans, fch1, foff, observingFrequency, observingBandwidth, tsamp,
            header.sourceName(),
            AstroUtil.formatRightAscension(header.rightAscension()),
            AstroUtil.formatDeclination(header.declination()),
            header.rightAscension(),
            header.declination(),
            config.creationTime().format(FITS_DATE_FORMAT),
            config.observer(),
            config.projectId(),
            startMjd, integerMjd, wholeSeconds, secondsOffset, lst,
            window.count() * tsamp);
    }
}
