package org.scharp.psrwriter;

import nom.tam.fits.Header;
import nom.tam.fits.HeaderCardException;

/**
 * Builds the primary header of a PSRFITS search-mode file.  The primary HDU has no data; it describes the
 * observation as a whole.
 */
final class PsrfitsPrimaryHeader {

    /** The version of the PSRFITS definition that the written header follows. */
    static final String HEADER_VERSION = "6.1";

    private PsrfitsPrimaryHeader() {
    }

    /**
     * Builds the primary header.
     *
     * @param info
     *     The observation's metadata.
     *
     * @return The header, without its END card.
     *
     * @throws HeaderCardException
     *     if a value cannot be represented on a header card.
     */
    static Header build(ObservationInfo info) throws HeaderCardException {
        Header header = new Header();
        header.addValue("SIMPLE", true, "file does conform to FITS standard");
        header.addValue("BITPIX", 8, "number of bits per data pixel");
        header.addValue("NAXIS", 0, "number of data axes");
        header.addValue("EXTEND", true, "FITS dataset may contain extensions");
        header.insertComment("FITS (Flexible Image Transport System) format is defined in 'Astronomy");
        header.insertComment("and Astrophysics', volume 376, page 359; bibcode: 2001A&A...376..359H");
        header.addValue("HDRVER", HEADER_VERSION, "Header version");
        header.addValue("FITSTYPE", "PSRFITS", "FITS definition for pulsar data files");
        header.addValue("DATE", info.creationDate, "File creation date (YYYY-MM-DDThh:mm:ss UTC)");
        header.addValue("OBSERVER", info.observer, "Observer name(s)");
        header.addValue("PROJID", info.projectId, "Project name");

        // Telescope
        header.addValue("TELESCOP", FitsHeaderUtil.sanitize(info.telescopeName), "Telescope name");
        header.addValue("ANT_X", info.antennaX, "[m] Antenna ITRF X-coordinate (D)");
        header.addValue("ANT_Y", info.antennaY, "[m] Antenna ITRF Y-coordinate (D)");
        header.addValue("ANT_Z", info.antennaZ, "[m] Antenna ITRF Z-coordinate (D)");

        // Receiver and backend
        header.addValue("FRONTEND", "unknown", "Receiver ID");
        header.addValue("BACKEND", "unknown", "Backend ID");
        header.addValue("NRCVR", 1, "Number of receiver polarisation channels");
        header.addValue("FD_POLN", "LIN", "LIN or CIRC");
        header.addValue("FD_HAND", 1, "+/- 1. +1 is LIN:A=X,B=Y, CIRC:A=L,B=R (I)");
        header.addValue("FD_SANG", 0.0, "[deg] FA of E vect for equal sig in A&B (E)");
        header.addValue("FD_XYPH", 0.0, "[deg] Phase of A^* B for injected cal (E)");
        header.addValue("BE_PHASE", 0, "0/+1/-1 BE cross-phase: 0 unknown, +/-1 std/rev");
        header.addValue("BE_DCC", 0, "0/1 BE downconversion conjugation corrected");
        header.addValue("BE_DELAY", 0.0, "[s] Backend propn delay from digitiser input");
        header.addValue("TCYCLE", 0.0, "[s] On-line cycle time (D)");

        // Observation
        header.addValue("OBS_MODE", "SEARCH", "(PSR, CAL, SEARCH)");
        header.addValue("OBSFREQ", info.observingFrequency, "[MHz] Centre frequency for observation");
        header.addValue("OBSBW", info.observingBandwidth, "[MHz] Bandwidth for observation");
        header.addValue("OBSNCHAN", info.nchans, "Number of frequency channels (original)");
        header.addValue("CHAN_DM", 0.0, "[cm-3 pc] DM used for on-line dedispersion");

        // Source
        header.addValue("SRC_NAME", FitsHeaderUtil.sanitize(info.sourceName), "Source or scan ID");
        header.addValue("COORD_MD", "J2000", "Coordinate mode (J2000, GALACTIC, ECLIPTIC)");
        header.addValue("EQUINOX", 2000.0, "Equinox of coords (e.g. 2000.0)");
        header.addValue("RA", info.rightAscension, "Right ascension (hh:mm:ss.ssss)");
        header.addValue("DEC", info.declination, "Declination (-dd:mm:ss.sss)");
        header.addValue("BMAJ", info.beamMajor, "[deg] Beam major axis length");
        header.addValue("BMIN", info.beamMinor, "[deg] Beam minor axis length");
        header.addValue("BPA", info.beamPositionAngle, "[deg] Beam position angle");
        header.addValue("STT_CRD1", info.rightAscension, "Start coord 1 (hh:mm:ss.sss or ddd.ddd)");
        header.addValue("STT_CRD2", info.declination, "Start coord 2 (-dd:mm:ss.sss or -dd.ddd)");
        header.addValue("TRK_MODE", "TRACK", "Track mode (TRACK, SCANGC, SCANLAT)");
        header.addValue("STP_CRD1", info.rightAscension, "Stop coord 1 (hh:mm:ss.sss or ddd.ddd)");
        header.addValue("STP_CRD2", info.declination, "Stop coord 2 (-dd:mm:ss.sss or -dd.ddd)");
        header.addValue("SCANLEN", info.scanLength, "[s] Requested scan length (E)");
        header.addValue("FD_MODE", "FA", "Feed track mode - FA, CPA, SPA, TPA");
        header.addValue("FA_REQ", 0.0, "[deg] Feed/Posn angle requested (E)");

        // Calibration
        header.addValue("CAL_MODE", "OFF", "Cal mode (OFF, SYNC, EXT1, EXT2)");
        header.addValue("CAL_FREQ", 0.0, "[Hz] Cal modulation frequency (E)");
        header.addValue("CAL_DCYC", 0.0, "Cal duty cycle (E)");
        header.addValue("CAL_PHS", 0.0, "Cal phase (wrt start time) (E)");

        // Start time
        header.addValue("STT_IMJD", info.startIntegerMjd, "Start MJD (UTC days) (J - long integer)");
        header.addValue("STT_SMJD", info.startSeconds, "[s] Start time (sec past UTC 00h) (J)");
        header.addValue("STT_OFFS", info.startSecondsOffset, "[s] Start time offset (D)");
        header.addValue("STT_LST", info.startLst, "[s] Start LST (D)");
        return header;
    }
}
